package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Wire shapes the backend is asked to answer with.
 *
 * Each payload checks its own required fields; the provider maps validated
 * payloads onto the port's result types.
 */
public final class AiPayloads {

    private AiPayloads() {
    }

    public interface Payload {
        /**
         * @throws MalformedAiResponseException when a required field is missing or out of range
         */
        void validate();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobAnalysisPayload(
            @JsonProperty("title") String title,
            @JsonProperty("company") String company,
            @JsonProperty("required_skills") List<String> requiredSkills,
            @JsonProperty("preferred_skills") List<String> preferredSkills,
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("seniority_level") String seniorityLevel,
            @JsonProperty("years_experience") Integer yearsExperience,
            @JsonProperty("summary") String summary
    ) implements Payload {

        @Override
        public void validate() {
            if (requiredSkills == null && keywords == null && (title == null || title.isBlank())) {
                throw new MalformedAiResponseException("job analysis has no title, skills or keywords");
            }
            if (yearsExperience != null && yearsExperience < 0) {
                throw new MalformedAiResponseException("job analysis has negative years of experience");
            }
        }

        JobAnalysis toJobAnalysis() {
            return new JobAnalysis(title, company, requiredSkills, preferredSkills, keywords,
                    seniorityLevel, yearsExperience, summary);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BulletSelectionPayload(
            @JsonProperty("selected_bullet_ids") List<String> selectedBulletIds,
            @JsonProperty("reasoning") String reasoning
    ) implements Payload {

        @Override
        public void validate() {
            if (selectedBulletIds == null) {
                throw new MalformedAiResponseException("bullet selection has no selected_bullet_ids");
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TailoredBulletPayload(
            @JsonProperty("tailored_content") String tailoredContent,
            @JsonProperty("keywords") List<String> keywords
    ) implements Payload {

        @Override
        public void validate() {
            if (tailoredContent == null || tailoredContent.isBlank()) {
                throw new MalformedAiResponseException("tailored bullet has no tailored_content");
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SummaryPayload(@JsonProperty("summary") String summary) implements Payload {

        @Override
        public void validate() {
            if (summary == null || summary.isBlank()) {
                throw new MalformedAiResponseException("summary response has no summary");
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScorePayload(
            @JsonProperty("score") Integer score,
            @JsonProperty("breakdown") Map<String, Number> breakdown,
            @JsonProperty("explanation") String explanation
    ) implements Payload {

        @Override
        public void validate() {
            if (score == null) {
                throw new MalformedAiResponseException("match score response has no score");
            }
            if (score < 0 || score > 100) {
                throw new MalformedAiResponseException("match score out of range: " + score);
            }
        }
    }
}
