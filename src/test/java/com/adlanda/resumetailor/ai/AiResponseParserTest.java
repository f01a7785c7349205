package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiResponseParserTest {

    private final AiResponseParser parser = new AiResponseParser(new ObjectMapper());

    @Test
    void parse_jobAnalysisWithExtraFields_ignoresUnknownAndNormalizes() {
        String raw = """
                Here is the analysis:
                ```json
                {
                  "title": "Senior Go Engineer",
                  "company": null,
                  "required_skills": ["Go", "Kubernetes", "PostgreSQL"],
                  "keywords": ["distributed systems"],
                  "seniority_level": "senior",
                  "years_experience": 5,
                  "confidence": 0.9
                }
                ```
                """;

        JobAnalysis analysis = parser.parse("analyze job", raw, AiPayloads.JobAnalysisPayload.class).toJobAnalysis();

        assertThat(analysis.title()).isEqualTo("Senior Go Engineer");
        assertThat(analysis.company()).isEmpty();
        assertThat(analysis.requiredSkills()).containsExactly("Go", "Kubernetes", "PostgreSQL");
        assertThat(analysis.preferredSkills()).isEmpty();
        assertThat(analysis.yearsExperience()).isEqualTo(5);
        assertThat(analysis.targetTerms()).containsExactly("Go", "Kubernetes", "PostgreSQL", "distributed systems");
    }

    @Test
    void parse_scoreOutOfRange_isMalformed() {
        assertThatThrownBy(() -> parser.parse("score match", "{\"score\": 140}", AiPayloads.ScorePayload.class))
                .isInstanceOf(MalformedAiResponseException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void parse_missingRequiredField_isMalformed() {
        assertThatThrownBy(() -> parser.parse("tailor bullet", "{\"keywords\": [\"Go\"]}",
                AiPayloads.TailoredBulletPayload.class))
                .isInstanceOf(MalformedAiResponseException.class)
                .hasMessageContaining("tailored_content");
    }

    @Test
    void parse_truncatedJson_isMalformed() {
        assertThatThrownBy(() -> parser.parse("select bullets", "{\"selected_bullet_ids\": [\"a\", }",
                AiPayloads.BulletSelectionPayload.class))
                .isInstanceOf(MalformedAiResponseException.class);
    }

    @Test
    void parse_lastFenceIsProse_usesOuterObject() {
        String raw = "{\"summary\": \"Go engineer with 8 years of experience.\"}\n```\nHope this helps!\n```";

        AiPayloads.SummaryPayload payload = parser.parse("generate summary", raw, AiPayloads.SummaryPayload.class);

        assertThat(payload.summary()).isEqualTo("Go engineer with 8 years of experience.");
    }
}
