package com.adlanda.resumetailor.ai;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured view of a job description, derived on every run and never stored on its own.
 *
 * @param title           Extracted job title
 * @param company         Company name, empty when not found
 * @param requiredSkills  Skills the posting requires
 * @param preferredSkills Nice-to-have skills
 * @param keywords        Important keywords from the description
 * @param seniorityLevel  junior, mid, senior, lead or executive
 * @param yearsExperience Required years of experience, null when not stated
 * @param summary         Two or three sentence summary of the role
 */
public record JobAnalysis(
        String title,
        String company,
        List<String> requiredSkills,
        List<String> preferredSkills,
        List<String> keywords,
        String seniorityLevel,
        Integer yearsExperience,
        String summary
) {
    public JobAnalysis {
        title = title == null ? "" : title;
        company = company == null ? "" : company;
        requiredSkills = copy(requiredSkills);
        preferredSkills = copy(preferredSkills);
        keywords = copy(keywords);
        seniorityLevel = seniorityLevel == null ? "" : seniorityLevel;
        summary = summary == null ? "" : summary;
    }

    /**
     * Required skills followed by keywords, without duplicates.
     */
    public List<String> targetTerms() {
        List<String> terms = new ArrayList<>(requiredSkills);
        for (String keyword : keywords) {
            if (terms.stream().noneMatch(t -> t.equalsIgnoreCase(keyword))) {
                terms.add(keyword);
            }
        }
        return terms;
    }

    private static List<String> copy(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
    }
}
