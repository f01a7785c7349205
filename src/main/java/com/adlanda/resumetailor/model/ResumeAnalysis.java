package com.adlanda.resumetailor.model;

import java.util.List;

/**
 * Keyword coverage of a tailored resume against the analyzed job.
 */
public record ResumeAnalysis(
        List<String> matchedKeywords,
        List<String> missingKeywords,
        List<String> recommendations,
        List<String> strengthAreas,
        List<String> improvementAreas
) {
    public ResumeAnalysis {
        matchedKeywords = copy(matchedKeywords);
        missingKeywords = copy(missingKeywords);
        recommendations = copy(recommendations);
        strengthAreas = copy(strengthAreas);
        improvementAreas = copy(improvementAreas);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
