package com.adlanda.resumetailor.model;

import java.util.List;

/**
 * The assembled output of one tailoring run.
 *
 * @param summary     Professional summary written for the job
 * @param experiences Tailored experiences in display order
 * @param skills      Flat skill list surfaced on the resume
 * @param analysis    Keyword coverage, may be null
 */
public record ResumeContent(
        String summary,
        List<TailoredExperience> experiences,
        List<String> skills,
        ResumeAnalysis analysis
) {
    public ResumeContent {
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public List<TailoredBullet> allBullets() {
        return experiences.stream()
                .flatMap(e -> e.bullets().stream())
                .toList();
    }

    public ResumeContent withAnalysis(ResumeAnalysis analysis) {
        return new ResumeContent(summary, experiences, skills, analysis);
    }
}
