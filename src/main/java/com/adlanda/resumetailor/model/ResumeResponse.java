package com.adlanda.resumetailor.model;

import java.time.Instant;
import java.util.List;

public record ResumeResponse(
        String id,
        String jobTitle,
        String companyName,
        String jobUrl,
        String jobDescription,
        String targetLanguage,
        ResumeStatus status,
        int score,
        List<String> selectedBullets,
        ResumeContent content,
        String notes,
        Instant createdAt,
        Instant updatedAt
) {
    public static ResumeResponse from(Resume resume) {
        return new ResumeResponse(
                resume.getId(),
                resume.getJobTitle(),
                resume.getCompanyName(),
                resume.getJobUrl(),
                resume.getJobDescription(),
                resume.getTargetLanguage(),
                resume.getStatus(),
                resume.getScore().value(),
                resume.getSelectedBullets(),
                resume.getGeneratedContent(),
                resume.getNotes(),
                resume.getCreatedAt(),
                resume.getUpdatedAt()
        );
    }
}
