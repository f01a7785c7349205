package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for creating a resume. Only the job description is required.
 *
 * @param targetLanguage "en" or "pt-br"; falls back to the user's preferred language
 */
public record CreateResumeRequest(
        @NotBlank(message = "Job description is required")
        String jobDescription,

        String jobTitle,
        String companyName,
        String jobUrl,
        String targetLanguage
) {}
