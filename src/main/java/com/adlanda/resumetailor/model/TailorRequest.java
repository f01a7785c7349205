package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Request body for tailoring a resume. Every field is optional.
 *
 * @param experienceTypes Wire values such as "work" or "project"
 */
public record TailorRequest(
        @Min(1) @Max(50)
        Integer maxBullets,

        @Min(1) @Max(20)
        Integer maxBulletsPerExperience,

        List<String> experienceTypes,
        List<String> highlightSkills,
        String style
) {}
