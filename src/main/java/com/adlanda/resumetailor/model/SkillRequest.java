package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record SkillRequest(
        @NotBlank(message = "Name is required")
        String name,

        String category,

        @Min(0) @Max(100)
        Integer proficiency,

        Double yearsOfExperience,
        boolean highlighted
) {}
