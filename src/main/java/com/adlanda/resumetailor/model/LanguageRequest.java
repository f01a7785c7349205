package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param proficiency basic, intermediate, advanced, fluent or native
 */
public record LanguageRequest(
        @NotBlank(message = "Language is required")
        String language,

        @NotBlank(message = "Proficiency is required")
        String proficiency
) {}
