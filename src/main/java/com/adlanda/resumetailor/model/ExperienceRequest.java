package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for adding an experience.
 *
 * @param startDate YYYY-MM-DD
 * @param endDate   YYYY-MM-DD, omitted while ongoing
 */
public record ExperienceRequest(
        @NotBlank(message = "Type is required")
        String type,

        @NotBlank(message = "Title is required")
        String title,

        @NotBlank(message = "Organization is required")
        String organization,

        String location,
        String description,
        String url,

        @NotBlank(message = "Start date is required")
        String startDate,

        String endDate,
        boolean current,
        Integer displayOrder
) {}
