package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Request body for creating or updating a bullet. On update, null fields are left alone.
 */
public record BulletRequest(
        String content,

        @Min(0) @Max(100)
        Integer impactScore,

        List<String> keywords,
        Integer displayOrder
) {}
