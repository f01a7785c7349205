package com.adlanda.resumetailor.model;

import jakarta.validation.constraints.NotBlank;

public record StatusUpdateRequest(
        @NotBlank(message = "Status is required")
        String status,

        String notes
) {}
