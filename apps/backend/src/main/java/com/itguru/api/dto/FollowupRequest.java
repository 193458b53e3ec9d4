package com.itguru.api.dto;

import jakarta.validation.constraints.NotBlank;

public record FollowupRequest(
        String sessionId,
        @NotBlank String query,
        @NotBlank String answer,
        String context
) {}
