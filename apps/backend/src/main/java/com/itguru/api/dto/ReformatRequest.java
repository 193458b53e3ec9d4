package com.itguru.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ReformatRequest(
        String sessionId,
        @NotBlank String answer,
        @NotNull ReformatStyle style,
        String context
) {}
