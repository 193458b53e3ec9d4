package com.itguru.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Either a pre-rendered {@code history} summary or the raw {@code messages};
 * the raw transcript is summarized when {@code history} is blank.
 */
public record ChatRequest(
        String sessionId,
        @NotBlank String query,
        String history,
        List<HistoryMessage> messages
) {}
