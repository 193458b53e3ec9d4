package com.itguru.api.dto;

public record ChatResponse(
        String sessionId,
        String answer,
        String sourcesMarkdown,
        IntentExplanation intent
) {}
