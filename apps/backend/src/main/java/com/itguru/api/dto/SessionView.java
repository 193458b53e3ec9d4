package com.itguru.api.dto;

import java.util.List;

public record SessionView(
        String sessionId,
        String selectedModel,
        IntentExplanation lastIntent,
        List<SourceResult> lastSources,
        String lastSourcesMarkdown,
        List<String> followups,
        List<String> errors
) {}
