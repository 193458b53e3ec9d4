package com.itguru.api.dto;

import java.util.List;

/**
 * Aggregated routing outcome for one query. {@code multiSource} is always false:
 * dispatch goes to a single source.
 */
public record EnhancedContext(
        Intent intent,
        List<SourceResult> results,
        String contextText,
        boolean multiSource
) {
    public EnhancedContext {
        results = results == null ? List.of() : List.copyOf(results);
        contextText = contextText == null ? "" : contextText;
    }

    public static EnhancedContext refusal(Intent intent, String refusalMessage) {
        return new EnhancedContext(intent, List.of(), refusalMessage, false);
    }

    public static EnhancedContext minimal() {
        return new EnhancedContext(Intent.timeoutMinimal(), List.of(), "", false);
    }
}
