package com.itguru.api.dto;

import java.util.Locale;

/**
 * Side-channel view of the last routing decision, rendered for display.
 */
public record IntentExplanation(
        String method,
        double confidence,
        String source,
        String reasoning,
        boolean multiSource,
        String summary
) {
    public static IntentExplanation of(EnhancedContext ctx) {
        Intent intent = ctx.intent();
        return new IntentExplanation(
                intent.method().label(),
                intent.confidence(),
                intent.route().wireName(),
                intent.reasoning(),
                ctx.multiSource(),
                summarize(intent));
    }

    static String summarize(Intent intent) {
        String pct = String.format(Locale.ROOT, "%.1f%%", intent.confidence() * 100);
        return switch (intent.method()) {
            case LLM_CLASSIFICATION -> "AI classified with " + pct + " confidence: " + intent.reasoning();
            case PATTERN_FALLBACK -> "Pattern matching with " + pct + " confidence: " + intent.reasoning();
            default -> "Method: " + intent.method().label() + ", confidence: " + pct;
        };
    }
}
