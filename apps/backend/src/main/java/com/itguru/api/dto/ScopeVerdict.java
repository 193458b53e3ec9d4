package com.itguru.api.dto;

/**
 * Topic-scope decision for one query. Confidence is in [0, 1].
 */
public record ScopeVerdict(
        boolean inScope,
        ScopeMethod method,
        double confidence,
        String reasoning
) {
    public static ScopeVerdict allow(ScopeMethod method, double confidence, String reasoning) {
        return new ScopeVerdict(true, method, confidence, reasoning);
    }

    public static ScopeVerdict refuse(ScopeMethod method, double confidence, String reasoning) {
        return new ScopeVerdict(false, method, confidence, reasoning);
    }
}
