package com.itguru.api.dto;

public record Intent(
        Route route,
        double confidence,
        IntentMethod method,
        String reasoning
) {
    public static Intent outOfScope(ScopeVerdict verdict) {
        return new Intent(Route.OUT_OF_SCOPE, verdict.confidence(), IntentMethod.SCOPE_GUARD, verdict.reasoning());
    }

    /** Placeholder used when the context stage timed out. */
    public static Intent timeoutMinimal() {
        return new Intent(Route.GENERAL_KNOWLEDGE, 0.0, IntentMethod.TIMEOUT_MINIMAL,
                "Context fetch timed out, answering without external sources");
    }

    public boolean isOutOfScope() {
        return route == Route.OUT_OF_SCOPE;
    }
}
