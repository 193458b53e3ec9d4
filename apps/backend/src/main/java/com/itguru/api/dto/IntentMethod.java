package com.itguru.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentMethod {
    LLM_CLASSIFICATION("llm-classification"),
    PATTERN_FALLBACK("pattern-fallback"),
    SCOPE_GUARD("scope-guard"),
    /** Context fetch exceeded its budget; the answer proceeds without sources. */
    TIMEOUT_MINIMAL("timeout_minimal");

    private final String label;

    IntentMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
