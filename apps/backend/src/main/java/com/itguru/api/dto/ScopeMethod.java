package com.itguru.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScopeMethod {
    KEYWORD("keyword"),
    LLM("llm"),
    DEFAULT_ALLOW("default-allow");

    private final String label;

    ScopeMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
