package com.itguru.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Downstream knowledge source chosen for a query, or none.
 */
public enum Route {
    AWS_DOCS("aws_docs", "aws_mcp", "aws"),
    MICROSOFT_LEARN("microsoft_learn", "microsoft", "ms_learn"),
    WEB_SEARCH("web_search", "exa_search", "exa"),
    GENERAL_KNOWLEDGE("general", "ai_general", "general_knowledge"),
    OUT_OF_SCOPE("out_of_scope");

    private final String wireName;
    private final String[] aliases;

    Route(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Resolves a classifier label; out-of-scope is never accepted from the model. */
    public static Optional<Route> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String norm = label.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Route r : values()) {
            if (r == OUT_OF_SCOPE) continue;
            if (r.wireName.equals(norm)) return Optional.of(r);
            for (String a : r.aliases) {
                if (a.equals(norm)) return Optional.of(r);
            }
        }
        return Optional.empty();
    }
}
