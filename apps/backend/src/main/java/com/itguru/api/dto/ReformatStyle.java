package com.itguru.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ReformatStyle {
    DEFINITION("a concise definition followed by key characteristics and real-world applications"),
    STEP_BY_STEP("numbered steps with clear instructions and any prerequisites"),
    TROUBLESHOOT("common causes first, then systematic troubleshooting steps"),
    COMPARISON("a structured comparison (a table where it helps) highlighting key differences and use cases");

    private final String instruction;

    ReformatStyle(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }

    /** Accepts {@code step-by-step}, {@code step_by_step}, {@code STEP BY STEP} and so on. */
    @JsonCreator
    public static ReformatStyle parse(String raw) {
        if (raw == null) return null;
        String norm = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("TROUBLESHOOTING".equals(norm)) return TROUBLESHOOT;
        return valueOf(norm);
    }
}
