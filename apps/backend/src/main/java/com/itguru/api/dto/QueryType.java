package com.itguru.api.dto;

/** Coarse answer shape, selects the format suffix of the system prompt. */
public enum QueryType {
    DEFINITION("\n\nFormat: Provide a clear definition followed by key characteristics and real-world applications."),
    STEP_BY_STEP("\n\nFormat: Provide numbered steps with clear instructions and any prerequisites."),
    TROUBLESHOOTING("\n\nFormat: Start with common causes, then provide systematic troubleshooting steps."),
    COMPARISON("\n\nFormat: Create a structured comparison highlighting key differences and use cases."),
    GENERAL("\n\nFormat: Provide comprehensive information with practical examples.");

    private final String formatSuffix;

    QueryType(String formatSuffix) {
        this.formatSuffix = formatSuffix;
    }

    public String formatSuffix() {
        return formatSuffix;
    }
}
