package com.itguru.api.dto;

import java.util.List;

public record InjectionCheck(boolean detected, List<String> matchedPatternIds) {

    public static InjectionCheck clean() {
        return new InjectionCheck(false, List.of());
    }
}
