package com.itguru.api.dto;

public record ReformatResponse(String sessionId, ReformatStyle style, String answer) {}
