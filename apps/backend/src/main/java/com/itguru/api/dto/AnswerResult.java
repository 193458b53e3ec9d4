package com.itguru.api.dto;

public record AnswerResult(String answer, String sourcesMarkdown) {}
