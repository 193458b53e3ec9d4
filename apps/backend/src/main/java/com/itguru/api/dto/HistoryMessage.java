package com.itguru.api.dto;

/** role: "user" | "assistant" */
public record HistoryMessage(String role, String content) {}
