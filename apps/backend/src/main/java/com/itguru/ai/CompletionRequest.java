package com.itguru.ai;

import java.util.List;

/**
 * Message list plus per-call overrides. A null model, token budget or temperature
 * keeps the gateway defaults.
 */
public record CompletionRequest(
        List<ChatTurn> messages,
        String model,
        Integer maxTokens,
        Double temperature
) {
    public CompletionRequest {
        messages = List.copyOf(messages);
    }

    public static CompletionRequest of(List<ChatTurn> messages, String model, int maxTokens, double temperature) {
        return new CompletionRequest(messages, model, maxTokens, temperature);
    }

    public static CompletionRequest singleUser(String prompt, String model, int maxTokens, double temperature) {
        return new CompletionRequest(List.of(ChatTurn.user(prompt)), model, maxTokens, temperature);
    }
}
