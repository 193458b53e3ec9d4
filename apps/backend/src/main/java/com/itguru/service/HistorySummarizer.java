package com.itguru.service;

import com.itguru.api.dto.HistoryMessage;
import com.itguru.config.AnswerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compresses a transcript into the bounded history block placed in the prompt:
 * the most recent messages, each cut to a fixed number of characters.
 */
@Component
public class HistorySummarizer {

    private final AnswerProperties.History limits;

    public HistorySummarizer(AnswerProperties props) {
        this.limits = props.getHistory();
    }

    public String summarize(List<HistoryMessage> messages) {
        if (messages == null || messages.isEmpty()) return "";
        int from = Math.max(0, messages.size() - limits.getMaxMessages());
        List<String> parts = new ArrayList<>();
        for (HistoryMessage m : messages.subList(from, messages.size())) {
            String role = "user".equalsIgnoreCase(m.role()) ? "Human" : "Assistant";
            String content = m.content() == null ? "" : m.content();
            if (content.length() > limits.getMaxChars()) content = content.substring(0, limits.getMaxChars());
            parts.add(role + ": " + content + "...");
        }
        return String.join("\n", parts);
    }
}
