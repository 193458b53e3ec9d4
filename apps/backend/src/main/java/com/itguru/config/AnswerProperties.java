package com.itguru.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "itguru.answer")
public class AnswerProperties {

    /** Budget for scope check, classification and source dispatch together. */
    private Duration contextTimeout = Duration.ofSeconds(8);

    private History history = new History();

    @Data
    public static class History {
        private int maxMessages = 6;
        private int maxChars = 200;
    }
}
