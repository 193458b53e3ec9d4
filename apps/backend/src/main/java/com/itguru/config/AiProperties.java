package com.itguru.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Completion endpoint settings (OpenAI-compatible, OpenRouter by default).
 *
 * <p>The same endpoint serves answer generation, intent classification, the
 * ambiguous-scope check, query enhancement, follow-ups and reformatting; each
 * of those calls carries its own token and temperature budget.</p>
 */
@Data
@ConfigurationProperties(prefix = "itguru.ai")
public class AiProperties {

    private String baseUrl = "https://openrouter.ai/api";
    private String apiKey;
    private String model = "meta-llama/llama-3.1-8b-instruct:free";

    private int maxTokens = 4000;
    private double temperature = 0.7;

    /** Routing headers sent with every completion call. */
    private String referer = "https://github.com/it-guru/it-guru-assistant";
    private String title = "IT-Guru Assistant";

    /** Must stay below {@code itguru.answer.context-timeout} so the keyword fallback can still route. */
    private Budget classification = new Budget(200, 0.1, Duration.ofSeconds(3));
    /** Runs inside the web-search source timeout. */
    private Budget enhancement = new Budget(100, 0.3, Duration.ofSeconds(2));
    private Budget followups = new Budget(150, 0.5, Duration.ofSeconds(15));
    private Budget reformat = new Budget(1500, 0.3, Duration.ofSeconds(60));

    public boolean hasApiKey() {
        return StringUtils.hasText(apiKey);
    }

    @Data
    public static class Budget {
        private int maxTokens;
        private double temperature;
        private Duration timeout;

        public Budget() {
        }

        public Budget(int maxTokens, double temperature, Duration timeout) {
            this.maxTokens = maxTokens;
            this.temperature = temperature;
            this.timeout = timeout;
        }
    }
}
