package com.itguru.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Endpoints, keys and limits of the three knowledge sources.
 */
@Data
@ConfigurationProperties(prefix = "itguru.sources")
public class SourceProperties {

    private int maxResults = 3;
    /** Per-call network budget for every source request. */
    private Duration timeout = Duration.ofSeconds(4);

    private Aws aws = new Aws();
    private Microsoft microsoft = new Microsoft();
    private Exa exa = new Exa();
    private Allowlist allowlist = new Allowlist();

    @Data
    public static class Aws {
        private String endpoint = "https://knowledge-mcp.global.api.aws";
        /** Optional keyword-search endpoint used when the tool path yields nothing. */
        private String searchUrl;
    }

    @Data
    public static class Microsoft {
        private String endpoint = "https://learn.microsoft.com/api/mcp";
        private String searchUrl = "https://learn.microsoft.com/api/search";
        private String locale = "en-us";
    }

    @Data
    public static class Exa {
        private String endpoint = "https://api.exa.ai/search";
        private String apiKey;
        /** Overrides the shared result count when set. */
        private Integer maxResults;
        private String startDate = "2024-01-01";
        /** Rolling recency window; wins over {@link #startDate} when positive. */
        private int startDays = 0;
        private String domainsResource = "classpath:exa-domains.json";

        public boolean hasApiKey() {
            return StringUtils.hasText(apiKey);
        }
    }

    @Data
    public static class Allowlist {
        private boolean enforce = false;
        private List<String> domains = new ArrayList<>(List.of(
                "learn.microsoft.com", "microsoft.com", "docs.aws.amazon.com", "aws.amazon.com",
                "azure.microsoft.com", "cloud.google.com", "kubernetes.io", "iana.org",
                "developer.mozilla.org"));
    }
}
