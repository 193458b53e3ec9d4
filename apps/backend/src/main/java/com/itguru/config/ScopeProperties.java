package com.itguru.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Topic-scope policy: toggles, refusal text and the three keyword lexicons.
 */
@Data
@ConfigurationProperties(prefix = "itguru.scope")
public class ScopeProperties {

    public static final String DEFAULT_REFUSAL =
            "Sorry, I’m focused on IT infrastructure, cybersecurity, cloud, DevOps, and IT careers. "
                    + "Please rephrase your question within this scope.";

    private boolean enforce = true;
    private boolean allowCareerTopics = true;
    private String refusalMessage = DEFAULT_REFUSAL;

    private LlmCheck llmCheck = new LlmCheck();

    private List<String> nonItPatterns = new ArrayList<>(List.of(
            "relationship", "dating", "marriage", "breakup", "love",
            "diet", "nutrition", "weight loss", "fitness", "workout",
            "mental health", "therapy", "depression", "anxiety",
            "finance", "stock market", "stock trading", "cryptocurrency", "crypto trading", "crypto wallet",
            "investment", "tax", "budget",
            "politics", "election", "public policy", "foreign policy", "economic policy",
            "religion", "spiritual", "astrology", "horoscope",
            "parenting", "pregnancy", "baby", "children",
            "travel", "vacation", "tourism", "itinerary",
            "sports", "football", "soccer", "basketball",
            "cooking", "recipe", "food", "restaurant", "pizza", "topping", "dessert",
            "celebrity", "gossip", "entertainment", "movie", "music"));

    private List<String> careerWhitelist = new ArrayList<>(List.of(
            "resume", "cv", "interview", "career", "study path", "roadmap",
            "certification", "certifications", "soc analyst", "sre career",
            "devops upskilling", "job market", "portfolio", "linkedin"));

    private List<String> itAnchors = new ArrayList<>(List.of(
            "firewall", "vpn", "router", "switch", "ips", "ids", "siem", "xdr", "edr", "soar", "endpoint",
            "malware", "cve", "vulnerability", "exploit", "threat", "tls", "ssl", "certificate", "certificates", "ssh",
            "linux", "windows", "active directory", "group policy", "gpo", "powershell",
            "azure", "aws", "gcp", "kubernetes", "docker", "terraform", "ansible", "devops", "sre",
            "fortinet", "cisco", "palo alto", "okta", "cloudflare", "nginx", "istio", "gitlab", "github",
            "s3", "ec2", "vpc"));

    @Data
    public static class LlmCheck {
        /** Ask the completion endpoint when a query hits both a non-IT term and an IT anchor. */
        private boolean enabled = false;
        /** Falls back to {@code itguru.ai.model} when blank. */
        private String model;
        private int maxTokens = 5;
    }
}
