package com.itguru.sources.exa;

import com.itguru.ai.CompletionGateway;
import com.itguru.ai.CompletionRequest;
import com.itguru.config.AiProperties;
import com.itguru.service.support.KeywordMatcher;
import com.itguru.sources.SourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Rewrites a query for web search: a keyword template for simple queries, a
 * completion-backed rewrite for complex ones (falling back to the template).
 */
@Slf4j
@Component
public class QueryEnhancer {

    private static final KeywordMatcher COMPLEX_WORDS = KeywordMatcher.of(
            "best", "compare", "difference", "how", "why", "when", "latest", "new", "emerging");

    private static final Map<String, String> TEMPLATE_SUFFIX = Map.of(
            "cybersecurity", "cybersecurity security threat vulnerability attack",
            "cloud_devops", "cloud devops infrastructure deployment automation",
            "programming", "programming development code software framework",
            "business_tech", "technology business industry trends innovation",
            "research_academic", "research study analysis methodology findings",
            DomainCatalog.IT_GENERAL, "IT technology infrastructure systems network");

    static final String ENHANCE_PROMPT = """
            You are a search optimization expert. Given a user query and category, generate the most \
            effective search keywords to find relevant, current information.

            User Query: "%s"
            Category: %s

            Rules:
            1. Keep the original query intact
            2. Add 3-5 highly relevant keywords that will improve search results
            3. Focus on technical terms, industry jargon, and specific concepts
            4. Consider current trends and terminology
            5. Return only the enhanced query, no explanation

            Enhanced Query:""";

    private final CompletionGateway gateway;
    private final AiProperties ai;

    public QueryEnhancer(CompletionGateway gateway, AiProperties ai) {
        this.gateway = gateway;
        this.ai = ai;
    }

    /** More than six words, a question mark, or comparison/recency wording. */
    public boolean isComplex(String query) {
        if (query == null) return false;
        String q = query.strip();
        return q.split("\\s+").length > 6 || q.contains("?") || COMPLEX_WORDS.matchesAny(q);
    }

    public String template(String query, String category) {
        String suffix = TEMPLATE_SUFFIX.get(category);
        return suffix == null ? query + " technology" : query + " " + suffix;
    }

    /** Uses the model found under {@link SourceClient#MODEL_CONTEXT_KEY}, else the default one. */
    public Mono<String> enhance(String query, String category) {
        return Mono.deferContextual(ctx -> enhance(query, category, ctx.<String>getOrDefault(SourceClient.MODEL_CONTEXT_KEY, null)));
    }

    public Mono<String> enhance(String query, String category, String model) {
        String fallback = template(query, category);
        if (!isComplex(query) || !gateway.isConfigured()) {
            return Mono.just(fallback);
        }
        AiProperties.Budget budget = ai.getEnhancement();
        return gateway.call(CompletionRequest.singleUser(
                        String.format(ENHANCE_PROMPT, query, category), model, budget.getMaxTokens(), budget.getTemperature()))
                .timeout(budget.getTimeout())
                .map(QueryEnhancer::clean)
                .filter(StringUtils::hasText)
                .doOnNext(q -> log.debug("[exa] enhanced query: {}", q))
                .defaultIfEmpty(fallback)
                .onErrorResume(e -> {
                    log.warn("[exa] query enhancement failed, using template: {}", e.toString());
                    return Mono.just(fallback);
                });
    }

    private static String clean(String raw) {
        String s = raw == null ? "" : raw.strip();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1).strip();
        }
        return s;
    }
}
