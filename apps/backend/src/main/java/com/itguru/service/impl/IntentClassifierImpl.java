package com.itguru.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itguru.ai.CompletionGateway;
import com.itguru.ai.CompletionRequest;
import com.itguru.api.dto.Intent;
import com.itguru.api.dto.IntentMethod;
import com.itguru.api.dto.Route;
import com.itguru.config.AiProperties;
import com.itguru.service.IntentClassifier;
import com.itguru.service.SecurityGuard;
import com.itguru.service.support.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClassifierImpl implements IntentClassifier {

    private static final int GREETING_MAX_CHARS = 50;

    private static final KeywordMatcher GREETINGS = KeywordMatcher.of(
            "hello", "hi", "hey", "good morning", "good afternoon", "good evening",
            "how are you", "what can you do", "help", "thanks", "thank you");
    private static final KeywordMatcher AWS_TERMS = KeywordMatcher.of(
            "aws", "amazon", "ec2", "s3", "lambda", "cloudformation");
    private static final KeywordMatcher MICROSOFT_TERMS = KeywordMatcher.of(
            "microsoft", "azure", "office", "windows", "powershell", "active directory", "entra", "intune");

    static final String CLASSIFICATION_PROMPT = """
            You are an expert IT query classifier. Analyze this query and determine the best source.

            Categories:
            1. **aws_docs**: AWS, Amazon Web Services, EC2, S3, Lambda, CloudFormation, VPC, IAM, RDS
            2. **microsoft_learn**: Microsoft, Azure, Office 365, Windows, PowerShell, Active Directory, Teams, SharePoint, Exchange
            3. **web_search**: Technical queries needing current information, vulnerabilities, troubleshooting, comparisons
            4. **general**: Simple greetings, conversational queries, basic questions that don't need external sources

            Query: "%s"

            Consider:
            - Keywords and context
            - Whether information needs to be current/real-time
            - Specific vendor/platform mentioned
            - Type of information requested

            Respond with JSON only:
            {
                "source": "category_name",
                "confidence": 0.95,
                "reasoning": "detailed explanation of classification decision"
            }
            """;

    private final SecurityGuard securityGuard;
    private final CompletionGateway gateway;
    private final AiProperties ai;
    private final ObjectMapper mapper;

    @Override
    public Mono<Intent> classify(String query, String model) {
        return securityGuard.evaluateScope(query)
                .flatMap(verdict -> {
                    if (!verdict.inScope()) {
                        log.info("[intent] out of scope ({}): {}", verdict.method().label(), verdict.reasoning());
                        return Mono.just(Intent.outOfScope(verdict));
                    }
                    if (!gateway.isConfigured()) {
                        return Mono.just(fallback(query));
                    }
                    return classifyRemotely(query, model);
                })
                .doOnNext(intent -> log.debug("[intent] {} via {} ({})",
                        intent.route().wireName(), intent.method().label(), intent.confidence()));
    }

    private Mono<Intent> classifyRemotely(String query, String model) {
        AiProperties.Budget budget = ai.getClassification();
        CompletionRequest request = CompletionRequest.singleUser(
                CLASSIFICATION_PROMPT.replace("%s", query), model, budget.getMaxTokens(), budget.getTemperature());

        return gateway.call(request)
                .timeout(budget.getTimeout())
                .mapNotNull(reply -> parse(reply).orElse(null))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("[intent] unusable classification reply, using keyword rules");
                    return fallback(query);
                }))
                .onErrorResume(e -> {
                    log.warn("[intent] classification call failed, using keyword rules: {}", e.toString());
                    return Mono.just(fallback(query));
                });
    }

    Optional<Intent> parse(String raw) {
        String json = stripFences(raw);
        if (json.isEmpty()) return Optional.empty();
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (Exception e) {
            log.debug("[intent] reply is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
        Optional<Route> route = Route.fromLabel(node.path("source").asText(null));
        if (route.isEmpty()) return Optional.empty();

        JsonNode c = node.get("confidence");
        double confidence = c != null && c.isNumber() ? clamp(c.asDouble()) : 0.5;
        String reasoning = node.path("reasoning").asText("");
        if (!StringUtils.hasText(reasoning)) reasoning = "No reasoning provided";
        return Optional.of(new Intent(route.get(), confidence, IntentMethod.LLM_CLASSIFICATION, reasoning));
    }

    @Override
    public Intent fallback(String query) {
        String q = query == null ? "" : query.strip();
        if (q.length() < GREETING_MAX_CHARS && GREETINGS.matchesAny(q)) {
            return new Intent(Route.GENERAL_KNOWLEDGE, 0.9, IntentMethod.PATTERN_FALLBACK,
                    "Simple greeting or conversational query, no external sources needed");
        }
        if (AWS_TERMS.matchesAny(q)) {
            return new Intent(Route.AWS_DOCS, 0.7, IntentMethod.PATTERN_FALLBACK, "AWS-related query detected");
        }
        if (MICROSOFT_TERMS.matchesAny(q)) {
            return new Intent(Route.MICROSOFT_LEARN, 0.7, IntentMethod.PATTERN_FALLBACK, "Microsoft-related query detected");
        }
        return new Intent(Route.WEB_SEARCH, 0.6, IntentMethod.PATTERN_FALLBACK, "General IT query, using real-time search");
    }

    /** Drops markdown code fences and any prose around the JSON object. */
    static String stripFences(String raw) {
        if (raw == null) return "";
        String s = raw.strip();
        int start = s.indexOf('{');
        int end = s.lastIndexOf('}');
        if (start < 0 || end <= start) return "";
        return s.substring(start, end + 1);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.5;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
