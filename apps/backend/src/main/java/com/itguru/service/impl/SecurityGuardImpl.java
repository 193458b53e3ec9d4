package com.itguru.service.impl;

import com.itguru.ai.CompletionGateway;
import com.itguru.ai.CompletionRequest;
import com.itguru.api.dto.InjectionCheck;
import com.itguru.api.dto.ScopeMethod;
import com.itguru.api.dto.ScopeVerdict;
import com.itguru.config.AiProperties;
import com.itguru.config.ScopeProperties;
import com.itguru.service.SecurityGuard;
import com.itguru.service.support.KeywordMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class SecurityGuardImpl implements SecurityGuard {

    private static final List<InjectionPattern> INJECTION_PATTERNS = List.of(
            new InjectionPattern("instruction-override",
                    Pattern.compile("ignore (the |all )?(previous|above|prior) (instructions|rules)", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("prompt-disregard",
                    Pattern.compile("disregard (the )?(system|previous) (prompt|instructions)", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("prompt-reveal",
                    Pattern.compile("reveal (the |your )?(system|hidden) (prompt|instructions)", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("secret-print",
                    Pattern.compile("print (environment|api|secret|token)", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("exfiltration",
                    Pattern.compile("exfiltrat(e|ion)|leak (data|key|secret)", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("out-of-bounds-action",
                    Pattern.compile("perform actions outside|execute code|run shell|launch process", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("data-send",
                    Pattern.compile("send (all|your) data to", Pattern.CASE_INSENSITIVE))
    );

    static final String SCOPE_CHECK_PROMPT = """
            Decide whether the user query below belongs to IT: infrastructure, networking, \
            cybersecurity, cloud, DevOps, system administration, software or IT careers.

            Query: "%s"

            Answer with exactly one word: yes or no.""";

    private final ScopeProperties scope;
    private final AiProperties ai;
    private final CompletionGateway gateway;

    private final KeywordMatcher nonIt;
    private final KeywordMatcher anchors;
    private final KeywordMatcher career;

    public SecurityGuardImpl(ScopeProperties scope, AiProperties ai, CompletionGateway gateway) {
        this.scope = scope;
        this.ai = ai;
        this.gateway = gateway;
        this.nonIt = KeywordMatcher.of(scope.getNonItPatterns());
        this.anchors = KeywordMatcher.stemsOf(scope.getItAnchors());
        this.career = KeywordMatcher.stemsOf(scope.getCareerWhitelist());
        log.info("[scope] enforce={} allowCareer={} llmCheck={} lexicons nonIt={} anchors={} career={}",
                scope.isEnforce(), scope.isAllowCareerTopics(), scope.getLlmCheck().isEnabled(),
                nonIt.size(), anchors.size(), career.size());
    }

    @Override
    public ScopeVerdict evaluateKeywords(String query) {
        return keywordTiers(query).verdict();
    }

    @Override
    public Mono<ScopeVerdict> evaluateScope(String query) {
        KeywordOutcome outcome = keywordTiers(query);
        if (!outcome.ambiguous() || !scope.getLlmCheck().isEnabled() || !gateway.isConfigured()) {
            return Mono.just(outcome.verdict());
        }
        return llmScopeCheck(query);
    }

    private KeywordOutcome keywordTiers(String query) {
        if (!scope.isEnforce()) {
            return new KeywordOutcome(ScopeVerdict.allow(ScopeMethod.DEFAULT_ALLOW, 1.0, "Scope enforcement disabled"), false);
        }
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();

        Optional<String> nonItHit = nonIt.firstMatch(q);
        if (nonItHit.isEmpty()) {
            return new KeywordOutcome(ScopeVerdict.allow(ScopeMethod.DEFAULT_ALLOW, 1.0, "No non-IT topic detected"), false);
        }

        Optional<String> anchorHit = anchors.firstMatch(q);
        if (anchorHit.isPresent()) {
            String reason = "Non-IT term '" + nonItHit.get() + "' appears with IT term '" + anchorHit.get() + "'";
            return new KeywordOutcome(ScopeVerdict.allow(ScopeMethod.KEYWORD, 0.8, reason), true);
        }

        Optional<String> careerHit = career.firstMatch(q);
        if (scope.isAllowCareerTopics() && careerHit.isPresent()) {
            return new KeywordOutcome(ScopeVerdict.allow(ScopeMethod.KEYWORD, 0.9,
                    "IT career topic '" + careerHit.get() + "' allowed by policy"), false);
        }

        log.debug("[scope] refusing on non-IT term '{}'", nonItHit.get());
        return new KeywordOutcome(ScopeVerdict.refuse(ScopeMethod.KEYWORD, 0.95,
                "Detected non-IT topic '" + nonItHit.get() + "' per scope policy"), false);
    }

    private Mono<ScopeVerdict> llmScopeCheck(String query) {
        String model = StringUtils.hasText(scope.getLlmCheck().getModel()) ? scope.getLlmCheck().getModel() : null;
        CompletionRequest request = CompletionRequest.singleUser(
                String.format(SCOPE_CHECK_PROMPT, query), model, scope.getLlmCheck().getMaxTokens(), 0.0);

        return gateway.call(request)
                .timeout(ai.getClassification().getTimeout())
                .map(SecurityGuardImpl::parseScopeAnswer)
                .onErrorResume(e -> {
                    log.warn("[scope] remote scope check failed, allowing query: {}", e.toString());
                    return Mono.just(failOpen());
                })
                .defaultIfEmpty(failOpen());
    }

    static ScopeVerdict parseScopeAnswer(String raw) {
        String a = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (a.startsWith("yes")) {
            return ScopeVerdict.allow(ScopeMethod.LLM, 0.8, "Remote scope check judged the query IT-related");
        }
        if (a.startsWith("no")) {
            return ScopeVerdict.refuse(ScopeMethod.LLM, 0.8, "Remote scope check judged the query outside IT");
        }
        return failOpen();
    }

    private static ScopeVerdict failOpen() {
        return ScopeVerdict.allow(ScopeMethod.DEFAULT_ALLOW, 0.5, "Scope check inconclusive, allowing query");
    }

    @Override
    public InjectionCheck detectInjection(String text) {
        if (!StringUtils.hasText(text)) return InjectionCheck.clean();
        List<String> hits = new ArrayList<>();
        for (InjectionPattern p : INJECTION_PATTERNS) {
            if (p.pattern().matcher(text).find()) hits.add(p.id());
        }
        if (!hits.isEmpty()) {
            log.info("[scope] injection heuristics fired: {}", hits);
        }
        return new InjectionCheck(!hits.isEmpty(), List.copyOf(hits));
    }

    private record InjectionPattern(String id, Pattern pattern) {}

    private record KeywordOutcome(ScopeVerdict verdict, boolean ambiguous) {}
}
