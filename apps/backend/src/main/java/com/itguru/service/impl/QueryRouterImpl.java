package com.itguru.service.impl;

import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.Intent;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.SourceResult;
import com.itguru.config.ScopeProperties;
import com.itguru.config.SourceProperties;
import com.itguru.service.IntentClassifier;
import com.itguru.service.QueryRouter;
import com.itguru.session.SessionContext;
import com.itguru.sources.SourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class QueryRouterImpl implements QueryRouter {

    static final String GENERAL_CONTEXT = "Using AI general knowledge for conversational response.";

    private final IntentClassifier classifier;
    private final ScopeProperties scope;
    private final SourceProperties sources;
    private final Map<Route, SourceClient> dispatch = new EnumMap<>(Route.class);

    public QueryRouterImpl(IntentClassifier classifier,
                           List<SourceClient> clients,
                           ScopeProperties scope,
                           SourceProperties sources) {
        this.classifier = classifier;
        this.scope = scope;
        this.sources = sources;
        for (SourceClient c : clients) {
            SourceClient previous = dispatch.put(c.route(), c);
            if (previous != null) {
                throw new IllegalStateException("two source clients registered for route " + c.route());
            }
        }
        log.info("[router] dispatch table: {}", dispatch.keySet());
    }

    @Override
    public Mono<EnhancedContext> route(String query, SessionContext session) {
        String model = session == null ? null : session.selectedModel();
        return classifier.classify(query, model)
                .flatMap(intent -> switch (intent.route()) {
                    case OUT_OF_SCOPE -> Mono.just(EnhancedContext.refusal(intent, refusalMessage()));
                    case GENERAL_KNOWLEDGE -> Mono.just(new EnhancedContext(intent, List.of(), GENERAL_CONTEXT, false));
                    default -> fetch(intent, query, session)
                            .map(results -> new EnhancedContext(intent, results, formatContext(results), false));
                })
                .onErrorResume(e -> {
                    log.warn("[router] routing failed, continuing without sources: {}", e.toString());
                    if (session != null) session.recordError("Routing error: " + e.getMessage());
                    return Mono.just(new EnhancedContext(classifier.fallback(query), List.of(), "", false));
                });
    }

    private Mono<List<SourceResult>> fetch(Intent intent, String query, SessionContext session) {
        SourceClient client = dispatch.get(intent.route());
        if (client == null) {
            log.warn("[router] no source client for route {}", intent.route());
            return Mono.just(List.of());
        }
        long t0 = System.nanoTime();
        String model = session == null ? null : session.selectedModel();
        return Mono.defer(() -> client.searchContent(query, sources.getMaxResults()))
                .contextWrite(ctx -> StringUtils.hasText(model) ? ctx.put(SourceClient.MODEL_CONTEXT_KEY, model) : ctx)
                .defaultIfEmpty(List.of())
                .doOnNext(results -> log.debug("[router] {} returned {} results in {}ms",
                        intent.route().wireName(), results.size(), (System.nanoTime() - t0) / 1_000_000))
                .onErrorResume(e -> {
                    log.warn("[router] dispatch to {} failed: {}", intent.route().wireName(), e.toString());
                    if (session != null) session.recordError("Routing error: " + e.getMessage());
                    return Mono.just(List.of());
                });
    }

    private String refusalMessage() {
        String msg = scope.getRefusalMessage();
        return StringUtils.hasText(msg) ? msg : ScopeProperties.DEFAULT_REFUSAL;
    }

    /** One block per result: bold title with source label, excerpt, URL. */
    static String formatContext(List<SourceResult> results) {
        return results.stream()
                .map(r -> "**" + r.title() + "** (" + r.source() + ")\n" + r.excerpt() + "\nURL: " + r.url() + "\n")
                .collect(Collectors.joining("\n"));
    }
}
