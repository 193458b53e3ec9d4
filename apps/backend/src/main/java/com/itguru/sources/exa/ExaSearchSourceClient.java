package com.itguru.sources.exa;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.SourceResult;
import com.itguru.config.SourceProperties;
import com.itguru.sources.Excerpts;
import com.itguru.sources.SourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exa web search, biased towards domains chosen from the query's topic category.
 */
@Slf4j
@Component
public class ExaSearchSourceClient implements SourceClient {

    static final String LABEL = "Exa Search";

    private final WebClient webClient;
    private final SourceProperties sources;
    private final QueryEnhancer enhancer;
    private final DomainCatalog catalog;
    private final Clock clock;

    @Autowired
    public ExaSearchSourceClient(@Qualifier("sourceWebClient") WebClient webClient,
                                 SourceProperties sources,
                                 QueryEnhancer enhancer,
                                 ResourceLoader resourceLoader,
                                 ObjectMapper mapper,
                                 Clock clock) {
        this(webClient, sources, enhancer, loadCatalog(resourceLoader, sources.getExa().getDomainsResource(), mapper), clock);
    }

    ExaSearchSourceClient(WebClient webClient, SourceProperties sources, QueryEnhancer enhancer,
                          DomainCatalog catalog, Clock clock) {
        this.webClient = webClient;
        this.sources = sources;
        this.enhancer = enhancer;
        this.catalog = catalog;
        this.clock = clock;
    }

    @Override
    public Route route() {
        return Route.WEB_SEARCH;
    }

    @Override
    public Mono<List<SourceResult>> searchContent(String query, int maxResults) {
        SourceProperties.Exa exa = sources.getExa();
        if (!exa.hasApiKey()) {
            log.debug("[exa] no API key configured, skipping web search");
            return Mono.just(List.of());
        }
        int limit = exa.getMaxResults() != null && exa.getMaxResults() > 0 ? exa.getMaxResults() : maxResults;
        String category = catalog.categorize(query);
        List<String> domains = catalog.domainsFor(category, query);
        String startDate = startCrawlDate();

        return enhancer.enhance(query, category)
                .flatMap(enhanced -> post(enhanced, limit, domains, startDate)
                        .flatMap(results -> {
                            if (!results.isEmpty() || domains.isEmpty()) return Mono.just(results);
                            log.debug("[exa] no results within {} domains, retrying unrestricted", domains.size());
                            return post(enhanced, limit, null, startDate);
                        }))
                .timeout(sources.getTimeout())
                .onErrorResume(e -> {
                    if (e instanceof WebClientResponseException w) {
                        log.warn("[exa] HTTP {} from search: {}", w.getStatusCode().value(), w.getResponseBodyAsString());
                    } else {
                        log.warn("[exa] search failed: {}", e.toString());
                    }
                    return Mono.just(List.of());
                });
    }

    /** Rolling window when {@code start-days} is positive, otherwise the fixed start date. */
    String startCrawlDate() {
        SourceProperties.Exa exa = sources.getExa();
        if (exa.getStartDays() > 0) {
            return LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(exa.getStartDays()).toString();
        }
        return exa.getStartDate();
    }

    private Mono<List<SourceResult>> post(String query, int limit, List<String> domains, String startDate) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("num_results", limit);
        if (domains != null && !domains.isEmpty()) body.put("include_domains", domains);
        if (StringUtils.hasText(startDate)) body.put("start_crawl_date", startDate);

        return webClient.post()
                .uri(sources.getExa().getEndpoint())
                .headers(h -> h.setBearerAuth(sources.getExa().getApiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    List<SourceResult> out = new ArrayList<>();
                    for (JsonNode item : root.path("results")) {
                        out.add(new SourceResult(
                                item.path("title").asText("No title"),
                                Excerpts.of(item.hasNonNull("text") ? item.get("text").asText() : "No excerpt available"),
                                item.path("url").asText(""),
                                LABEL));
                    }
                    return out;
                })
                .defaultIfEmpty(List.of());
    }

    private static DomainCatalog loadCatalog(ResourceLoader loader, String location, ObjectMapper mapper) {
        if (!StringUtils.hasText(location)) return DomainCatalog.defaults();
        Resource resource = loader.getResource(location);
        if (!resource.exists()) {
            log.info("[exa] {} not found, using built-in domain catalog", location);
            return DomainCatalog.defaults();
        }
        try (InputStream in = resource.getInputStream()) {
            return DomainCatalog.load(in, mapper);
        } catch (IOException e) {
            log.warn("[exa] cannot read {}: {}", location, e.getMessage());
            return DomainCatalog.defaults();
        }
    }
}
