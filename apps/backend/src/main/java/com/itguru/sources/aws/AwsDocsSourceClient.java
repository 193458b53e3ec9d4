package com.itguru.sources.aws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.SourceResult;
import com.itguru.config.SourceProperties;
import com.itguru.sources.AbstractMcpSourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AWS Knowledge MCP server over plain JSON request/response.
 */
@Slf4j
@Component
public class AwsDocsSourceClient extends AbstractMcpSourceClient {

    static final String LABEL = "AWS Documentation";
    private static final Pattern DOCS_URL = Pattern.compile("https?://docs\\.aws\\.amazon\\.com\\S+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:)\\]\"']+$");

    private final SourceProperties.Aws props;

    public AwsDocsSourceClient(@Qualifier("sourceWebClient") WebClient webClient,
                               ObjectMapper mapper,
                               SourceProperties sourceProperties,
                               Clock clock) {
        super(webClient, mapper, sourceProperties.getTimeout(), clock);
        this.props = sourceProperties.getAws();
    }

    @Override
    public Route route() {
        return Route.AWS_DOCS;
    }

    @Override
    protected String tag() {
        return "aws-docs";
    }

    @Override
    protected String endpoint() {
        return props.getEndpoint();
    }

    @Override
    protected String sourceLabel() {
        return LABEL;
    }

    @Override
    protected String keywordSearchUrl() {
        return props.getSearchUrl();
    }

    @Override
    protected String searchPageUrl(String query) {
        return "https://docs.aws.amazon.com/search/doc-search.html?searchPath=documentation&searchQuery="
                + UriUtils.encodeQueryParam(query, StandardCharsets.UTF_8);
    }

    /**
     * A docs URL inside the query asks for related pages first; otherwise, or when
     * that yields nothing, the documentation search tool runs.
     */
    @Override
    protected Mono<List<SourceResult>> searchViaTools(String query, int maxResults) {
        Mono<List<SourceResult>> recommended = docsUrlIn(query)
                .map(url -> recommend(url, maxResults))
                .orElse(Mono.just(List.of()));

        return recommended.flatMap(list -> {
            if (!list.isEmpty()) return Mono.just(list);
            return callTool("search_documentation", Map.of("search_phrase", query, "limit", maxResults))
                    .map(result -> mapContent(result, query, maxResults))
                    .defaultIfEmpty(List.of());
        });
    }

    /** Pages related to a documentation URL. */
    public Mono<List<SourceResult>> recommend(String url, int maxResults) {
        return callTool("recommend", Map.of("url", url))
                .map(result -> {
                    List<SourceResult> out = new ArrayList<>();
                    for (SourceResult r : mapContent(result, url, maxResults)) {
                        out.add(r.title().startsWith(LABEL + ": ")
                                ? new SourceResult(LABEL, r.excerpt(), r.url(), r.source())
                                : r);
                    }
                    return out;
                })
                .defaultIfEmpty(List.<SourceResult>of())
                .onErrorResume(e -> {
                    log.warn("[aws-docs] recommend failed: {}", e.toString());
                    return Mono.just(List.of());
                });
    }

    /**
     * Full text of one documentation page as Markdown; empty when unavailable.
     */
    public Mono<String> readDocumentation(String url) {
        return callTool("read_documentation", Map.of("url", url))
                .map(AwsDocsSourceClient::contentText)
                .timeout(timeout)
                .defaultIfEmpty("")
                .onErrorResume(e -> {
                    log.warn("[aws-docs] read_documentation failed: {}", e.toString());
                    return Mono.just("");
                });
    }

    static String contentText(JsonNode result) {
        JsonNode content = result.path("content");
        if (content.isTextual()) return content.asText();
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : content) {
            String t = part.path("text").asText("");
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(t);
        }
        return sb.toString();
    }

    static Optional<String> docsUrlIn(String query) {
        if (query == null) return Optional.empty();
        Matcher m = DOCS_URL.matcher(query);
        if (!m.find()) return Optional.empty();
        return Optional.of(TRAILING_PUNCTUATION.matcher(m.group()).replaceFirst(""));
    }

    @Override
    protected Mono<JsonNode> exchangeRpc(ObjectNode rpcRequest) {
        return webClient.post()
                .uri(endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(rpcRequest)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(this::resultOf);
    }
}
