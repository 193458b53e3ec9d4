package com.itguru.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.itguru.api.dto.SourceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared "list tools, then call a tool by name" protocol of the documentation
 * backends. Subclasses supply the transport ({@link #exchangeRpc}) and the
 * backend-specific search strategy.
 */
@Slf4j
public abstract class AbstractMcpSourceClient implements SourceClient {

    private static final int LIST_ID = 1;
    private static final int CALL_ID = 2;

    protected final WebClient webClient;
    protected final ObjectMapper mapper;
    protected final Duration timeout;
    private final Clock clock;
    private final ToolCache toolCache = new ToolCache();

    protected AbstractMcpSourceClient(WebClient webClient, ObjectMapper mapper, Duration timeout, Clock clock) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.timeout = timeout;
        this.clock = clock;
    }

    /** Log tag, e.g. {@code aws-docs}. */
    protected abstract String tag();

    protected abstract String endpoint();

    /** Label shown next to each result. */
    protected abstract String sourceLabel();

    /**
     * Sends one JSON-RPC request and emits its {@code result} object, or completes
     * empty when the reply carries none. Transport failures are signalled as errors.
     */
    protected abstract Mono<JsonNode> exchangeRpc(ObjectNode rpcRequest);

    /** Tool-protocol search; empty when the tools gave nothing usable. */
    protected abstract Mono<List<SourceResult>> searchViaTools(String query, int maxResults);

    /** Keyword-search REST endpoint, or null when the backend has none. */
    protected abstract String keywordSearchUrl();

    /** Link used when a tool answers with a bare string instead of items. */
    protected abstract String searchPageUrl(String query);

    @Override
    public Mono<List<SourceResult>> searchContent(String query, int maxResults) {
        int limit = Math.max(1, maxResults);
        return ensureTools()
                .then(Mono.defer(() -> searchViaTools(query, limit)))
                .defaultIfEmpty(List.of())
                .flatMap(results -> results.isEmpty() ? keywordSearch(query, limit) : Mono.just(results))
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("[{}] search failed, returning no results: {}", tag(), e.toString());
                    return Mono.just(List.of());
                });
    }

    public ToolCache toolCache() {
        return toolCache;
    }

    /**
     * Re-reads the tool list. Completes with false (never an error) when the server
     * is unreachable or the reply has no tools.
     */
    public Mono<Boolean> refreshTools() {
        return exchangeRpc(rpc(LIST_ID, "tools/list", null))
                .map(result -> {
                    List<String> names = new ArrayList<>();
                    for (JsonNode tool : result.path("tools")) {
                        String name = tool.path("name").asText("");
                        if (!name.isEmpty()) names.add(name);
                    }
                    if (names.isEmpty()) return false;
                    toolCache.update(names, clock.instant());
                    log.debug("[{}] tools refreshed: {}", tag(), names);
                    return true;
                })
                .timeout(timeout)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("[{}] tools/list failed: {}", tag(), e.toString());
                    return Mono.just(false);
                });
    }

    protected Mono<Void> ensureTools() {
        return Mono.defer(() -> toolCache.needsRefresh() ? refreshTools().then() : Mono.empty());
    }

    /**
     * Invokes a tool. A 400 or 404 means the server's schema moved: the tool list is
     * refreshed once and the call yields nothing. Any other failure also yields nothing.
     */
    protected Mono<JsonNode> callTool(String name, Map<String, Object> arguments) {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", mapper.valueToTree(arguments));

        return exchangeRpc(rpc(CALL_ID, "tools/call", params))
                .onErrorResume(e -> {
                    if (e instanceof WebClientResponseException w && isSchemaDrift(w)) {
                        log.warn("[{}] tools/call {} -> HTTP {}, refreshing tool list", tag(), name, w.getStatusCode().value());
                        return refreshTools().then(Mono.empty());
                    }
                    log.warn("[{}] tools/call {} failed: {}", tag(), name, e.toString());
                    return Mono.empty();
                });
    }

    private static boolean isSchemaDrift(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.BAD_REQUEST.value() || status == HttpStatus.NOT_FOUND.value();
    }

    protected ObjectNode rpc(int id, String method, ObjectNode params) {
        ObjectNode body = mapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", id);
        body.put("method", method);
        if (params != null) body.set("params", params);
        return body;
    }

    /** Emits the {@code result} of a JSON-RPC reply; logs and drops an {@code error} reply. */
    protected Mono<JsonNode> resultOf(JsonNode reply) {
        if (reply == null) return Mono.empty();
        if (reply.hasNonNull("error")) {
            log.warn("[{}] rpc error: {}", tag(), reply.get("error"));
            return Mono.empty();
        }
        JsonNode result = reply.get("result");
        return result == null || result.isNull() ? Mono.empty() : Mono.just(result);
    }

    /**
     * Maps a tool result's {@code content} into results. Items may be objects, MCP
     * text parts whose text holds a JSON array or object, or a bare string.
     */
    protected List<SourceResult> mapContent(JsonNode result, String query, int maxResults) {
        List<SourceResult> out = new ArrayList<>();
        JsonNode content = result == null ? null : result.get("content");
        if (content == null || content.isNull()) return out;

        if (content.isTextual()) {
            addTextResult(out, content.asText(), query);
        } else if (content.isArray()) {
            for (JsonNode item : content) {
                if (out.size() >= maxResults) break;
                if (item.isObject() && "text".equals(item.path("type").asText()) && item.has("text")) {
                    expandTextPart(out, item.get("text").asText(""), query, maxResults);
                } else if (item.isObject()) {
                    out.add(toResult(item, query));
                }
            }
        }
        return out.size() > maxResults ? new ArrayList<>(out.subList(0, maxResults)) : out;
    }

    private void expandTextPart(List<SourceResult> out, String text, String query, int maxResults) {
        JsonNode parsed = tryParse(text);
        JsonNode items = parsed == null ? null
                : parsed.isArray() ? parsed
                : parsed.has("results") ? parsed.get("results")
                : null;
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                if (out.size() >= maxResults) return;
                if (item.isObject()) out.add(toResult(item, query));
            }
        } else if (parsed != null && parsed.isObject() && parsed.has("url")) {
            out.add(toResult(parsed, query));
        } else {
            addTextResult(out, text, query);
        }
    }

    private void addTextResult(List<SourceResult> out, String text, String query) {
        if (!StringUtils.hasText(text)) return;
        out.add(new SourceResult(sourceLabel() + ": " + query, Excerpts.of(text), searchPageUrl(query), sourceLabel()));
    }

    protected SourceResult toResult(JsonNode item, String query) {
        String title = prefer(text(item, "title"), sourceLabel() + ": " + query);
        String excerpt = prefer(text(item, "excerpt"), text(item, "description"), text(item, "summary"),
                text(item, "context"), text(item, "content"));
        String url = prefer(text(item, "url"), text(item, "link"), text(item, "contentUrl"));
        return new SourceResult(title, Excerpts.of(excerpt), url, sourceLabel());
    }

    /**
     * GET {@code ?search=&locale=&facet=category&top=}, reading {@code results[]}.
     */
    protected Mono<List<SourceResult>> keywordSearch(String query, int maxResults) {
        String base = keywordSearchUrl();
        if (!StringUtils.hasText(base)) return Mono.just(List.of());

        URI uri = UriComponentsBuilder.fromUriString(base)
                .queryParam("search", query)
                .queryParam("locale", keywordSearchLocale())
                .queryParam("facet", "category")
                .queryParam("top", maxResults)
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    List<SourceResult> out = new ArrayList<>();
                    for (JsonNode item : root.path("results")) {
                        if (out.size() >= maxResults) break;
                        String title = prefer(text(item, "title"), sourceLabel() + ": " + query);
                        String excerpt = prefer(text(item, "description"), text(item, "summary"));
                        out.add(new SourceResult(title, Excerpts.of(excerpt), keywordResultUrl(item), sourceLabel()));
                    }
                    log.debug("[{}] keyword search returned {} results", tag(), out.size());
                    return out;
                })
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("[{}] keyword search failed: {}", tag(), e.toString());
                    return Mono.just(List.of());
                });
    }

    protected String keywordSearchLocale() {
        return "en-us";
    }

    protected String keywordResultUrl(JsonNode item) {
        String url = text(item, "url");
        return url == null ? "" : url;
    }

    private JsonNode tryParse(String text) {
        String t = text == null ? "" : text.strip();
        if (!(t.startsWith("[") || t.startsWith("{"))) return null;
        try {
            return mapper.readTree(t);
        } catch (Exception e) {
            log.debug("[{}] text part is not JSON: {}", tag(), e.getMessage());
            return null;
        }
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.isValueNode() ? v.asText() : v.toString();
        return StringUtils.hasText(s) ? s : null;
    }

    protected static String prefer(String... candidates) {
        for (String c : candidates) {
            if (StringUtils.hasText(c)) return c;
        }
        return "";
    }
}
