package com.itguru.sources.microsoft;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.SourceResult;
import com.itguru.config.SourceProperties;
import com.itguru.sources.AbstractMcpSourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Microsoft Learn MCP server. Replies arrive as an SSE stream which is reassembled
 * by {@link SseLineAssembler}; plain JSON replies are accepted as well.
 */
@Slf4j
@Component
public class MicrosoftLearnSourceClient extends AbstractMcpSourceClient {

    static final String LABEL = "Microsoft Learn";
    private static final String LEARN_HOST = "https://learn.microsoft.com";

    private final SourceProperties.Microsoft props;

    public MicrosoftLearnSourceClient(@Qualifier("sourceWebClient") WebClient webClient,
                                      ObjectMapper mapper,
                                      SourceProperties sourceProperties,
                                      Clock clock) {
        super(webClient, mapper, sourceProperties.getTimeout(), clock);
        this.props = sourceProperties.getMicrosoft();
    }

    @Override
    public Route route() {
        return Route.MICROSOFT_LEARN;
    }

    @Override
    protected String tag() {
        return "ms-learn";
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
    protected String keywordSearchLocale() {
        return props.getLocale();
    }

    @Override
    protected String searchPageUrl(String query) {
        return LEARN_HOST + "/search?query=" + UriUtils.encodeQueryParam(query, StandardCharsets.UTF_8);
    }

    @Override
    protected String keywordResultUrl(JsonNode item) {
        String url = text(item, "url");
        if (url != null) return url;
        String path = text(item, "path");
        return LEARN_HOST + (path == null ? "" : path);
    }

    /** The search tool is only attempted when the server advertised tools. */
    @Override
    protected Mono<List<SourceResult>> searchViaTools(String query, int maxResults) {
        if (toolCache().isEmpty()) {
            log.debug("[ms-learn] no tools cached, using keyword search");
            return Mono.just(List.of());
        }
        return callTool("microsoft_docs_search", Map.of("query", query))
                .map(result -> mapContent(result, query, maxResults))
                .defaultIfEmpty(List.of());
    }

    @Override
    protected Mono<JsonNode> exchangeRpc(ObjectNode rpcRequest) {
        return webClient.post()
                .uri(endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM)
                .bodyValue(rpcRequest)
                .exchangeToMono(resp -> {
                    if (resp.statusCode().isError()) {
                        return resp.createException().flatMap(Mono::error);
                    }
                    MediaType type = resp.headers().contentType().orElse(MediaType.TEXT_EVENT_STREAM);
                    if (MediaType.APPLICATION_JSON.isCompatibleWith(type)) {
                        return resp.bodyToMono(JsonNode.class).flatMap(this::resultOf);
                    }
                    return resp.bodyToFlux(DataBuffer.class)
                            .map(MicrosoftLearnSourceClient::drain)
                            .reduceWith(() -> new SseLineAssembler(mapper), SseLineAssembler::feed)
                            .flatMap(assembler -> Mono.justOrEmpty(assembler.finish()));
                });
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
