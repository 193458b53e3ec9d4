package com.itguru.sources.microsoft;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Line-buffered reassembly of a JSON-RPC reply delivered as server-sent events.
 *
 * <p>Bytes are buffered until a newline, so a chunk boundary may fall anywhere,
 * even inside a multi-byte character. Each complete {@code data:} line is parsed
 * as JSON; the latest {@code result} object (or bare {@code content} payload)
 * wins. Not thread-safe: one instance per response.</p>
 */
@Slf4j
public final class SseLineAssembler {

    private static final String DATA_PREFIX = "data:";
    private static final String DONE = "[DONE]";

    private final ObjectMapper mapper;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);

    private JsonNode latest;
    private JsonNode lastError;
    private int events;

    public SseLineAssembler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SseLineAssembler feed(byte[] chunk) {
        if (chunk == null) return this;
        for (byte b : chunk) {
            if (b == '\n') {
                flushLine();
            } else {
                pending.write(b);
            }
        }
        return this;
    }

    public SseLineAssembler feed(String chunk) {
        return chunk == null ? this : feed(chunk.getBytes(StandardCharsets.UTF_8));
    }

    /** Processes a trailing unterminated line and returns the accumulated result. */
    public Optional<JsonNode> finish() {
        if (pending.size() > 0) flushLine();
        return Optional.ofNullable(latest);
    }

    public Optional<JsonNode> lastError() {
        return Optional.ofNullable(lastError);
    }

    public int events() {
        return events;
    }

    private void flushLine() {
        String line = pending.toString(StandardCharsets.UTF_8).strip();
        pending.reset();
        if (!line.startsWith(DATA_PREFIX)) return;

        String data = line.substring(DATA_PREFIX.length()).strip();
        if (data.isEmpty() || DONE.equals(data)) return;

        JsonNode node;
        try {
            node = mapper.readTree(data);
        } catch (Exception e) {
            log.debug("[ms-learn] skipping malformed event: {}", e.getMessage());
            return;
        }
        events++;
        if (node.has("result")) {
            latest = node.get("result");
        } else if (node.has("content")) {
            latest = node;
        } else if (node.has("error")) {
            lastError = node.get("error");
            log.warn("[ms-learn] server reported error event: {}", lastError);
        }
    }
}
