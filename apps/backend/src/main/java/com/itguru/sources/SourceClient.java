package com.itguru.sources;

import com.itguru.api.dto.Route;
import com.itguru.api.dto.SourceResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One knowledge backend behind a uniform search call.
 *
 * <p>Implementations absorb every failure (network, timeout, non-2xx status,
 * malformed payload) and complete with an empty list instead; an empty list is
 * the only error signal a caller sees.</p>
 */
public interface SourceClient {

    /** Reactor context key holding the session's selected model, when one is set. */
    String MODEL_CONTEXT_KEY = "itguru.selected-model";

    /** Route this client serves in the router's dispatch table. */
    Route route();

    /**
     * @param query      raw user query
     * @param maxResults upper bound on returned results
     * @return results in source order, never an error signal
     */
    Mono<List<SourceResult>> searchContent(String query, int maxResults);
}
