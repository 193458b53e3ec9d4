package com.itguru.ai;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Access to the OpenAI-compatible completion endpoint.
 */
public interface CompletionGateway {

    /**
     * Whether a completion credential is present. When false, {@link #call} and
     * {@link #stream} fail with {@link CompletionNotConfiguredException}.
     */
    boolean isConfigured();

    /**
     * Blocking-mode completion, run off the event loop.
     *
     * @return the assistant text, possibly empty
     */
    Mono<String> call(CompletionRequest request);

    /**
     * Streaming completion. Emits the non-empty text deltas in arrival order;
     * cancelling the subscription closes the underlying connection.
     */
    Flux<String> stream(CompletionRequest request);
}
