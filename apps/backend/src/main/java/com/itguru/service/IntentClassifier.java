package com.itguru.service;

import com.itguru.api.dto.Intent;
import reactor.core.publisher.Mono;

public interface IntentClassifier {

    /**
     * Scope check first (out-of-scope short-circuits), then a low-temperature
     * classification call, then keyword rules when the call is unavailable or fails.
     * Never errors.
     *
     * @param model model override for the classification call, null for the default
     */
    Mono<Intent> classify(String query, String model);

    /**
     * Deterministic rules: greeting, then AWS terms, then Microsoft terms, else web search.
     */
    Intent fallback(String query);
}
