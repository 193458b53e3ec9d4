package com.itguru.service;

import com.itguru.api.dto.InjectionCheck;
import com.itguru.api.dto.ScopeVerdict;
import reactor.core.publisher.Mono;

/**
 * Topic-scope policy and prompt-injection heuristics.
 */
public interface SecurityGuard {

    /**
     * Keyword tiers only; never performs I/O.
     */
    ScopeVerdict evaluateKeywords(String query);

    /**
     * Keyword tiers plus the optional remote check for ambiguous queries. The remote
     * check fails open: any error yields an in-scope verdict.
     */
    Mono<ScopeVerdict> evaluateScope(String query);

    /**
     * Runs the injection heuristics in order and reports every pattern that fired.
     * Detection never blocks a query.
     */
    InjectionCheck detectInjection(String text);
}
