package com.itguru.service;

import com.itguru.api.dto.EnhancedContext;
import com.itguru.session.SessionContext;
import reactor.core.publisher.Mono;

public interface QueryRouter {

    /**
     * Scope check, classification, then dispatch to at most one source. Out-of-scope
     * queries get a refusal context and no source call. Dispatch failures are recorded
     * on the session and treated as no results; the returned Mono does not error.
     */
    Mono<EnhancedContext> route(String query, SessionContext session);
}
