package com.itguru.service;

import com.itguru.api.dto.AnswerResult;
import com.itguru.api.dto.ReformatStyle;
import com.itguru.api.dto.StreamingAnswer;
import com.itguru.session.SessionContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns a routed query into an answer and its side artifacts.
 */
public interface ResponseOrchestrator {

    /**
     * Lazy fragment sequence: an empty heartbeat first, then either one refusal or
     * notice fragment, or the completion deltas. A streaming failure appends one
     * error fragment; fragments already emitted stand. Each call starts a fresh run.
     */
    Flux<String> streamAnswer(String query, String history, SessionContext session);

    /** Streaming entry point; the sources block is written to the session once routing completes. */
    StreamingAnswer streamAnswerQuery(String query, String history, SessionContext session);

    /** Blocking-mode entry point: final text and the rendered sources block. */
    Mono<AnswerResult> answerQuery(String query, String history, SessionContext session);

    /** Up to three follow-up questions; empty on any failure. */
    Mono<List<String>> generateFollowups(String query, String answer, String context, SessionContext session);

    /** Re-renders an answer in another structure; the original answer on any failure. */
    Mono<String> reformat(String answer, ReformatStyle style, String context, SessionContext session);
}
