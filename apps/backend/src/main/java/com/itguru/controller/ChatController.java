package com.itguru.controller;

import com.itguru.api.dto.ChatRequest;
import com.itguru.api.dto.ChatResponse;
import com.itguru.api.dto.FollowupRequest;
import com.itguru.api.dto.FollowupResponse;
import com.itguru.api.dto.ReformatRequest;
import com.itguru.api.dto.ReformatResponse;
import com.itguru.service.HistorySummarizer;
import com.itguru.service.ResponseOrchestrator;
import com.itguru.session.SessionContext;
import com.itguru.session.SessionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    static final String FRAGMENT_EVENT = "delta";
    static final String SOURCES_EVENT = "sources";

    private final ResponseOrchestrator orchestrator;
    private final SessionRegistry sessions;
    private final HistorySummarizer historySummarizer;

    @Operation(summary = "Answer an IT question in one response")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest req) {
        SessionContext session = sessions.getOrCreate(req.sessionId());
        log.debug("[answer] blocking request, session={}", session.id());
        return orchestrator.answerQuery(req.query(), historyOf(req), session)
                .map(r -> new ChatResponse(session.id(), r.answer(), r.sourcesMarkdown(), session.lastIntent()));
    }

    /**
     * Streams answer fragments as {@code delta} events, then one {@code sources}
     * event carrying the rendered sources block of this request.
     */
    @Operation(summary = "Answer an IT question as a server-sent event stream")
    @PostMapping(value = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@Valid @RequestBody ChatRequest req) {
        SessionContext session = sessions.getOrCreate(req.sessionId());
        log.debug("[answer] streaming request, session={}", session.id());

        Flux<ServerSentEvent<String>> fragments = orchestrator
                .streamAnswerQuery(req.query(), historyOf(req), session)
                .fragments()
                .map(text -> ServerSentEvent.<String>builder(text).id(session.id()).event(FRAGMENT_EVENT).build());

        Mono<ServerSentEvent<String>> sources = Mono.fromSupplier(() -> ServerSentEvent
                .<String>builder(session.lastSourcesMarkdown())
                .id(session.id())
                .event(SOURCES_EVENT)
                .build());

        return fragments.concatWith(sources);
    }

    @Operation(summary = "Suggest follow-up questions for an answer")
    @PostMapping(value = "/followups", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FollowupResponse> followups(@Valid @RequestBody FollowupRequest req) {
        SessionContext session = sessions.getOrCreate(req.sessionId());
        return orchestrator.generateFollowups(req.query(), req.answer(), req.context(), session)
                .map(list -> new FollowupResponse(session.id(), list));
    }

    @Operation(summary = "Re-render an answer in another structure")
    @PostMapping(value = "/reformat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ReformatResponse> reformat(@Valid @RequestBody ReformatRequest req) {
        SessionContext session = sessions.getOrCreate(req.sessionId());
        return orchestrator.reformat(req.answer(), req.style(), req.context(), session)
                .map(text -> new ReformatResponse(session.id(), req.style(), text));
    }

    private String historyOf(ChatRequest req) {
        if (StringUtils.hasText(req.history())) return req.history();
        return historySummarizer.summarize(req.messages());
    }
}
