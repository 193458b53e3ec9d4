package com.itguru.service.impl;

import com.itguru.ai.ChatTurn;
import com.itguru.ai.CompletionGateway;
import com.itguru.ai.CompletionRequest;
import com.itguru.api.dto.AnswerResult;
import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.InjectionCheck;
import com.itguru.api.dto.ReformatStyle;
import com.itguru.api.dto.StreamingAnswer;
import com.itguru.config.AiProperties;
import com.itguru.config.AnswerProperties;
import com.itguru.service.ContextAssembler;
import com.itguru.service.QueryRouter;
import com.itguru.service.ResponseOrchestrator;
import com.itguru.service.SecurityGuard;
import com.itguru.service.SourcesMarkdown;
import com.itguru.session.SessionContext;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseOrchestratorImpl implements ResponseOrchestrator {

    static final String MISSING_KEY_MESSAGE =
            "⚠️ OpenRouter API key not configured. Please add your API key to continue.";
    static final String STREAM_ERROR_PREFIX = "\n\n❌ Streaming error: ";
    static final String ANSWER_ERROR_PREFIX = "❌ Error generating response: ";

    private static final int MAX_FOLLOWUPS = 3;
    private static final int MAX_FOLLOWUP_CHARS = 150;
    private static final int FOLLOWUP_ANSWER_CHARS = 1500;
    private static final int FOLLOWUP_CONTEXT_CHARS = 1000;
    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s*");

    static final String FOLLOWUP_PROMPT = """
            Based on the user's IT question and the answer below, suggest up to 3 short follow-up \
            questions the user might ask next. Return one question per line, without numbering or extra text.

            Question: %s

            Answer (excerpt): %s

            Context: %s""";

    static final String REFORMAT_SYSTEM = "You reformat IT answers without changing their technical content. "
            + "Do not add new facts, links or commands that are not in the original answer.";

    private final QueryRouter router;
    private final SecurityGuard securityGuard;
    private final ContextAssembler contextAssembler;
    private final SourcesMarkdown sourcesMarkdown;
    private final CompletionGateway gateway;
    private final AiProperties ai;
    private final AnswerProperties answerProps;

    @PostConstruct
    void checkBudgets() {
        if (ai.getClassification().getTimeout().compareTo(answerProps.getContextTimeout()) >= 0) {
            log.warn("[answer] classification timeout {} does not fit the context budget {}; "
                            + "a stalled classification will answer without sources",
                    ai.getClassification().getTimeout(), answerProps.getContextTimeout());
        }
    }

    @Override
    public Flux<String> streamAnswer(String query, String history, SessionContext session) {
        Flux<String> body = fetchContext(query, session)
                .flatMapMany(ctx -> {
                    if (ctx.intent().isOutOfScope()) {
                        return Flux.just(ctx.contextText());
                    }
                    if (!gateway.isConfigured()) {
                        return Flux.just(MISSING_KEY_MESSAGE);
                    }
                    return gateway.stream(answerRequest(query, history, ctx, session))
                            .filter(StringUtils::hasLength)
                            .onErrorResume(e -> {
                                log.warn("[answer] stream broke off: {}", e.toString());
                                return Flux.just(STREAM_ERROR_PREFIX + describe(e));
                            });
                })
                .onErrorResume(e -> {
                    log.warn("[answer] could not start answer stream: {}", e.toString());
                    return Flux.just(ANSWER_ERROR_PREFIX + describe(e));
                })
                .subscribeOn(session.scheduler());

        return Flux.concat(Flux.just(""), body);
    }

    @Override
    public StreamingAnswer streamAnswerQuery(String query, String history, SessionContext session) {
        return new StreamingAnswer(streamAnswer(query, history, session), "");
    }

    @Override
    public Mono<AnswerResult> answerQuery(String query, String history, SessionContext session) {
        return fetchContext(query, session)
                .flatMap(ctx -> {
                    if (ctx.intent().isOutOfScope()) {
                        return Mono.just(new AnswerResult(ctx.contextText(), ""));
                    }
                    if (!gateway.isConfigured()) {
                        return Mono.just(new AnswerResult(MISSING_KEY_MESSAGE, ""));
                    }
                    String markdown = sourcesMarkdown.render(ctx.results());
                    return gateway.call(answerRequest(query, history, ctx, session))
                            .defaultIfEmpty("")
                            .map(text -> new AnswerResult(text, markdown));
                })
                .onErrorResume(e -> {
                    log.warn("[answer] blocking answer failed: {}", e.toString());
                    return Mono.just(new AnswerResult(ANSWER_ERROR_PREFIX + describe(e), ""));
                })
                .subscribeOn(session.scheduler());
    }

    /**
     * Routes under the context budget. A timeout degrades to an empty context so the
     * answer still goes out; the outcome is written to the session either way.
     */
    private Mono<EnhancedContext> fetchContext(String query, SessionContext session) {
        return router.route(query, session)
                .timeout(answerProps.getContextTimeout())
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("[answer] context fetch exceeded {}, answering without sources",
                                answerProps.getContextTimeout());
                        session.recordError("Context fetch timed out; answered without external sources");
                    } else {
                        log.warn("[answer] context fetch failed: {}", e.toString());
                        session.recordError("Context fetch failed: " + e.getMessage());
                    }
                    return Mono.just(EnhancedContext.minimal());
                })
                .doOnNext(ctx -> session.recordRouting(ctx, sourcesMarkdown.render(ctx.results())));
    }

    private CompletionRequest answerRequest(String query, String history, EnhancedContext ctx, SessionContext session) {
        InjectionCheck injection = securityGuard.detectInjection(query);
        List<ChatTurn> messages = contextAssembler.buildMessages(query, history, ctx, injection);
        return CompletionRequest.of(messages, session.selectedModel(), ai.getMaxTokens(), ai.getTemperature());
    }

    @Override
    public Mono<List<String>> generateFollowups(String query, String answer, String context, SessionContext session) {
        if (!gateway.isConfigured() || !StringUtils.hasText(answer)) {
            return Mono.just(List.of());
        }
        AiProperties.Budget budget = ai.getFollowups();
        String prompt = String.format(FOLLOWUP_PROMPT,
                query, truncate(answer, FOLLOWUP_ANSWER_CHARS), truncate(context, FOLLOWUP_CONTEXT_CHARS));

        return gateway.call(CompletionRequest.singleUser(prompt, session.selectedModel(),
                        budget.getMaxTokens(), budget.getTemperature()))
                .timeout(budget.getTimeout())
                .map(ResponseOrchestratorImpl::parseFollowups)
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("[answer] follow-up generation failed: {}", e.toString());
                    return Mono.just(List.of());
                })
                .doOnNext(session::recordFollowups);
    }

    static List<String> parseFollowups(String raw) {
        if (raw == null) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String line : raw.split("\\R")) {
            String s = LIST_MARKER.matcher(line).replaceFirst("").strip();
            if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) s = s.substring(1, s.length() - 1).strip();
            if (s.isEmpty() || s.length() > MAX_FOLLOWUP_CHARS) continue;
            out.add(s);
            if (out.size() == MAX_FOLLOWUPS) break;
        }
        return new ArrayList<>(out);
    }

    @Override
    public Mono<String> reformat(String answer, ReformatStyle style, String context, SessionContext session) {
        if (!StringUtils.hasText(answer) || style == null || !gateway.isConfigured()) {
            return Mono.justOrEmpty(answer).defaultIfEmpty("");
        }
        AiProperties.Budget budget = ai.getReformat();
        StringBuilder user = new StringBuilder("Rewrite the answer below as ").append(style.instruction()).append(".\n\n");
        if (StringUtils.hasText(context)) {
            user.append("[Context]\n").append(context).append("\n\n");
        }
        user.append("[Answer]\n").append(answer);

        CompletionRequest request = CompletionRequest.of(
                List.of(ChatTurn.system(REFORMAT_SYSTEM), ChatTurn.user(user.toString())),
                session.selectedModel(), budget.getMaxTokens(), budget.getTemperature());

        return gateway.call(request)
                .timeout(budget.getTimeout())
                .filter(StringUtils::hasText)
                .defaultIfEmpty(answer)
                .onErrorResume(e -> {
                    log.warn("[answer] reformat to {} failed, keeping original: {}", style, e.toString());
                    return Mono.just(answer);
                });
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return StringUtils.hasText(msg) ? msg : e.getClass().getSimpleName();
    }
}
