package com.itguru.ai.impl;

import com.itguru.ai.ChatTurn;
import com.itguru.ai.CompletionGateway;
import com.itguru.ai.CompletionNotConfiguredException;
import com.itguru.ai.CompletionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Spring AI adapter: maps {@link ChatTurn}s onto Spring AI messages and per-call
 * {@link OpenAiChatOptions}, and reduces responses to plain text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiCompletionGateway implements CompletionGateway {

    private static final int MAX_LOG_CONTENT_CHARS = 300;

    private final ObjectProvider<ChatModel> chatModelProvider;

    @Override
    public boolean isConfigured() {
        return chatModelProvider.getIfAvailable() != null;
    }

    @Override
    public Mono<String> call(CompletionRequest request) {
        return Mono.fromCallable(() -> executeCall(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<String> stream(CompletionRequest request) {
        return Flux.defer(() -> {
                    ChatModel model = requireModel();
                    Prompt prompt = toPrompt(request);
                    logOutgoing("stream", request);
                    return model.stream(prompt);
                })
                .map(SpringAiCompletionGateway::textOf)
                .filter(StringUtils::hasLength)
                .doOnError(e -> logHttpError("stream", e));
    }

    private String executeCall(CompletionRequest request) {
        ChatModel model = requireModel();
        Prompt prompt = toPrompt(request);
        logOutgoing("call", request);
        long t0 = System.nanoTime();
        try {
            ChatResponse response = model.call(prompt);
            String text = textOf(response);
            if (log.isDebugEnabled()) {
                log.debug("[completion] call done in {}ms, {} chars: {}",
                        (System.nanoTime() - t0) / 1_000_000, text.length(), preview(text));
            }
            return text;
        } catch (RuntimeException e) {
            logHttpError("call", e);
            throw e;
        }
    }

    private ChatModel requireModel() {
        ChatModel model = chatModelProvider.getIfAvailable();
        if (model == null) {
            throw new CompletionNotConfiguredException();
        }
        return model;
    }

    Prompt toPrompt(CompletionRequest request) {
        List<Message> messages = new ArrayList<>(request.messages().size());
        for (ChatTurn turn : request.messages()) {
            messages.add(mapToMessage(turn));
        }
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder();
        if (StringUtils.hasText(request.model())) options.model(request.model());
        if (request.maxTokens() != null) options.maxTokens(request.maxTokens());
        if (request.temperature() != null) options.temperature(request.temperature());
        return new Prompt(messages, options.build());
    }

    private static Message mapToMessage(ChatTurn turn) {
        String role = turn.role() == null ? "user" : turn.role().toLowerCase(Locale.ROOT);
        String content = turn.content() == null ? "" : turn.content();
        return switch (role) {
            case "system" -> new SystemMessage(content);
            case "assistant" -> new AssistantMessage(content);
            default -> new UserMessage(content);
        };
    }

    static String textOf(ChatResponse response) {
        if (response == null) return "";
        Generation generation = response.getResult();
        if (generation == null || generation.getOutput() == null) return "";
        String text = generation.getOutput().getText();
        return text == null ? "" : text;
    }

    private void logOutgoing(String mode, CompletionRequest request) {
        if (!log.isDebugEnabled()) return;
        ChatTurn last = request.messages().isEmpty() ? null : request.messages().get(request.messages().size() - 1);
        log.debug("[completion] {} model={} messages={} maxTokens={} temperature={} last={}",
                mode,
                StringUtils.hasText(request.model()) ? request.model() : "<default>",
                request.messages().size(),
                request.maxTokens(),
                request.temperature(),
                last == null ? "" : preview(last.content()));
    }

    private static void logHttpError(String mode, Throwable e) {
        if (e instanceof WebClientResponseException w) {
            log.warn("[completion] {} failed: HTTP {} body={}", mode, w.getStatusCode().value(),
                    preview(w.getResponseBodyAsString()));
        } else {
            log.warn("[completion] {} failed: {}", mode, e.toString());
        }
    }

    private static String preview(String s) {
        if (s == null) return "";
        return s.length() <= MAX_LOG_CONTENT_CHARS ? s : s.substring(0, MAX_LOG_CONTENT_CHARS) + "…";
    }
}
