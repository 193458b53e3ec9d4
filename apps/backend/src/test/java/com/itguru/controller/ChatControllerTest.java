package com.itguru.controller;

import com.itguru.api.dto.AnswerResult;
import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.Intent;
import com.itguru.api.dto.IntentMethod;
import com.itguru.api.dto.ReformatStyle;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.StreamingAnswer;
import com.itguru.config.AnswerProperties;
import com.itguru.config.SessionProperties;
import com.itguru.service.HistorySummarizer;
import com.itguru.service.ResponseOrchestrator;
import com.itguru.session.SessionContext;
import com.itguru.session.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock
    private ResponseOrchestrator orchestrator;

    private SessionRegistry sessions;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        sessions = new SessionRegistry(new SessionProperties());
        ChatController chat = new ChatController(orchestrator, sessions, new HistorySummarizer(new AnswerProperties()));
        SessionController session = new SessionController(sessions);
        client = WebTestClient.bindToController(chat, session).build();
    }

    @AfterEach
    void tearDown() {
        sessions.shutdown();
    }

    private static EnhancedContext awsContext() {
        return new EnhancedContext(new Intent(Route.AWS_DOCS, 0.7, IntentMethod.PATTERN_FALLBACK, "AWS-related query detected"),
                List.of(), "", false);
    }

    @Test
    void blockingChatReturnsAnswerAndIntent() {
        when(orchestrator.answerQuery(eq("create a vpc"), anyString(), any(SessionContext.class)))
                .thenAnswer(inv -> {
                    SessionContext s = inv.getArgument(2);
                    s.recordRouting(awsContext(), "");
                    return Mono.just(new AnswerResult("Open the VPC console.", ""));
                });

        client.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"sessionId\":\"abc\",\"query\":\"create a vpc\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessionId").isEqualTo("abc")
                .jsonPath("$.answer").isEqualTo("Open the VPC console.")
                .jsonPath("$.intent.source").isEqualTo("aws_docs")
                .jsonPath("$.intent.method").isEqualTo("pattern-fallback");
    }

    @Test
    void rawMessagesAreSummarizedIntoHistory() {
        when(orchestrator.answerQuery(anyString(), anyString(), any(SessionContext.class)))
                .thenReturn(Mono.just(new AnswerResult("ok", "")));

        client.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"and for subnets?\",\"messages\":[{\"role\":\"user\",\"content\":\"create a vpc\"}]}")
                .exchange()
                .expectStatus().isOk();

        verify(orchestrator).answerQuery(eq("and for subnets?"), eq("Human: create a vpc..."), any(SessionContext.class));
    }

    @Test
    void blankQueryIsRejected() {
        client.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"query\":\"  \"}")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(orchestrator);
    }

    @Test
    void streamEndsWithSourcesEvent() {
        when(orchestrator.streamAnswerQuery(anyString(), anyString(), any(SessionContext.class)))
                .thenAnswer(inv -> {
                    SessionContext s = inv.getArgument(2);
                    Flux<String> fragments = Flux.defer(() -> {
                        s.recordRouting(awsContext(), "\n\n**📚 Sources:**\n1. [VPC](https://docs.aws.amazon.com/vpc/)");
                        return Flux.just("", "Open ", "the console.");
                    });
                    return new StreamingAnswer(fragments, "");
                });

        List<ServerSentEvent<String>> events = client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue("{\"sessionId\":\"s-9\",\"query\":\"create a vpc\"}")
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
                .getResponseBody()
                .collectList()
                .block();

        assertThat(events).isNotNull();
        ServerSentEvent<String> last = events.get(events.size() - 1);
        assertThat(last.event()).isEqualTo("sources");
        assertThat(last.data()).contains("[VPC](https://docs.aws.amazon.com/vpc/)");
        assertThat(events.subList(0, events.size() - 1)).allSatisfy(e -> assertThat(e.event()).isEqualTo("delta"));
    }

    @Test
    void followupsAndReformat() {
        when(orchestrator.generateFollowups(anyString(), anyString(), any(), any(SessionContext.class)))
                .thenReturn(Mono.just(List.of("How do I add a subnet?")));
        when(orchestrator.reformat(anyString(), eq(ReformatStyle.STEP_BY_STEP), any(), any(SessionContext.class)))
                .thenReturn(Mono.just("1. Open the console"));

        client.post().uri("/api/chat/followups")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"sessionId\":\"f-1\",\"query\":\"create a vpc\",\"answer\":\"Open the console.\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.followups[0]").isEqualTo("How do I add a subnet?");

        client.post().uri("/api/chat/reformat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"sessionId\":\"f-1\",\"answer\":\"Open the console.\",\"style\":\"step_by_step\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("1. Open the console");
    }

    @Test
    void sessionEndpoints() {
        client.get().uri("/api/sessions/{id}", "missing")
                .exchange()
                .expectStatus().isNotFound();

        client.put().uri("/api/sessions/{id}/model", "m-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"openai/gpt-4o-mini\"}")
                .exchange()
                .expectStatus().isOk();

        client.get().uri("/api/sessions/{id}", "m-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.selectedModel").isEqualTo("openai/gpt-4o-mini");

        assertThat(sessions.find("m-1")).isPresent();
    }
}
