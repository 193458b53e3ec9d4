package com.itguru.service.impl;

import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.Intent;
import com.itguru.api.dto.IntentMethod;
import com.itguru.api.dto.Route;
import com.itguru.api.dto.ScopeMethod;
import com.itguru.api.dto.ScopeVerdict;
import com.itguru.api.dto.SourceResult;
import com.itguru.config.ScopeProperties;
import com.itguru.config.SourceProperties;
import com.itguru.service.IntentClassifier;
import com.itguru.session.SessionContext;
import com.itguru.sources.SourceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryRouterImplTest {

    @Mock
    private IntentClassifier classifier;
    @Mock
    private SourceClient aws;
    @Mock
    private SourceClient microsoft;
    @Mock
    private SourceClient web;

    private ScopeProperties scope;
    private SessionContext session;
    private QueryRouterImpl router;

    @BeforeEach
    void setUp() {
        lenient().when(aws.route()).thenReturn(Route.AWS_DOCS);
        lenient().when(microsoft.route()).thenReturn(Route.MICROSOFT_LEARN);
        lenient().when(web.route()).thenReturn(Route.WEB_SEARCH);
        scope = new ScopeProperties();
        session = new SessionContext("s-1", Schedulers.immediate());
        router = new QueryRouterImpl(classifier, List.of(aws, microsoft, web), scope, new SourceProperties());
    }

    @Test
    void outOfScopeNeverTouchesSources() {
        Intent refused = Intent.outOfScope(ScopeVerdict.refuse(ScopeMethod.KEYWORD, 0.95, "pizza"));
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(refused));

        StepVerifier.create(router.route("best pizza topping", session))
                .assertNext(ctx -> {
                    assertThat(ctx.intent().route()).isEqualTo(Route.OUT_OF_SCOPE);
                    assertThat(ctx.results()).isEmpty();
                    assertThat(ctx.contextText()).isEqualTo(ScopeProperties.DEFAULT_REFUSAL);
                    assertThat(ctx.multiSource()).isFalse();
                })
                .verifyComplete();

        verify(aws, never()).searchContent(anyString(), anyInt());
        verify(microsoft, never()).searchContent(anyString(), anyInt());
        verify(web, never()).searchContent(anyString(), anyInt());
    }

    @Test
    void customRefusalMessageIsUsed() {
        scope.setRefusalMessage("IT questions only, please.");
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(
                Intent.outOfScope(ScopeVerdict.refuse(ScopeMethod.KEYWORD, 0.95, "movie"))));

        StepVerifier.create(router.route("recommend a movie", session))
                .assertNext(ctx -> assertThat(ctx.contextText()).isEqualTo("IT questions only, please."))
                .verifyComplete();
    }

    @Test
    void generalKnowledgeHasNoResults() {
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(
                new Intent(Route.GENERAL_KNOWLEDGE, 0.9, IntentMethod.PATTERN_FALLBACK, "greeting")));

        StepVerifier.create(router.route("hello", session))
                .assertNext(ctx -> {
                    assertThat(ctx.results()).isEmpty();
                    assertThat(ctx.contextText()).isEqualTo(QueryRouterImpl.GENERAL_CONTEXT);
                })
                .verifyComplete();

        verify(web, never()).searchContent(anyString(), anyInt());
    }

    @Test
    void dispatchesToTheMatchingSourceOnly() {
        SourceResult doc = new SourceResult("Create a bucket", "Use the console...", "https://docs.aws.amazon.com/s3", "AWS Documentation");
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(
                new Intent(Route.AWS_DOCS, 0.7, IntentMethod.PATTERN_FALLBACK, "AWS-related query detected")));
        when(aws.searchContent(eq("create s3 bucket"), eq(3))).thenReturn(Mono.just(List.of(doc)));

        StepVerifier.create(router.route("create s3 bucket", session))
                .assertNext(ctx -> {
                    assertThat(ctx.results()).containsExactly(doc);
                    assertThat(ctx.contextText()).isEqualTo(
                            "**Create a bucket** (AWS Documentation)\nUse the console...\nURL: https://docs.aws.amazon.com/s3\n");
                })
                .verifyComplete();

        verify(microsoft, never()).searchContent(anyString(), anyInt());
        verify(web, never()).searchContent(anyString(), anyInt());
    }

    @Test
    void sessionModelReachesSourceThroughContext() {
        session.selectModel("openai/gpt-4o-mini");
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(
                new Intent(Route.WEB_SEARCH, 0.6, IntentMethod.PATTERN_FALLBACK, "General IT query")));
        when(web.searchContent(anyString(), anyInt())).thenReturn(Mono.deferContextual(ctx -> Mono.just(List.of(
                new SourceResult("Seen model", ctx.getOrDefault(SourceClient.MODEL_CONTEXT_KEY, "none"), "https://exa.ai", "Web Search")))));

        StepVerifier.create(router.route("zero trust rollout plan", session))
                .assertNext(ctx -> assertThat(ctx.results().get(0).excerpt()).isEqualTo("openai/gpt-4o-mini"))
                .verifyComplete();
    }

    @Test
    void sourceFailureIsRecordedAndTreatedAsNoResults() {
        when(classifier.classify(anyString(), any())).thenReturn(Mono.just(
                new Intent(Route.WEB_SEARCH, 0.6, IntentMethod.PATTERN_FALLBACK, "General IT query")));
        when(web.searchContent(anyString(), anyInt())).thenReturn(Mono.error(new IllegalStateException("exa down")));

        StepVerifier.create(router.route("latest openssl cve", session))
                .assertNext(ctx -> {
                    assertThat(ctx.intent().route()).isEqualTo(Route.WEB_SEARCH);
                    assertThat(ctx.results()).isEmpty();
                    assertThat(ctx.contextText()).isEmpty();
                })
                .verifyComplete();

        assertThat(session.errors()).containsExactly("Routing error: exa down");
    }

    @Test
    void classifierErrorDegradesToKeywordIntent() {
        when(classifier.classify(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("guard broke")));
        when(classifier.fallback("create s3 bucket")).thenReturn(
                new Intent(Route.AWS_DOCS, 0.7, IntentMethod.PATTERN_FALLBACK, "AWS-related query detected"));

        StepVerifier.create(router.route("create s3 bucket", session))
                .assertNext(ctx -> {
                    assertThat(ctx.intent().route()).isEqualTo(Route.AWS_DOCS);
                    assertThat(ctx.results()).isEmpty();
                })
                .verifyComplete();

        assertThat(session.errors()).hasSize(1);
    }

    @Test
    void duplicateRouteRegistrationIsRejected() {
        SourceClient second = mock(SourceClient.class);
        when(second.route()).thenReturn(Route.AWS_DOCS);

        assertThatThrownBy(() -> new QueryRouterImpl(classifier, List.of(aws, second), scope, new SourceProperties()))
                .isInstanceOf(IllegalStateException.class);
    }
}
