package com.itguru.config;

import com.itguru.support.HttpConnectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the OpenAI-compatible {@link ChatModel} only when an API key is present,
 * so the service starts (and answers with a configuration notice) without one.
 */
@Configuration
@Slf4j
public class CompletionModelConfig {

    @Bean
    @Conditional(ApiKeyPresent.class)
    public ChatModel completionChatModel(AiProperties props) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(props.getBaseUrl())
                .apiKey(props.getApiKey())
                .webClientBuilder(WebClient.builder().clientConnector(HttpConnectors.connector("completion", null)))
                .build();

        Map<String, String> headers = new LinkedHashMap<>();
        if (StringUtils.hasText(props.getReferer())) headers.put("HTTP-Referer", props.getReferer());
        if (StringUtils.hasText(props.getTitle())) headers.put("X-Title", props.getTitle());

        OpenAiChatOptions defaults = OpenAiChatOptions.builder()
                .model(props.getModel())
                .maxTokens(props.getMaxTokens())
                .temperature(props.getTemperature())
                .httpHeaders(headers)
                .build();

        log.info("[completion] chat model ready baseUrl={} model={} key=<set>", props.getBaseUrl(), props.getModel());
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(defaults)
                .build();
    }

    static class ApiKeyPresent implements Condition {
        @Override
        public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
            boolean present = StringUtils.hasText(context.getEnvironment().getProperty("itguru.ai.api-key"));
            if (!present) {
                log.warn("[completion] itguru.ai.api-key is empty; answers will carry a configuration notice");
            }
            return present;
        }
    }
}
