package com.itguru.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.itguru.support.HttpConnectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Slf4j
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Shared client for the knowledge sources. Requests use absolute URLs, so one
     * instance serves all three backends.
     */
    @Bean
    public WebClient sourceWebClient(SourceProperties props) {
        ExchangeFilterFunction timing = (request, next) -> {
            long t0 = System.nanoTime();
            return next.exchange(request)
                    .doOnNext(resp -> log.debug("[http] {} {} -> {} in {}ms",
                            request.method(), request.url(), resp.statusCode().value(),
                            (System.nanoTime() - t0) / 1_000_000));
        };

        return WebClient.builder()
                .clientConnector(HttpConnectors.connector("sources", props.getTimeout()))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .filter(timing)
                .build();
    }
}
