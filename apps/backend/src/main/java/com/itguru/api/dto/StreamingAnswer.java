package com.itguru.api.dto;

import reactor.core.publisher.Flux;

/**
 * Lazy answer stream. The sources block is not known until routing finishes, so the
 * placeholder is empty and the rendered block lands in the session afterwards.
 */
public record StreamingAnswer(Flux<String> fragments, String sourcesMarkdownPlaceholder) {}
