package com.itguru.api.dto;

/** One fetched document; {@code excerpt} is already truncated. */
public record SourceResult(
        String title,
        String excerpt,
        String url,
        String source
) {}
