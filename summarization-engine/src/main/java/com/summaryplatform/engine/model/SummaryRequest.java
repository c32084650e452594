package com.summaryplatform.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /api/v1/summaries}. An empty or missing {@code kinds}
 * list requests every summarizer.
 */
public record SummaryRequest(
    @JsonProperty("kinds") List<SummarizerKind> kinds,
    @JsonProperty("config") SummaryConfig config
) {
    public SummaryRequest {
        kinds = kinds == null ? List.of() : List.copyOf(kinds);
    }
}
