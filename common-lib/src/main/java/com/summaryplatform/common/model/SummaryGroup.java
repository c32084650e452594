package com.summaryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Titled, ordered list of summaries produced by one summarizer. An empty list
 * means "no summary available" for the requested configuration.
 */
public record SummaryGroup(
    @JsonProperty("title") String title,
    @JsonProperty("summaries") List<Summary> summaries
) {
    public SummaryGroup {
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }

    public static SummaryGroup of(String title, List<Summary> summaries) {
        return new SummaryGroup(title, summaries);
    }

    public static SummaryGroup empty(String title) {
        return new SummaryGroup(title, List.of());
    }
}
