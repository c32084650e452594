package com.summaryplatform.engine.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Mean of each week, chronological.
 */
public record TrendWeeklyComparisonAverageProperties(
    @JsonProperty("weekYAverages") List<Double> weekYAverages
) {
    public TrendWeeklyComparisonAverageProperties {
        weekYAverages = List.copyOf(weekYAverages);
    }
}
