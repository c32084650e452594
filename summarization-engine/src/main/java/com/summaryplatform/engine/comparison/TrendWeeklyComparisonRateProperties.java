package com.summaryplatform.engine.comparison;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Regression gradient (per day) of each fitted week, plus the weekday/weekend
 * equality degree used to qualify the sentences.
 */
public record TrendWeeklyComparisonRateProperties(
    @JsonProperty("weekRates") List<Double> weekRates,
    @JsonProperty("weekdayWeekendEqualValidity") double weekdayWeekendEqualValidity
) {
    public TrendWeeklyComparisonRateProperties {
        weekRates = List.copyOf(weekRates);
    }
}
