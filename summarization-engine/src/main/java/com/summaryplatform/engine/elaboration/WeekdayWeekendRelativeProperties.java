package com.summaryplatform.engine.elaboration;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weekday versus weekend behaviour of a series.
 *
 * <p>{@code weekdayWeekendEqualValidity} is the degree, in [0, 1], to which
 * weekdays and weekends are indistinguishable. Means of an empty subset are 0
 * and the subset's count tells them apart from a real 0.
 */
public record WeekdayWeekendRelativeProperties(
    @JsonProperty("weekdayCount") int weekdayCount,
    @JsonProperty("weekendCount") int weekendCount,
    @JsonProperty("weekdayMean") double weekdayMean,
    @JsonProperty("weekendMean") double weekendMean,
    @JsonProperty("normalizedDifference") double normalizedDifference,
    @JsonProperty("weekdayWeekendEqualValidity") double weekdayWeekendEqualValidity
) {
    public boolean comparable() {
        return weekdayCount > 0 && weekendCount > 0;
    }
}
