package com.summaryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One observation of a time series as delivered by a data supplier.
 */
public record TimeSeriesPoint(
    @JsonProperty("x") Instant x,
    @JsonProperty("y") double y
) {
    public static TimeSeriesPoint of(Instant x, double y) {
        return new TimeSeriesPoint(x, y);
    }
}
