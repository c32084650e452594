package com.summaryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Timestamp-normalized point used by the numeric routines. For time series
 * {@code x} is measured in days since the epoch.
 */
public record NumericPoint(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y
) {
    public static NumericPoint of(double x, double y) {
        return new NumericPoint(x, y);
    }
}
