package com.summaryplatform.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Least-squares line {@code y = gradient * x + intercept}.
 */
public record LinearModel(
    @JsonProperty("gradient") double gradient,
    @JsonProperty("intercept") double intercept
) {
    public double predict(double x) {
        return gradient * x + intercept;
    }
}
