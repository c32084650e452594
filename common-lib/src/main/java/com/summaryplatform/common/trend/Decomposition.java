package com.summaryplatform.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.summaryplatform.common.model.NumericPoint;

import java.util.List;

/**
 * Result of an additive decomposition. All four lists are aligned: index
 * {@code i} of each list refers to the same retained input point, so
 * {@code observed[i].y == trend[i].y + seasonal[i].y + residual[i].y}.
 */
public record Decomposition(
    @JsonProperty("observed") List<NumericPoint> observed,
    @JsonProperty("trend") List<NumericPoint> trend,
    @JsonProperty("seasonal") List<NumericPoint> seasonal,
    @JsonProperty("residual") List<NumericPoint> residual
) {
    public Decomposition {
        observed = List.copyOf(observed);
        trend = List.copyOf(trend);
        seasonal = List.copyOf(seasonal);
        residual = List.copyOf(residual);
    }

    public static Decomposition empty() {
        return new Decomposition(List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return observed.size();
    }
}
