package com.summaryplatform.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.summaryplatform.common.exception.ConfigException;

import java.time.LocalDate;

/**
 * Input of every summarizer and the key of every cache slot. Two configs are
 * the same cache key iff all fields are equal by value.
 *
 * <p>Thresholds:
 * <ul>
 *   <li>{@code percentageThreshold}: minimum |% change| worth naming (default 5)</li>
 *   <li>{@code rateDiffThreshold}: minimum per-day rate difference worth naming (default 2)</li>
 *   <li>{@code weekdayQualifierThreshold}: weekday/weekend equality degree at or below
 *       which rate sentences are qualified with "of weekdays" (default 0.7)</li>
 * </ul>
 */
public record SummaryConfig(
    @JsonProperty("datasetId") String datasetId,
    @JsonProperty("metric") String metric,
    @JsonProperty("startDate") LocalDate startDate,
    @JsonProperty("endDate") LocalDate endDate,
    @JsonProperty("percentageThreshold") Double percentageThreshold,
    @JsonProperty("rateDiffThreshold") Double rateDiffThreshold,
    @JsonProperty("weekdayQualifierThreshold") Double weekdayQualifierThreshold
) {
    public static final double DEFAULT_PERCENTAGE_THRESHOLD = 5.0;
    public static final double DEFAULT_RATE_DIFF_THRESHOLD = 2.0;
    public static final double DEFAULT_WEEKDAY_QUALIFIER_THRESHOLD = 0.7;

    private static final String COMPONENT = "SummaryConfig";

    /**
     * Omitted thresholds (e.g. absent from a JSON body) fall back to their defaults.
     */
    public SummaryConfig {
        percentageThreshold = percentageThreshold != null ? percentageThreshold : DEFAULT_PERCENTAGE_THRESHOLD;
        rateDiffThreshold = rateDiffThreshold != null ? rateDiffThreshold : DEFAULT_RATE_DIFF_THRESHOLD;
        weekdayQualifierThreshold = weekdayQualifierThreshold != null
            ? weekdayQualifierThreshold : DEFAULT_WEEKDAY_QUALIFIER_THRESHOLD;
    }

    public static SummaryConfig of(String datasetId, String metric, LocalDate startDate, LocalDate endDate) {
        return new SummaryConfig(datasetId, metric, startDate, endDate, null, null, null);
    }

    public SummaryConfig withThresholds(double percentage, double rateDiff, double weekdayQualifier) {
        return new SummaryConfig(datasetId, metric, startDate, endDate, percentage, rateDiff, weekdayQualifier);
    }

    /**
     * Fails fast on malformed configs, before any cache slot is created.
     *
     * @return this config, for chaining
     * @throws ConfigException describing the first offending field
     */
    public SummaryConfig validate() {
        if (datasetId == null || datasetId.isBlank()) {
            throw new ConfigException(COMPONENT, "datasetId is required");
        }
        if (metric == null || metric.isBlank()) {
            throw new ConfigException(COMPONENT, "metric is required");
        }
        if (startDate == null || endDate == null) {
            throw new ConfigException(COMPONENT, "startDate and endDate are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ConfigException(COMPONENT, "endDate " + endDate + " is before startDate " + startDate);
        }
        if (!Double.isFinite(percentageThreshold) || percentageThreshold < 0) {
            throw new ConfigException(COMPONENT, "percentageThreshold must be a non-negative number");
        }
        if (!Double.isFinite(rateDiffThreshold) || rateDiffThreshold < 0) {
            throw new ConfigException(COMPONENT, "rateDiffThreshold must be a non-negative number");
        }
        if (!(weekdayQualifierThreshold >= 0 && weekdayQualifierThreshold <= 1)) {
            throw new ConfigException(COMPONENT, "weekdayQualifierThreshold must be within [0, 1]");
        }
        return this;
    }
}
