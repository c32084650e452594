package com.summaryplatform.engine.datasource;

import com.summaryplatform.engine.model.SummaryConfig;

import java.time.LocalDate;

/**
 * Dataset/date-range selection handed to a {@link TimeSeriesSupplier}. Configs
 * that differ only in thresholds map to the same query and share one fetch.
 */
public record TimeSeriesQuery(
    String datasetId,
    String metric,
    LocalDate startDate,
    LocalDate endDate
) {
    public static TimeSeriesQuery from(SummaryConfig config) {
        return new TimeSeriesQuery(config.datasetId(), config.metric(), config.startDate(), config.endDate());
    }
}
