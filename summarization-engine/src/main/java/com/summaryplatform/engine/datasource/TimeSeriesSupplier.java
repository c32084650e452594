package com.summaryplatform.engine.datasource;

import com.summaryplatform.common.model.TimeSeriesPoint;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface for the collaborator that delivers raw observations.
 */
public interface TimeSeriesSupplier {
    Mono<List<TimeSeriesPoint>> fetch(TimeSeriesQuery query);
}
