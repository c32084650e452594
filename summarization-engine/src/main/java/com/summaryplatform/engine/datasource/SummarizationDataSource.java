package com.summaryplatform.engine.datasource;

import com.summaryplatform.common.model.TimeSeriesPoint;
import com.summaryplatform.engine.cache.SingleFlightCache;
import com.summaryplatform.engine.model.SummaryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Entry point of every summarizer's data: fetches the configured series from the
 * {@link TimeSeriesSupplier} once per {@link TimeSeriesQuery} and replays it to
 * all services that need it.
 */
@Component
public class SummarizationDataSource {

    private static final Logger log = LoggerFactory.getLogger(SummarizationDataSource.class);

    private final TimeSeriesSupplier supplier;
    private final SingleFlightCache<TimeSeriesQuery, List<TimeSeriesPoint>> cache =
        new SingleFlightCache<>("SummarizationDataSource.points");

    public SummarizationDataSource(TimeSeriesSupplier supplier) {
        this.supplier = supplier;
    }

    public Mono<List<TimeSeriesPoint>> points(SummaryConfig config) {
        TimeSeriesQuery query = TimeSeriesQuery.from(config);
        return cache.get(query, q -> supplier.fetch(q)
            .map(List::copyOf)
            .doOnSuccess(points -> log.info("Series delivered. dataset={} metric={} points={}",
                q.datasetId(), q.metric(), points == null ? 0 : points.size())));
    }

    public void invalidate() {
        cache.invalidate();
    }
}
