package com.summaryplatform.engine.service;

import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.engine.cache.SingleFlightCache;
import com.summaryplatform.engine.model.SummarizerKind;
import com.summaryplatform.engine.model.SummaryConfig;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Contract every summarizer implements.
 *
 * <p>Both {@link #properties(SummaryConfig)} and {@link #summaries(SummaryConfig)}
 * are memoized per config through a {@link SingleFlightCache}: value-equal
 * configs share one computation, concurrent first requests collapse into a
 * single flight, and results are replayed to every requester.
 *
 * <p>Subclasses implement {@link #createProperties(SummaryConfig)} and
 * {@link #createSummaries(SummaryConfig)}. They may call upstream services'
 * {@code properties} with the same config; every such upstream must be listed
 * in {@link #upstream()} so {@link SummarizationEngine} can reject cycles.
 *
 * @param <P> immutable properties record computed by this service
 */
public abstract class SummarizationService<P> {

    private final SingleFlightCache<SummaryConfig, P> propertiesCache;
    private final SingleFlightCache<SummaryConfig, List<SummaryGroup>> summariesCache;

    protected SummarizationService() {
        String name = getClass().getSimpleName();
        this.propertiesCache = new SingleFlightCache<>(name + ".properties");
        this.summariesCache  = new SingleFlightCache<>(name + ".summaries");
    }

    public abstract SummarizerKind kind();

    /**
     * Services whose {@code properties} this service consumes.
     */
    public List<SummarizationService<?>> upstream() {
        return List.of();
    }

    /**
     * Derived aggregate for {@code config}; computed once per distinct config.
     *
     * @throws com.summaryplatform.common.exception.ConfigException synchronously for malformed configs
     */
    public final Mono<P> properties(SummaryConfig config) {
        return propertiesCache.get(config.validate(), this::createProperties);
    }

    /**
     * Text summaries for {@code config}; computed once per distinct config.
     *
     * @throws com.summaryplatform.common.exception.ConfigException synchronously for malformed configs
     */
    public final Mono<List<SummaryGroup>> summaries(SummaryConfig config) {
        return summariesCache.get(config.validate(), this::createSummaries);
    }

    /**
     * Drops this service's cached properties and summaries and cancels their
     * in-flight computations.
     */
    public void invalidate() {
        propertiesCache.invalidate();
        summariesCache.invalidate();
    }

    public String name() {
        return getClass().getSimpleName();
    }

    protected String title() {
        return kind().title();
    }

    protected abstract Mono<P> createProperties(SummaryConfig config);

    protected abstract Mono<List<SummaryGroup>> createSummaries(SummaryConfig config);
}
