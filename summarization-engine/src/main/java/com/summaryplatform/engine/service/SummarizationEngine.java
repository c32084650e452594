package com.summaryplatform.engine.service;

import com.summaryplatform.common.exception.ConfigException;
import com.summaryplatform.common.exception.CyclicDependencyException;
import com.summaryplatform.common.model.SummaryGroup;
import com.summaryplatform.engine.datasource.SummarizationDataSource;
import com.summaryplatform.engine.model.SummarizerKind;
import com.summaryplatform.engine.model.SummaryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the summarization services and their caches.
 *
 * <p>At construction the service dependency graph is walked depth-first and a
 * {@link CyclicDependencyException} is thrown if any service (transitively)
 * depends on itself. {@link #invalidate()} resets every cache for session
 * teardown.
 */
@Service
public class SummarizationEngine {

    private static final Logger log = LoggerFactory.getLogger(SummarizationEngine.class);

    private final Map<SummarizerKind, SummarizationService<?>> services = new EnumMap<>(SummarizerKind.class);
    private final SummarizationDataSource dataSource;

    public SummarizationEngine(List<SummarizationService<?>> services, SummarizationDataSource dataSource) {
        verifyAcyclic(services);
        for (SummarizationService<?> service : services) {
            SummarizationService<?> previous = this.services.put(service.kind(), service);
            if (previous != null && previous != service) {
                throw new IllegalStateException("Two services registered for " + service.kind()
                    + ": " + previous.name() + ", " + service.name());
            }
        }
        this.dataSource = dataSource;
        log.info("Summarization engine ready. services={}", this.services.keySet());
    }

    /**
     * Summary groups of the requested kinds, in request order. An empty list
     * requests every registered kind. All services run concurrently; the result
     * is emitted once all of them resolved.
     */
    public Mono<List<SummaryGroup>> summaries(List<SummarizerKind> kinds, SummaryConfig config) {
        config.validate();
        List<SummarizerKind> requested = kinds == null || kinds.isEmpty()
            ? new ArrayList<>(services.keySet())
            : kinds;
        requested.forEach(this::service);

        log.info("Summaries requested. kinds={} config={}", requested, config);
        return Flux.fromIterable(requested)
            .flatMapSequential(kind -> service(kind).summaries(config))
            .flatMapIterable(groups -> groups)
            .collectList()
            .doOnSuccess(groups -> log.info("Summaries complete. groups={} dataset={}",
                groups == null ? 0 : groups.size(), config.datasetId()));
    }

    public Mono<Object> properties(SummarizerKind kind, SummaryConfig config) {
        return service(kind).properties(config).cast(Object.class);
    }

    public SummarizationService<?> service(SummarizerKind kind) {
        SummarizationService<?> service = services.get(kind);
        if (service == null) {
            throw new ConfigException("SummarizationEngine", "No summarizer registered for " + kind);
        }
        return service;
    }

    public Collection<SummarizerKind> kinds() {
        return services.keySet();
    }

    /**
     * Session teardown: clears every cache and cancels in-flight computations.
     */
    public void invalidate() {
        log.info("Invalidating summarization caches. services={}", services.size());
        services.values().forEach(SummarizationService::invalidate);
        dataSource.invalidate();
    }

    // ── Dependency graph ────────────────────────────────────────────

    private enum Mark { VISITING, DONE }

    /**
     * Depth-first walk over {@link SummarizationService#upstream()} edges.
     *
     * @throws CyclicDependencyException naming the services on the cycle
     */
    static void verifyAcyclic(Collection<? extends SummarizationService<?>> roots) {
        Map<SummarizationService<?>, Mark> marks = new IdentityHashMap<>();
        for (SummarizationService<?> root : roots) {
            visit(root, marks, new ArrayList<>());
        }
    }

    private static void visit(SummarizationService<?> service,
                              Map<SummarizationService<?>, Mark> marks,
                              List<SummarizationService<?>> path) {
        Mark mark = marks.get(service);
        if (mark == Mark.DONE) return;
        if (mark == Mark.VISITING) {
            List<String> cycle = new ArrayList<>();
            for (SummarizationService<?> s : path.subList(path.indexOf(service), path.size())) {
                cycle.add(s.name());
            }
            cycle.add(service.name());
            throw new CyclicDependencyException("SummarizationEngine", cycle);
        }

        marks.put(service, Mark.VISITING);
        path.add(service);
        for (SummarizationService<?> upstream : service.upstream()) {
            visit(upstream, marks, path);
        }
        path.remove(path.size() - 1);
        marks.put(service, Mark.DONE);
    }
}
