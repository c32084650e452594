package com.summaryplatform.engine.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Reactive memoizing cache with single-flight semantics, one slot per key.
 *
 * <p><strong>Compute Once → Replay Many:</strong> the first request for a key
 * installs a {@code Mono.defer(loader).cache()} in the slot; every later or
 * concurrent request for a value-equal key receives that same {@code Mono} and
 * therefore the same result, in subscription order. A slot is write-once:
 * completed results (and failures) are never replaced.
 *
 * <p>There is no TTL. {@link #invalidate()} is the only eviction: it swaps in a
 * fresh generation of slots and fires the old generation's teardown signal, so
 * any computation still in flight for the old generation completes empty
 * (cancelling its downstream awaiters) instead of publishing stale output.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap#computeIfAbsent}. No blocking calls.
 *
 * @param <K> key type; must have value-based {@code equals}/{@code hashCode}
 * @param <V> cached value type
 */
public final class SingleFlightCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightCache.class);

    private final String name;
    private final AtomicReference<Generation<K, V>> generation = new AtomicReference<>(new Generation<>());

    public SingleFlightCache(String name) {
        this.name = name;
    }

    /**
     * Returns the shared computation for {@code key}, starting it lazily with
     * {@code loader} if this is the first request in the current generation.
     */
    public Mono<V> get(K key, Function<K, Mono<V>> loader) {
        Generation<K, V> current = generation.get();

        Mono<V> cached = current.slots.get(key);
        if (cached != null) {
            log.debug("CACHE_HIT cache={} key={}", name, key);
            return cached;
        }

        return current.slots.computeIfAbsent(key, k -> {
            log.info("CACHE_MISS cache={} key={}", name, k);
            return Mono.defer(() -> loader.apply(k))
                .takeUntilOther(current.teardown.asMono())
                .doOnError(e -> log.warn("CACHE_FAILED cache={} key={} error={}", name, k, e.getMessage()))
                .cache();
        });
    }

    /**
     * Drops every slot and cancels computations still in flight.
     */
    public void invalidate() {
        Generation<K, V> old = generation.getAndSet(new Generation<>());
        old.teardown.tryEmitValue(Boolean.TRUE);
        log.info("CACHE_INVALIDATE cache={} evicted={}", name, old.slots.size());
    }

    public boolean contains(K key) {
        return generation.get().slots.containsKey(key);
    }

    public int size() {
        return generation.get().slots.size();
    }

    public String name() {
        return name;
    }

    private static final class Generation<K, V> {
        private final Map<K, Mono<V>> slots = new ConcurrentHashMap<>();
        private final Sinks.One<Boolean> teardown = Sinks.one();
    }
}
