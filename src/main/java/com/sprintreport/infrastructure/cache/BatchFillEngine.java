package com.sprintreport.infrastructure.cache;

import com.sprintreport.infrastructure.upstream.UpstreamFetchException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Resolves a set of independent cache entries with one multi-get, parallel fetches
 * for the misses only, and one multi-set.
 *
 * Fill Flow:
 * 1. Render one key per distinct id and multi-get them
 * 2. Submit a fetch per miss on the bounded upstream executor
 * 3. Wait for every fetch
 * 4. Multi-set all fetched values under the caller's TTL
 * 5. Return hits and fetched values in the requested order
 *
 * Failure Handling:
 * - One failing fetch fails the whole batch with {@link UpstreamFetchException}
 * - Nothing from a failed batch is written
 *
 * Concurrent callers missing the same key share one upstream fetch.
 */
@Slf4j
@Component
public class BatchFillEngine {

    private final CacheStore cacheStore;
    private final Executor upstreamExecutor;
    private final MeterRegistry meterRegistry;
    private final SingleFlight singleFlight = new SingleFlight();

    public BatchFillEngine(CacheStore cacheStore,
                           @Qualifier("upstreamExecutor") Executor upstreamExecutor,
                           MeterRegistry meterRegistry) {
        this.cacheStore = cacheStore;
        this.upstreamExecutor = upstreamExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param ids      entities to resolve; duplicates are resolved once
     * @param keyFn    cache key of an entity
     * @param fetchOne upstream fetch of one entity
     * @param ttl      TTL for every value written back
     * @return values by id, in the order the ids were first requested
     */
    public <I, V> Map<I, V> fillBatch(List<I> ids,
                                      Function<I, CacheKey<V>> keyFn,
                                      Function<I, V> fetchOne,
                                      Duration ttl) {
        Map<I, CacheKey<V>> keys = new LinkedHashMap<>();
        for (I id : ids) {
            keys.computeIfAbsent(id, keyFn);
        }
        if (keys.isEmpty()) {
            return new LinkedHashMap<>();
        }

        Map<CacheKey<V>, V> hits = cacheStore.getMany(keys.values());

        Map<I, CompletableFuture<V>> pending = new LinkedHashMap<>();
        keys.forEach((id, key) -> {
            if (!hits.containsKey(key)) {
                pending.put(id, singleFlight.execute(key.getValue(), () -> fetchOne.apply(id), upstreamExecutor));
            }
        });

        recordKeys("hit", hits.size());
        recordKeys("miss", pending.size());
        log.debug("Batch fill: {} keys, {} hits, {} misses", keys.size(), hits.size(), pending.size());

        Map<I, V> fetched = awaitAll(pending);

        if (!fetched.isEmpty()) {
            List<CacheWrite<?>> writes = new ArrayList<>(fetched.size());
            fetched.forEach((id, value) -> writes.add(CacheWrite.of(keys.get(id), value, ttl)));
            cacheStore.setMany(writes);
        }

        Map<I, V> result = new LinkedHashMap<>();
        keys.forEach((id, key) -> {
            V value = hits.containsKey(key) ? hits.get(key) : fetched.get(id);
            if (value != null) {
                result.put(id, value);
            }
        });
        return result;
    }

    private <I, V> Map<I, V> awaitAll(Map<I, CompletableFuture<V>> pending) {
        Map<I, V> fetched = new LinkedHashMap<>();
        if (pending.isEmpty()) {
            return fetched;
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            recordKeys("error", pending.size());
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof UpstreamFetchException upstream) {
                throw upstream;
            }
            throw new UpstreamFetchException("batch-fill", "Batch fetch failed: " + cause.getMessage(), cause);
        }

        pending.forEach((id, future) -> {
            V value = future.join();
            if (value != null) {
                fetched.put(id, value);
            }
        });
        return fetched;
    }

    private void recordKeys(String result, int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("cache.batch.keys")
                .tag("result", result)
                .register(meterRegistry)
                .increment(count);
    }

    int inFlightCount() {
        return singleFlight.inFlightCount();
    }
}
