package com.sprintreport.infrastructure.cache;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * In-flight fetch map keyed by cache key.
 *
 * The first caller for a key submits the fetch; callers arriving while it runs get the
 * same future. The entry is removed before the future completes, so a caller that
 * observes the result and misses the cache again starts a new fetch.
 */
class SingleFlight {

    private final ConcurrentHashMap<String, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    <V> CompletableFuture<V> execute(String key, Supplier<V> fetch, Executor executor) {
        CompletableFuture<V> fresh = new CompletableFuture<>();
        CompletableFuture<?> existing = inFlight.putIfAbsent(key, fresh);
        if (existing != null) {
            // callers sharing a key share its value type
            return (CompletableFuture<V>) existing;
        }

        try {
            executor.execute(() -> {
                try {
                    V value = fetch.get();
                    inFlight.remove(key, fresh);
                    fresh.complete(value);
                } catch (Throwable t) {
                    inFlight.remove(key, fresh);
                    fresh.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, fresh);
            fresh.completeExceptionally(e);
        }
        return fresh;
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
