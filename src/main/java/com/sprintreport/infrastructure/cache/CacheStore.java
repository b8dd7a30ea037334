package com.sprintreport.infrastructure.cache;

import com.sprintreport.domain.model.CacheStats;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store with per-entry TTL.
 *
 * Reads fail open: an unreachable store is a miss. Writes never throw.
 * Deletes throw {@link CacheStoreException} so callers can account for each
 * key or pattern separately.
 */
public interface CacheStore {

    <T> Optional<T> get(CacheKey<T> key);

    /**
     * Returns only the keys that were found.
     */
    <T> Map<CacheKey<T>, T> getMany(Collection<CacheKey<T>> keys);

    <T> void set(CacheKey<T> key, T value, Duration ttl);

    void setMany(List<CacheWrite<?>> writes);

    boolean delete(CacheKey<?> key);

    /**
     * Deletes every key matching a glob pattern ({@code *} and {@code ?}).
     *
     * @return number of entries removed
     */
    long deletePattern(String pattern);

    CacheStats stats();
}
