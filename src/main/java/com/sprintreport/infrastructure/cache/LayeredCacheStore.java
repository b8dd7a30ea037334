package com.sprintreport.infrastructure.cache;

import com.sprintreport.domain.model.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local tier checked before the shared tier.
 *
 * Shared-tier hits are back-filled into the local tier for the time the shared entry
 * has left, capped at {@code maxBackfillTtl}, so a local copy never outlives the
 * shared one. Writes and deletes go to both tiers; a shared-tier delete failure is
 * rethrown after the local tier has been cleared.
 */
@Slf4j
public class LayeredCacheStore implements CacheStore {

    private final CaffeineCacheStore local;
    private final SharedCacheTier shared;
    private final Duration maxBackfillTtl;
    private final CacheStatsCounter counter = new CacheStatsCounter();

    public LayeredCacheStore(CaffeineCacheStore local, SharedCacheTier shared, Duration maxBackfillTtl) {
        this.local = local;
        this.shared = shared;
        this.maxBackfillTtl = maxBackfillTtl;
    }

    @Override
    public <T> Optional<T> get(CacheKey<T> key) {
        Optional<T> value = local.get(key);
        if (value.isPresent()) {
            counter.hits.incrementAndGet();
            return value;
        }

        Optional<ExpiringValue<T>> fromShared = shared.getWithTtl(key);
        if (fromShared.isEmpty()) {
            counter.misses.incrementAndGet();
            return Optional.empty();
        }

        ExpiringValue<T> entry = fromShared.get();
        Duration ttl = backfillTtl(entry.getRemainingTtl());
        if (ttl != null) {
            local.set(key, entry.getValue(), ttl);
        }
        counter.hits.incrementAndGet();
        return Optional.ofNullable(entry.getValue());
    }

    @Override
    public <T> Map<CacheKey<T>, T> getMany(Collection<CacheKey<T>> keys) {
        Map<CacheKey<T>, T> found = new LinkedHashMap<>(local.getMany(keys));

        List<CacheKey<T>> missing = new ArrayList<>();
        for (CacheKey<T> key : keys) {
            if (!found.containsKey(key)) {
                missing.add(key);
            }
        }

        if (!missing.isEmpty()) {
            Map<CacheKey<T>, ExpiringValue<T>> fromShared = shared.getManyWithTtl(missing);
            List<CacheWrite<?>> backfill = new ArrayList<>();
            fromShared.forEach((key, entry) -> {
                found.put(key, entry.getValue());
                Duration ttl = backfillTtl(entry.getRemainingTtl());
                if (ttl != null) {
                    backfill.add(CacheWrite.of(key, entry.getValue(), ttl));
                }
            });
            if (!backfill.isEmpty()) {
                local.setMany(backfill);
            }
        }

        counter.hits.addAndGet(found.size());
        counter.misses.addAndGet(keys.size() - found.size());
        return found;
    }

    @Override
    public <T> void set(CacheKey<T> key, T value, Duration ttl) {
        local.set(key, value, ttl);
        shared.set(key, value, ttl);
        counter.sets.incrementAndGet();
    }

    @Override
    public void setMany(List<CacheWrite<?>> writes) {
        local.setMany(writes);
        shared.setMany(writes);
        counter.sets.addAndGet(writes.size());
    }

    @Override
    public boolean delete(CacheKey<?> key) {
        boolean removedLocally = local.delete(key);
        boolean removed = shared.delete(key) || removedLocally;
        if (removed) {
            counter.deletes.incrementAndGet();
        }
        return removed;
    }

    @Override
    public long deletePattern(String pattern) {
        long removedLocally = local.deletePattern(pattern);
        long removedShared = shared.deletePattern(pattern);
        long removed = Math.max(removedLocally, removedShared);
        counter.deletes.addAndGet(removed);
        return removed;
    }

    @Override
    public CacheStats stats() {
        CacheStats sharedStats = shared.stats();
        CacheStats stats = counter.snapshot(local.size(), true);
        stats.setErrors(stats.getErrors() + sharedStats.getErrors());
        return stats;
    }

    /**
     * Local TTL for a copy of a shared entry, or {@code null} when the entry is already
     * due to expire and should not be copied.
     */
    private Duration backfillTtl(Duration remaining) {
        if (remaining == null) {
            return maxBackfillTtl;
        }
        if (remaining.isNegative() || remaining.isZero()) {
            return null;
        }
        return remaining.compareTo(maxBackfillTtl) < 0 ? remaining : maxBackfillTtl;
    }
}
