package com.sprintreport.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.sprintreport.domain.model.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * In-process cache tier backed by Caffeine.
 *
 * Every entry carries its own expiry. When this tier sits in front of Redis the
 * TTL is capped ({@code maxTtl}) so local copies never outlive a shared-tier
 * invalidation by much; standalone it honours the requested TTL.
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, Entry> cache;
    private final Duration maxTtl;
    private final CacheStatsCounter counter = new CacheStatsCounter();

    public CaffeineCacheStore(long maximumSize, Duration maxTtl) {
        this(maximumSize, maxTtl, Ticker.systemTicker());
    }

    /**
     * @param maxTtl upper bound for entry TTLs, or {@code null} for none
     */
    public CaffeineCacheStore(long maximumSize, Duration maxTtl, Ticker ticker) {
        this.maxTtl = maxTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public <T> Optional<T> get(CacheKey<T> key) {
        Entry entry = cache.getIfPresent(key.getValue());
        if (entry == null) {
            counter.misses.incrementAndGet();
            log.debug("Local cache miss for key: {}", key);
            return Optional.empty();
        }
        counter.hits.incrementAndGet();
        log.debug("Local cache hit for key: {}", key);
        return Optional.of((T) entry.value);
    }

    @Override
    public <T> Map<CacheKey<T>, T> getMany(Collection<CacheKey<T>> keys) {
        Map<CacheKey<T>, T> found = new LinkedHashMap<>();
        for (CacheKey<T> key : keys) {
            Entry entry = cache.getIfPresent(key.getValue());
            if (entry != null) {
                found.put(key, (T) entry.value);
            }
        }
        counter.hits.addAndGet(found.size());
        counter.misses.addAndGet(keys.size() - found.size());
        return found;
    }

    @Override
    public <T> void set(CacheKey<T> key, T value, Duration ttl) {
        if (value == null) {
            return;
        }
        cache.put(key.getValue(), new Entry(value, effectiveTtl(ttl)));
        counter.sets.incrementAndGet();
    }

    @Override
    public void setMany(List<CacheWrite<?>> writes) {
        for (CacheWrite<?> write : writes) {
            if (write.getValue() != null) {
                cache.put(write.getKey().getValue(), new Entry(write.getValue(), effectiveTtl(write.getTtl())));
                counter.sets.incrementAndGet();
            }
        }
    }

    @Override
    public boolean delete(CacheKey<?> key) {
        boolean removed = cache.asMap().remove(key.getValue()) != null;
        if (removed) {
            counter.deletes.incrementAndGet();
        }
        return removed;
    }

    @Override
    public long deletePattern(String pattern) {
        Pattern matcher = KeyPatterns.compile(pattern);
        long removed = 0;
        for (String key : new ArrayList<>(cache.asMap().keySet())) {
            if (matcher.matcher(key).matches() && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        counter.deletes.addAndGet(removed);
        log.debug("Local cache removed {} entries for pattern: {}", removed, pattern);
        return removed;
    }

    @Override
    public CacheStats stats() {
        return counter.snapshot(size(), false);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    Duration getMaxTtl() {
        return maxTtl;
    }

    private Duration effectiveTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (maxTtl != null && ttl.compareTo(maxTtl) > 0) {
            return maxTtl;
        }
        return ttl;
    }

    private static final class Entry {

        private final Object value;
        private final Duration ttl;

        private Entry(Object value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
