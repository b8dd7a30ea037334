package com.sprintreport.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sprintreport.domain.model.CacheStats;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Shared cache tier on Redis.
 *
 * Values are stored as JSON strings. Batched reads use MGET, batched writes a
 * single pipeline, pattern deletes SCAN (never KEYS) followed by batched DEL.
 * Reads with TTL add PTTL, pipelined for batches.
 *
 * Failure Handling:
 * - Circuit breaker "redis" keeps an unreachable Redis from slowing every request
 * - Reads degrade to a miss, writes are logged and dropped
 * - Deletes surface {@link CacheStoreException}
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.cache.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisCacheStore implements SharedCacheTier {

    private static final int SCAN_COUNT = 100;
    private static final int DELETE_BATCH_SIZE = 1000;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CacheStatsCounter counter = new CacheStatsCounter();

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(CacheKey<T> key) {
        String cached = redisTemplate.opsForValue().get(key.getValue());

        if (cached == null) {
            counter.misses.incrementAndGet();
            log.debug("Redis miss for key: {}", key);
            return Optional.empty();
        }

        Optional<T> value = deserialize(key, cached);
        if (value.isPresent()) {
            counter.hits.incrementAndGet();
            log.debug("Redis hit for key: {}", key);
        } else {
            counter.misses.incrementAndGet();
        }
        return value;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getManyFallback")
    public <T> Map<CacheKey<T>, T> getMany(Collection<CacheKey<T>> keys) {
        Map<CacheKey<T>, T> found = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return found;
        }

        List<CacheKey<T>> ordered = new ArrayList<>(keys);
        List<String> rendered = ordered.stream().map(CacheKey::getValue).toList();
        List<String> values = redisTemplate.opsForValue().multiGet(rendered);

        if (values == null) {
            counter.misses.addAndGet(ordered.size());
            return found;
        }

        for (int i = 0; i < ordered.size(); i++) {
            CacheKey<T> key = ordered.get(i);
            String json = values.get(i);
            if (json != null) {
                deserialize(key, json).ifPresent(value -> found.put(key, value));
            }
        }

        counter.hits.addAndGet(found.size());
        counter.misses.addAndGet(ordered.size() - found.size());
        log.debug("Redis multi-get: {} of {} keys found", found.size(), ordered.size());
        return found;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getWithTtlFallback")
    public <T> Optional<ExpiringValue<T>> getWithTtl(CacheKey<T> key) {
        Optional<T> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Long pttl = redisTemplate.getExpire(key.getValue(), TimeUnit.MILLISECONDS);
        return Optional.of(new ExpiringValue<>(value.get(), remainingTtl(pttl)));
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getManyWithTtlFallback")
    public <T> Map<CacheKey<T>, ExpiringValue<T>> getManyWithTtl(Collection<CacheKey<T>> keys) {
        Map<CacheKey<T>, ExpiringValue<T>> found = new LinkedHashMap<>();
        Map<CacheKey<T>, T> values = getMany(keys);
        if (values.isEmpty()) {
            return found;
        }

        List<byte[]> rendered = values.keySet().stream()
                .map(key -> key.getValue().getBytes(StandardCharsets.UTF_8))
                .toList();
        List<Object> ttls = redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            rendered.forEach(key -> connection.keyCommands().pTtl(key, TimeUnit.MILLISECONDS));
            return null;
        });

        int i = 0;
        for (Map.Entry<CacheKey<T>, T> entry : values.entrySet()) {
            Object pttl = i < ttls.size() ? ttls.get(i) : null;
            found.put(entry.getKey(), new ExpiringValue<>(entry.getValue(),
                    remainingTtl(pttl instanceof Long millis ? millis : null)));
            i++;
        }
        return found;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public <T> void set(CacheKey<T> key, T value, Duration ttl) {
        if (value == null) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key.getValue(), json, ttl);
            counter.sets.incrementAndGet();
            log.debug("Cached key: {} (TTL: {}ms)", key, ttl.toMillis());
        } catch (JsonProcessingException e) {
            counter.errors.incrementAndGet();
            log.error("Error serializing value for key {}: {}", key, e.getMessage());
        }
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setManyFallback")
    public void setMany(List<CacheWrite<?>> writes) {
        Map<String, PendingWrite> serialized = new LinkedHashMap<>();
        for (CacheWrite<?> write : writes) {
            if (write.getValue() == null) {
                continue;
            }
            try {
                serialized.put(write.getKey().getValue(),
                        new PendingWrite(objectMapper.writeValueAsString(write.getValue()), write.getTtl()));
            } catch (JsonProcessingException e) {
                counter.errors.incrementAndGet();
                log.error("Error serializing value for key {}: {}", write.getKey(), e.getMessage());
            }
        }
        if (serialized.isEmpty()) {
            return;
        }

        redisTemplate.executePipelined(new SessionCallback<Object>() {
            @Override
            public <K, V> Object execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                serialized.forEach((key, write) -> ops.opsForValue().set(key, write.json, write.ttl));
                return null;
            }
        });

        counter.sets.addAndGet(serialized.size());
        log.debug("Redis pipelined multi-set of {} keys", serialized.size());
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deleteFallback")
    public boolean delete(CacheKey<?> key) {
        boolean removed = Boolean.TRUE.equals(redisTemplate.delete(key.getValue()));
        if (removed) {
            counter.deletes.incrementAndGet();
        }
        log.debug("Invalidated key: {} (removed: {})", key, removed);
        return removed;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deletePatternFallback")
    public long deletePattern(String pattern) {
        List<String> matched = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(matched::add);
        }

        long removed = 0;
        for (int i = 0; i < matched.size(); i += DELETE_BATCH_SIZE) {
            List<String> batch = matched.subList(i, Math.min(i + DELETE_BATCH_SIZE, matched.size()));
            Long deleted = redisTemplate.delete(batch);
            removed += deleted != null ? deleted : 0;
        }

        counter.deletes.addAndGet(removed);
        log.debug("Redis removed {} keys for pattern: {}", removed, pattern);
        return removed;
    }

    @Override
    public CacheStats stats() {
        return counter.snapshot(0, true);
    }

    private <T> Optional<T> deserialize(CacheKey<T> key, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, key.getType()));
        } catch (JsonProcessingException e) {
            counter.errors.incrementAndGet();
            log.error("Error reading cached value for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * PTTL semantics: -1 no expiry, -2 key gone. A missing reply is treated as no expiry.
     */
    private static Duration remainingTtl(Long pttl) {
        if (pttl == null || pttl == -1) {
            return null;
        }
        return Duration.ofMillis(Math.max(pttl, 0));
    }

    private static final class PendingWrite {

        private final String json;
        private final Duration ttl;

        private PendingWrite(String json, Duration ttl) {
            this.json = json;
            this.ttl = ttl;
        }
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getFallback(CacheKey<T> key, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, treating {} as a miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private <T> Map<CacheKey<T>, T> getManyFallback(Collection<CacheKey<T>> keys, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, treating {} keys as misses: {}", keys.size(), e.getMessage());
        return new LinkedHashMap<>();
    }

    private <T> Optional<ExpiringValue<T>> getWithTtlFallback(CacheKey<T> key, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, treating {} as a miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private <T> Map<CacheKey<T>, ExpiringValue<T>> getManyWithTtlFallback(Collection<CacheKey<T>> keys, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, treating {} keys as misses: {}", keys.size(), e.getMessage());
        return new LinkedHashMap<>();
    }

    private <T> void setFallback(CacheKey<T> key, T value, Duration ttl, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }

    private void setManyFallback(List<CacheWrite<?>> writes, Exception e) {
        counter.errors.incrementAndGet();
        log.warn("Redis unavailable, skipping batch write of {} keys: {}", writes.size(), e.getMessage());
    }

    private boolean deleteFallback(CacheKey<?> key, Exception e) {
        counter.errors.incrementAndGet();
        throw new CacheStoreException("Failed to delete " + key, e);
    }

    private long deletePatternFallback(String pattern, Exception e) {
        counter.errors.incrementAndGet();
        throw new CacheStoreException("Failed to delete pattern " + pattern, e);
    }
}
