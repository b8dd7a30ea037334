package com.sprintreport.infrastructure.cache;

import lombok.Value;

import java.time.Duration;

/**
 * One entry of a batched multi-set.
 */
@Value
public class CacheWrite<T> {

    CacheKey<T> key;
    T value;
    Duration ttl;

    public static <T> CacheWrite<T> of(CacheKey<T> key, T value, Duration ttl) {
        return new CacheWrite<>(key, value, ttl);
    }
}
