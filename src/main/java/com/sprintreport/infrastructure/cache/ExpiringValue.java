package com.sprintreport.infrastructure.cache;

import lombok.Value;

import java.time.Duration;

/**
 * A cached value with the time it has left in the store; {@code remainingTtl} is
 * {@code null} when the entry has no expiry.
 */
@Value
public class ExpiringValue<T> {

    T value;
    Duration remainingTtl;
}
