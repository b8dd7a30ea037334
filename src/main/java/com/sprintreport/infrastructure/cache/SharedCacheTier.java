package com.sprintreport.infrastructure.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Cache tier shared between instances. Reads also report each entry's remaining TTL so a
 * local copy never outlives the shared entry.
 */
public interface SharedCacheTier extends CacheStore {

    <T> Optional<ExpiringValue<T>> getWithTtl(CacheKey<T> key);

    /**
     * Returns only the keys that were found.
     */
    <T> Map<CacheKey<T>, ExpiringValue<T>> getManyWithTtl(Collection<CacheKey<T>> keys);
}
