package com.sprintreport.infrastructure.cache;

import com.sprintreport.domain.model.CacheStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters behind {@link CacheStore#stats()}.
 */
class CacheStatsCounter {

    final AtomicLong hits = new AtomicLong();
    final AtomicLong misses = new AtomicLong();
    final AtomicLong sets = new AtomicLong();
    final AtomicLong deletes = new AtomicLong();
    final AtomicLong errors = new AtomicLong();

    CacheStats snapshot(long localKeys, boolean redisEnabled) {
        long hitCount = hits.get();
        long total = hitCount + misses.get();
        return CacheStats.builder()
                .hits(hitCount)
                .misses(misses.get())
                .sets(sets.get())
                .deletes(deletes.get())
                .errors(errors.get())
                .hitRate(total > 0 ? (hitCount * 100.0) / total : 0)
                .localKeys(localKeys)
                .redisEnabled(redisEnabled)
                .build();
    }
}
