package com.sprintreport.infrastructure.config;

import com.sprintreport.infrastructure.cache.CacheStore;
import com.sprintreport.infrastructure.cache.CaffeineCacheStore;
import com.sprintreport.infrastructure.cache.LayeredCacheStore;
import com.sprintreport.infrastructure.cache.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Cache tiers and the executors behind batch fill and background refresh.
 *
 * Two pools keep background refresh isolated from request-path fetches:
 * - upstreamExecutor: fixed size, bounds concurrent upstream calls per process
 * - refreshExecutor: small pool, rejects when saturated (the stale entry stays served)
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Value("${app.cache.local.max-size:10000}")
    private long localMaxSize;

    @Value("${app.cache.local.max-ttl:5m}")
    private Duration localMaxTtl;

    @Value("${app.cache.batch.max-concurrency:8}")
    private int maxConcurrency;

    @Value("${app.cache.refresh.core-pool-size:2}")
    private int refreshCorePoolSize;

    @Value("${app.cache.refresh.max-pool-size:4}")
    private int refreshMaxPoolSize;

    @Value("${app.cache.refresh.queue-capacity:100}")
    private int refreshQueueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public CacheStore cacheStore(ObjectProvider<RedisCacheStore> redisCacheStore) {
        RedisCacheStore shared = redisCacheStore.getIfAvailable();
        if (shared == null) {
            log.info("Redis disabled, using local cache only (max size: {})", localMaxSize);
            return new CaffeineCacheStore(localMaxSize, null);
        }
        log.info("Using layered cache: local (max size: {}, max TTL: {}) over Redis", localMaxSize, localMaxTtl);
        return new LayeredCacheStore(new CaffeineCacheStore(localMaxSize, localMaxTtl), shared, localMaxTtl);
    }

    @Bean("upstreamExecutor")
    public ThreadPoolTaskExecutor upstreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrency);
        executor.setMaxPoolSize(maxConcurrency);
        executor.setThreadNamePrefix("upstream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("refreshExecutor")
    public ThreadPoolTaskExecutor refreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(refreshCorePoolSize);
        executor.setMaxPoolSize(refreshMaxPoolSize);
        executor.setQueueCapacity(refreshQueueCapacity);
        executor.setThreadNamePrefix("cache-refresh-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
