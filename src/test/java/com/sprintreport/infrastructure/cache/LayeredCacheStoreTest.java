package com.sprintreport.infrastructure.cache;

import com.sprintreport.domain.model.CacheStats;
import com.sprintreport.domain.model.SprintState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LayeredCacheStore.
 *
 * The local tier is a real Caffeine store, the shared tier a mock.
 */
@ExtendWith(MockitoExtension.class)
class LayeredCacheStoreTest {

    private static final Duration BACKFILL_TTL = Duration.ofMinutes(5);

    @Mock
    private SharedCacheTier shared;

    private CaffeineCacheStore local;
    private LayeredCacheStore store;

    @BeforeEach
    void setUp() {
        local = new CaffeineCacheStore(1000, BACKFILL_TTL);
        store = new LayeredCacheStore(local, shared, BACKFILL_TTL);
    }

    @Test
    void testGet_LocalHitSkipsSharedTier() {
        // Given
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        local.set(key, SprintState.ACTIVE, Duration.ofMinutes(1));

        // When
        Optional<SprintState> result = store.get(key);

        // Then
        assertEquals(SprintState.ACTIVE, result.orElseThrow());
        verify(shared, never()).getWithTtl(any());
    }

    @Test
    void testGet_SharedHitBackfillsLocalTier() {
        // Given
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        when(shared.getWithTtl(key))
                .thenReturn(Optional.of(new ExpiringValue<>(SprintState.CLOSED, Duration.ofMinutes(1))));

        // When
        store.get(key);
        Optional<SprintState> second = store.get(key);

        // Then
        assertEquals(SprintState.CLOSED, second.orElseThrow());
        assertTrue(local.get(key).isPresent());
        verify(shared, times(1)).getWithTtl(key);
    }

    @Test
    void testGetMany_OnlyLocalMissesReachSharedTier() {
        // Given
        CacheKey<SprintState> cachedLocally = CacheKeys.sprintState("1");
        CacheKey<SprintState> cachedShared = CacheKeys.sprintState("2");
        CacheKey<SprintState> missing = CacheKeys.sprintState("3");
        local.set(cachedLocally, SprintState.ACTIVE, Duration.ofMinutes(1));

        Map<CacheKey<SprintState>, ExpiringValue<SprintState>> fromShared =
                Map.of(cachedShared, new ExpiringValue<>(SprintState.CLOSED, Duration.ofMinutes(1)));
        when(shared.getManyWithTtl(List.of(cachedShared, missing))).thenReturn(fromShared);

        // When
        Map<CacheKey<SprintState>, SprintState> result = store.getMany(List.of(cachedLocally, cachedShared, missing));

        // Then
        assertEquals(2, result.size());
        assertEquals(SprintState.ACTIVE, result.get(cachedLocally));
        assertEquals(SprintState.CLOSED, result.get(cachedShared));
        assertTrue(local.get(cachedShared).isPresent());

        CacheStats stats = store.stats();
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
    }

    @Test
    void testGet_BackfillNeverOutlivesSharedEntry() {
        // Given
        AtomicLong nanos = new AtomicLong();
        CaffeineCacheStore tickingLocal = new CaffeineCacheStore(1000, BACKFILL_TTL, nanos::get);
        LayeredCacheStore layered = new LayeredCacheStore(tickingLocal, shared, BACKFILL_TTL);
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        when(shared.getWithTtl(key))
                .thenReturn(Optional.of(new ExpiringValue<>(SprintState.ACTIVE, Duration.ofSeconds(1))))
                .thenReturn(Optional.empty());

        // When
        layered.get(key);
        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        Optional<SprintState> afterSharedExpiry = layered.get(key);

        // Then
        assertTrue(afterSharedExpiry.isEmpty());
        verify(shared, times(2)).getWithTtl(key);
    }

    @Test
    void testGet_PersistentSharedEntryBackfillsWithCap() {
        // Given
        AtomicLong nanos = new AtomicLong();
        CaffeineCacheStore tickingLocal = new CaffeineCacheStore(1000, null, nanos::get);
        LayeredCacheStore layered = new LayeredCacheStore(tickingLocal, shared, BACKFILL_TTL);
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        when(shared.getWithTtl(key)).thenReturn(Optional.of(new ExpiringValue<>(SprintState.CLOSED, null)));

        // When
        layered.get(key);
        nanos.addAndGet(BACKFILL_TTL.minusSeconds(1).toNanos());
        boolean presentBeforeCap = tickingLocal.get(key).isPresent();
        nanos.addAndGet(Duration.ofSeconds(2).toNanos());

        // Then
        assertTrue(presentBeforeCap);
        assertTrue(tickingLocal.get(key).isEmpty());
    }

    @Test
    void testGet_ExpiredSharedEntryIsServedWithoutBackfill() {
        // Given
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        when(shared.getWithTtl(key)).thenReturn(Optional.of(new ExpiringValue<>(SprintState.ACTIVE, Duration.ZERO)));

        // When
        Optional<SprintState> result = store.get(key);

        // Then
        assertEquals(SprintState.ACTIVE, result.orElseThrow());
        assertTrue(local.get(key).isEmpty());
    }

    @Test
    void testSet_WritesBothTiers() {
        // Given
        CacheKey<SprintState> key = CacheKeys.sprintState("1");

        // When
        store.set(key, SprintState.FUTURE, Duration.ofMinutes(15));

        // Then
        assertTrue(local.get(key).isPresent());
        verify(shared).set(key, SprintState.FUTURE, Duration.ofMinutes(15));
    }

    @Test
    void testDeletePattern_SharedFailureSurfacesAfterLocalCleared() {
        // Given
        CacheKey<SprintState> key = CacheKeys.sprintState("1");
        local.set(key, SprintState.ACTIVE, Duration.ofMinutes(1));
        when(shared.deletePattern("sprint:1:state")).thenThrow(new CacheStoreException("Redis down"));

        // When / Then
        assertThrows(CacheStoreException.class, () -> store.deletePattern("sprint:1:state"));
        assertTrue(local.get(key).isEmpty());
    }

    @Test
    void testStats_ReportsLocalKeysAndSharedErrors() {
        // Given
        local.set(CacheKeys.sprintState("1"), SprintState.ACTIVE, Duration.ofMinutes(1));
        when(shared.stats()).thenReturn(CacheStats.builder().errors(3).redisEnabled(true).build());

        // When
        CacheStats stats = store.stats();

        // Then
        assertEquals(1, stats.getLocalKeys());
        assertEquals(3, stats.getErrors());
        assertTrue(stats.isRedisEnabled());
    }
}
