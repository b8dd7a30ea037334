package com.sprintreport.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.SprintState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheStore serialization and multi-key reads.
 * Circuit breaker fallbacks need the Spring proxy and are not exercised here.
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisCacheStore(redisTemplate, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void testGet_DeserializesTypedValue() {
        // Given
        when(valueOperations.get("sprint:1:issues:all"))
                .thenReturn("[{\"key\":\"PROJ-1\",\"status\":\"Done\",\"storyPoints\":5.0}]");

        // When
        Optional<List<Issue>> result = store.get(CacheKeys.sprintIssues("1"));

        // Then
        assertTrue(result.isPresent());
        assertEquals("PROJ-1", result.get().get(0).getKey());
        assertEquals(5.0, result.get().get(0).getStoryPoints());
    }

    @Test
    void testGet_CorruptValueIsMiss() {
        // Given
        when(valueOperations.get("sprint:1:state")).thenReturn("{not json");

        // When
        Optional<SprintState> result = store.get(CacheKeys.sprintState("1"));

        // Then
        assertTrue(result.isEmpty());
        assertEquals(1, store.stats().getErrors());
    }

    @Test
    void testGetMany_UsesSingleMultiGet() {
        // Given
        CacheKey<SprintState> first = CacheKeys.sprintState("1");
        CacheKey<SprintState> second = CacheKeys.sprintState("2");
        when(valueOperations.multiGet(List.of("sprint:1:state", "sprint:2:state")))
                .thenReturn(Arrays.asList("\"closed\"", null));

        // When
        Map<CacheKey<SprintState>, SprintState> result = store.getMany(List.of(first, second));

        // Then
        assertEquals(Map.of(first, SprintState.CLOSED), result);
        verify(valueOperations, times(1)).multiGet(anyCollection());
        verify(valueOperations, never()).get(anyString());
    }

    @Test
    void testGetWithTtl_ReportsRemainingTime() {
        // Given
        when(valueOperations.get("sprint:1:state")).thenReturn("\"active\"");
        when(redisTemplate.getExpire("sprint:1:state", TimeUnit.MILLISECONDS)).thenReturn(1500L);

        // When
        Optional<ExpiringValue<SprintState>> result = store.getWithTtl(CacheKeys.sprintState("1"));

        // Then
        assertEquals(SprintState.ACTIVE, result.orElseThrow().getValue());
        assertEquals(Duration.ofMillis(1500), result.get().getRemainingTtl());
    }

    @Test
    void testGetWithTtl_PersistentKeyHasNoRemainingTtl() {
        // Given
        when(valueOperations.get("sprint:1:state")).thenReturn("\"closed\"");
        when(redisTemplate.getExpire("sprint:1:state", TimeUnit.MILLISECONDS)).thenReturn(-1L);

        // When
        Optional<ExpiringValue<SprintState>> result = store.getWithTtl(CacheKeys.sprintState("1"));

        // Then
        assertNull(result.orElseThrow().getRemainingTtl());
    }

    @Test
    void testGetManyWithTtl_PipelinesPttlForHitsOnly() {
        // Given
        CacheKey<SprintState> first = CacheKeys.sprintState("1");
        CacheKey<SprintState> second = CacheKeys.sprintState("2");
        when(valueOperations.multiGet(List.of("sprint:1:state", "sprint:2:state")))
                .thenReturn(Arrays.asList(null, "\"closed\""));
        when(redisTemplate.executePipelined(any(RedisCallback.class))).thenReturn(List.of(30_000L));

        // When
        Map<CacheKey<SprintState>, ExpiringValue<SprintState>> result = store.getManyWithTtl(List.of(first, second));

        // Then
        assertEquals(1, result.size());
        assertEquals(SprintState.CLOSED, result.get(second).getValue());
        assertEquals(Duration.ofSeconds(30), result.get(second).getRemainingTtl());
        verify(redisTemplate, times(1)).executePipelined(any(RedisCallback.class));
    }

    @Test
    void testSet_WritesJsonWithTtl() {
        // When
        store.set(CacheKeys.sprintState("1"), SprintState.ACTIVE, Duration.ofHours(1));

        // Then
        verify(valueOperations).set("sprint:1:state", "\"active\"", Duration.ofHours(1));
        assertEquals(1, store.stats().getSets());
    }
}
