package com.sprintreport.domain.service;

import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.infrastructure.cache.CaffeineCacheStore;
import com.sprintreport.infrastructure.upstream.IssueTrackerClient;
import com.sprintreport.infrastructure.upstream.SourceControlClient;
import com.sprintreport.infrastructure.upstream.UpstreamFetchException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Background refresh through AnalyticsService against the real in-process store and
 * orchestrator. Refreshes run on the calling thread.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsServiceRefreshTest {

    private static final String BOARD = "6306";
    private static final Instant START = Instant.parse("2024-03-15T09:00:00Z");

    @Mock
    private AnalyticsAggregator aggregator;

    @Mock
    private IssueTrackerClient issueTrackerClient;

    @Mock
    private SourceControlClient sourceControlClient;

    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        CaffeineCacheStore cacheStore = new CaffeineCacheStore(1000, null);
        clock = new MutableClock(START);
        meterRegistry = new SimpleMeterRegistry();
        SprintTtlPolicy ttlPolicy = new SprintTtlPolicy(cacheStore, issueTrackerClient);
        CacheOrchestrator orchestrator = new CacheOrchestrator(cacheStore, issueTrackerClient, sourceControlClient,
                ttlPolicy, Runnable::run, clock, meterRegistry);
        analyticsService = new AnalyticsService(aggregator, orchestrator, cacheStore, ttlPolicy,
                issueTrackerClient, sourceControlClient, Runnable::run, clock, meterRegistry);
    }

    @Test
    void testGetAllSprints_FailedListingsKeepCachedList() {
        // Given - one active sprint cached, then every listing fails
        Sprint active = Sprint.builder()
                .id("9")
                .name("Sprint 9")
                .state(SprintState.ACTIVE)
                .startDate(START.minus(Duration.ofDays(3)))
                .boardId(BOARD)
                .build();
        UpstreamFetchException down = new UpstreamFetchException("jira.listSprints", "timeout");
        when(issueTrackerClient.listSprints(BOARD, SprintState.ACTIVE)).thenReturn(List.of(active)).thenThrow(down);
        when(issueTrackerClient.listSprints(BOARD, SprintState.FUTURE)).thenReturn(List.of()).thenThrow(down);
        when(aggregator.getClosedSprints(BOARD)).thenReturn(List.of()).thenThrow(down);

        assertEquals(List.of(active), analyticsService.getAllSprints(BOARD));
        clock.advance(Duration.ofMinutes(3));

        // When - the hit schedules a refresh, which fails
        List<Sprint> served = analyticsService.getAllSprints(BOARD);
        List<Sprint> afterRefresh = analyticsService.getAllSprints(BOARD);

        // Then
        assertEquals(List.of(active), served);
        assertEquals(List.of(active), afterRefresh);
        assertTrue(meterRegistry.counter("cache.refresh", "result", "failure").count() >= 1.0);
    }

    @Test
    void testGetTeamPerformance_EmptyRefreshKeepsCachedRows() {
        // Given
        TeamPerformance row = TeamPerformance.builder().name("Sprint 9").planned(21).completed(18).velocity(18).build();
        when(aggregator.calculateTeamPerformance(BOARD, 5)).thenReturn(List.of(row)).thenReturn(List.of());

        assertEquals(List.of(row), analyticsService.getTeamPerformance(BOARD, 5));
        clock.advance(Duration.ofMinutes(3));

        // When
        analyticsService.getTeamPerformance(BOARD, 5);
        List<TeamPerformance> afterRefresh = analyticsService.getTeamPerformance(BOARD, 5);

        // Then
        assertEquals(List.of(row), afterRefresh);
        assertTrue(meterRegistry.counter("cache.refresh", "result", "skipped").count() >= 1.0);
    }
}
