package com.sprintreport.domain.service;

import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.MonthlyActivity;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.domain.model.VelocityResult;
import com.sprintreport.domain.model.VelocityTrend;
import com.sprintreport.infrastructure.cache.CacheKey;
import com.sprintreport.infrastructure.cache.CacheKeys;
import com.sprintreport.infrastructure.cache.CacheStore;
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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnalyticsService.
 *
 * Tests the read-through caching around each metric and the partial-failure rules of
 * the composite reads.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    private static final String BOARD = "6306";
    private static final Instant NOW = Instant.parse("2024-03-15T00:00:00Z");

    @Mock
    private AnalyticsAggregator aggregator;

    @Mock
    private CacheOrchestrator orchestrator;

    @Mock
    private CacheStore cacheStore;

    @Mock
    private SprintTtlPolicy ttlPolicy;

    @Mock
    private IssueTrackerClient issueTrackerClient;

    @Mock
    private SourceControlClient sourceControlClient;

    private MeterRegistry meterRegistry;
    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        analyticsService = new AnalyticsService(aggregator, orchestrator, cacheStore, ttlPolicy,
                issueTrackerClient, sourceControlClient, Runnable::run,
                Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }

    @Test
    void testGetVelocity_CacheHit() {
        // Given
        CacheKey<VelocityResult> key = CacheKeys.velocity(BOARD, 10);
        VelocityResult cached = velocity(42);
        when(cacheStore.get(key)).thenReturn(Optional.of(cached));

        // When
        VelocityResult result = analyticsService.getVelocity(BOARD, 10);

        // Then
        assertSame(cached, result);
        verify(orchestrator).scheduleBackgroundRefresh(eq(key), any(), eq(AnalyticsService.VELOCITY_TTL), any());
        verify(aggregator, never()).calculateVelocity(anyString(), anyInt());
        assertEquals(1.0, meterRegistry.counter("cache.requests", "namespace", "analytics", "result", "hit").count());
    }

    @Test
    void testGetVelocity_CacheMiss() {
        // Given
        CacheKey<VelocityResult> key = CacheKeys.velocity(BOARD, 10);
        VelocityResult computed = velocity(42);
        when(aggregator.calculateVelocity(BOARD, 10)).thenReturn(computed);

        // When
        VelocityResult result = analyticsService.getVelocity(BOARD, 10);

        // Then
        assertSame(computed, result);
        verify(orchestrator).cacheWithRefreshMetadata(key, computed, AnalyticsService.VELOCITY_TTL);
        verify(orchestrator, never()).scheduleBackgroundRefresh(any(), any(), any(), any());
        assertEquals(1.0, meterRegistry.counter("cache.requests", "namespace", "analytics", "result", "miss").count());
    }

    @Test
    void testSprintCountOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getVelocity(BOARD, 0));
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getTeamPerformance(BOARD, 51));
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getIssueTypeDistribution(BOARD, -1));

        verifyNoInteractions(cacheStore, aggregator);
    }

    @Test
    void testGetTeamPerformance_EmptyResultNotCached() {
        // Given
        when(aggregator.calculateTeamPerformance(BOARD, 5)).thenReturn(List.of());

        // When
        List<TeamPerformance> result = analyticsService.getTeamPerformance(BOARD, 5);

        // Then
        assertTrue(result.isEmpty());
        verify(orchestrator, never()).cacheWithRefreshMetadata(any(), any(), any());
    }

    @Test
    void testGetCommitTrends_PullRequestFailureCountsCommitsOnly() {
        // Given
        Instant start = Instant.parse("2023-09-15T00:00:00Z");
        List<Commit> commits = List.of(Commit.builder().sha("a1").date(NOW).build());
        List<MonthlyActivity> activity = List.of(new MonthlyActivity("2024-03", 1, 0));
        when(sourceControlClient.listCommits("acme", "web", start, NOW)).thenReturn(commits);
        when(sourceControlClient.listPullRequests("acme", "web", "all"))
                .thenThrow(new UpstreamFetchException("github.listPullRequests", "rate limited"));
        when(aggregator.aggregateCommitsByMonth(commits, List.of(),
                LocalDate.of(2023, 9, 15), LocalDate.of(2024, 3, 15))).thenReturn(activity);

        // When
        List<MonthlyActivity> result = analyticsService.getCommitTrends("acme", "web", null);

        // Then
        assertEquals(activity, result);
        verify(orchestrator).cacheWithRefreshMetadata(CacheKeys.commitTrends("acme", "web", "6months"),
                activity, AnalyticsService.COMMIT_TRENDS_TTL);
    }

    @Test
    void testGetCommitTrends_CommitFailurePropagates() {
        // Given
        when(sourceControlClient.listCommits(eq("acme"), eq("web"), any(), any()))
                .thenThrow(new UpstreamFetchException("github.listCommits", "timeout"));

        // When / Then
        UpstreamFetchException error = assertThrows(UpstreamFetchException.class,
                () -> analyticsService.getCommitTrends("acme", "web", "1month"));
        assertEquals("github.listCommits", error.getOperation());
        verify(orchestrator, never()).cacheWithRefreshMetadata(any(), any(), any());
        assertEquals(1.0, meterRegistry.counter("analytics.errors", "metric", "commit-trends").count());
    }

    @Test
    void testGetCommitTrends_UnknownPeriod() {
        assertThrows(IllegalArgumentException.class, () -> analyticsService.getCommitTrends("acme", "web", "2weeks"));
        verifyNoInteractions(sourceControlClient);
    }

    @Test
    void testGetAllSprints_FailedStateLeftOut() {
        // Given
        Sprint closed = sprint("1", "2024-01-01T00:00:00Z", SprintState.CLOSED);
        Sprint future = sprint("3", "2024-03-01T00:00:00Z", SprintState.FUTURE);
        when(issueTrackerClient.listSprints(BOARD, SprintState.ACTIVE))
                .thenThrow(new UpstreamFetchException("jira.listSprints", "timeout"));
        when(issueTrackerClient.listSprints(BOARD, SprintState.FUTURE)).thenReturn(List.of(future));
        when(aggregator.getClosedSprints(BOARD)).thenReturn(List.of(closed));

        // When
        List<Sprint> result = analyticsService.getAllSprints(BOARD);

        // Then
        assertEquals(List.of(future, closed), result);
        verify(orchestrator).cacheWithRefreshMetadata(CacheKeys.allSprints(BOARD), result, AnalyticsService.ALL_SPRINTS_TTL);
    }

    @Test
    void testGetSprintIssues_CachedUnderStateTtl() {
        // Given
        List<Issue> issues = List.of(Issue.builder().key("PROJ-1").status("Done").build());
        when(issueTrackerClient.listSprintIssues("42")).thenReturn(issues);
        when(ttlPolicy.resolveSprintTtl("42")).thenReturn(SprintTtlPolicy.ACTIVE_TTL);

        // When
        List<Issue> result = analyticsService.getSprintIssues("42");

        // Then
        assertEquals(issues, result);
        verify(cacheStore).set(CacheKeys.sprintIssues("42"), issues, SprintTtlPolicy.ACTIVE_TTL);
    }

    @Test
    void testGetSprintIssues_CacheHit() {
        // Given
        List<Issue> issues = List.of(Issue.builder().key("PROJ-1").build());
        when(cacheStore.get(CacheKeys.sprintIssues("42"))).thenReturn(Optional.of(issues));

        // When
        List<Issue> result = analyticsService.getSprintIssues("42");

        // Then
        assertSame(issues, result);
        verifyNoInteractions(issueTrackerClient, ttlPolicy);
    }

    private static VelocityResult velocity(double average) {
        return VelocityResult.builder()
                .sprints(List.of())
                .average(average)
                .trend(VelocityTrend.STABLE)
                .build();
    }

    private static Sprint sprint(String id, String start, SprintState state) {
        return Sprint.builder()
                .id(id)
                .name("Sprint " + id)
                .state(state)
                .startDate(Instant.parse(start))
                .boardId(BOARD)
                .build();
    }
}
