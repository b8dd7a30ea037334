package com.sprintreport.domain.service;

import com.sprintreport.domain.model.CacheStats;
import com.sprintreport.domain.model.ChangeLog;
import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.IssueTypeCount;
import com.sprintreport.domain.model.MonthlyActivity;
import com.sprintreport.domain.model.PullRequest;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintSnapshot;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.domain.model.TrendPeriod;
import com.sprintreport.domain.model.VelocityResult;
import com.sprintreport.infrastructure.cache.CacheKey;
import com.sprintreport.infrastructure.cache.CacheKeys;
import com.sprintreport.infrastructure.cache.CacheStore;
import com.sprintreport.infrastructure.upstream.IssueTrackerClient;
import com.sprintreport.infrastructure.upstream.SourceControlClient;
import com.sprintreport.infrastructure.upstream.UpstreamFetchException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Entry point for dashboards and report generation.
 *
 * Query Flow:
 * 1. Build the metric's cache key
 * 2. On a hit, return it and schedule a background refresh if past half-life
 * 3. On a miss, compute through {@link AnalyticsAggregator}
 * 4. Store the result together with its refresh metadata
 *
 * Caching Strategy:
 * - Velocity, team performance: 5 minutes
 * - Issue-type distribution, commit trends: 10 minutes
 * - Combined sprint list: 5 minutes
 *
 * Derived metrics are not removed when a sprint's raw issues are invalidated; they may
 * be stale for up to their own TTL.
 */
@Slf4j
@Service
public class AnalyticsService {

    static final Duration VELOCITY_TTL = Duration.ofMinutes(5);
    static final Duration TEAM_PERFORMANCE_TTL = Duration.ofMinutes(5);
    static final Duration ISSUE_TYPES_TTL = Duration.ofMinutes(10);
    static final Duration COMMIT_TRENDS_TTL = Duration.ofMinutes(10);
    static final Duration ALL_SPRINTS_TTL = Duration.ofMinutes(5);
    static final int MAX_SPRINT_COUNT = 50;

    private final AnalyticsAggregator aggregator;
    private final CacheOrchestrator orchestrator;
    private final CacheStore cacheStore;
    private final SprintTtlPolicy ttlPolicy;
    private final IssueTrackerClient issueTrackerClient;
    private final SourceControlClient sourceControlClient;
    private final Executor upstreamExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public AnalyticsService(AnalyticsAggregator aggregator,
                            CacheOrchestrator orchestrator,
                            CacheStore cacheStore,
                            SprintTtlPolicy ttlPolicy,
                            IssueTrackerClient issueTrackerClient,
                            SourceControlClient sourceControlClient,
                            @Qualifier("upstreamExecutor") Executor upstreamExecutor,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.aggregator = aggregator;
        this.orchestrator = orchestrator;
        this.cacheStore = cacheStore;
        this.ttlPolicy = ttlPolicy;
        this.issueTrackerClient = issueTrackerClient;
        this.sourceControlClient = sourceControlClient;
        this.upstreamExecutor = upstreamExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public VelocityResult getVelocity(String boardId, int sprintCount) {
        validateSprintCount(sprintCount);
        return cachedMetric("velocity", CacheKeys.velocity(boardId, sprintCount), VELOCITY_TTL,
                () -> aggregator.calculateVelocity(boardId, sprintCount),
                result -> true);
    }

    /**
     * Empty results are returned but not cached, so a board whose first sprint has just
     * closed shows up without waiting for the TTL.
     */
    public List<TeamPerformance> getTeamPerformance(String boardId, int sprintCount) {
        validateSprintCount(sprintCount);
        return cachedMetric("team-performance", CacheKeys.teamPerformance(boardId, sprintCount), TEAM_PERFORMANCE_TTL,
                () -> aggregator.calculateTeamPerformance(boardId, sprintCount),
                result -> !result.isEmpty());
    }

    public List<IssueTypeCount> getIssueTypeDistribution(String boardId, int sprintCount) {
        validateSprintCount(sprintCount);
        return cachedMetric("issue-types", CacheKeys.issueTypes(boardId, sprintCount), ISSUE_TYPES_TTL,
                () -> aggregator.calculateIssueTypeDistribution(boardId, sprintCount),
                result -> true);
    }

    /**
     * Monthly commit and pull request counts from {@code period} ago until now.
     *
     * @param period {@code 1month}, {@code 3months}, {@code 6months} (default) or {@code 1year}
     */
    public List<MonthlyActivity> getCommitTrends(String owner, String repo, String period) {
        TrendPeriod trendPeriod = TrendPeriod.fromValue(period);
        return cachedMetric("commit-trends", CacheKeys.commitTrends(owner, repo, trendPeriod.getValue()), COMMIT_TRENDS_TTL,
                () -> computeCommitTrends(owner, repo, trendPeriod),
                result -> true);
    }

    /**
     * Active, closed and future sprints of a board, newest first. A state whose listing
     * fails is left out rather than failing the whole list; a background refresh with a
     * failing listing fails instead, so a partial list never replaces a complete one.
     */
    public List<Sprint> getAllSprints(String boardId) {
        return cachedMetric("all-sprints", CacheKeys.allSprints(boardId), ALL_SPRINTS_TTL,
                () -> computeAllSprints(boardId, true),
                () -> computeAllSprints(boardId, false),
                result -> !result.isEmpty());
    }

    /**
     * Issue set of one sprint, cached under the TTL its current state allows.
     */
    public List<Issue> getSprintIssues(String sprintId) {
        CacheKey<List<Issue>> key = CacheKeys.sprintIssues(sprintId);
        Optional<List<Issue>> cached = cacheStore.get(key);
        if (cached.isPresent()) {
            recordRequest(key, "hit");
            return cached.get();
        }

        recordRequest(key, "miss");
        List<Issue> issues = issueTrackerClient.listSprintIssues(sprintId);
        Duration ttl = ttlPolicy.resolveSprintTtl(sprintId);
        cacheStore.set(key, issues, ttl);

        log.info("Sprint issues fetched: {} ({} issues, TTL: {})", sprintId, issues.size(), ttl);
        return issues;
    }

    public SprintSnapshot warmSprintCache(String sprintId, String owner, String repo) {
        return orchestrator.warmSprintCache(sprintId, owner, repo);
    }

    public long invalidateSprintCache(String sprintId) {
        return orchestrator.invalidateSprintCache(sprintId);
    }

    public Set<String> invalidateIssueCache(Issue issue, ChangeLog changeLog) {
        return orchestrator.invalidateIssueCache(issue, changeLog);
    }

    public CacheStats getCacheStats() {
        return cacheStore.stats();
    }

    private <T> T cachedMetric(String metric, CacheKey<T> key, Duration ttl,
                               Supplier<T> compute, Predicate<T> cacheable) {
        return cachedMetric(metric, key, ttl, compute, compute, cacheable);
    }

    /**
     * @param refresh computation used by background refresh, which must fail rather than
     *                degrade so the cached value is kept
     */
    private <T> T cachedMetric(String metric, CacheKey<T> key, Duration ttl,
                               Supplier<T> compute, Supplier<T> refresh, Predicate<T> cacheable) {
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Optional<T> cached = cacheStore.get(key);

            if (cached.isPresent()) {
                log.debug("Cache hit for metric: {}", key);
                recordRequest(key, "hit");
                orchestrator.scheduleBackgroundRefresh(key, refresh, ttl, cacheable);

                sample.stop(Timer.builder("analytics.latency")
                        .tag("metric", metric)
                        .tag("cached", "true")
                        .register(meterRegistry));
                return cached.get();
            }

            log.debug("Cache miss for metric: {}", key);
            recordRequest(key, "miss");

            T result = compute.get();
            if (cacheable.test(result)) {
                orchestrator.cacheWithRefreshMetadata(key, result, ttl);
            }

            sample.stop(Timer.builder("analytics.latency")
                    .tag("metric", metric)
                    .tag("cached", "false")
                    .register(meterRegistry));
            return result;

        } catch (RuntimeException e) {
            log.error("Error computing {} for {}: {}", metric, key, e.getMessage(), e);
            Counter.builder("analytics.errors")
                    .tag("metric", metric)
                    .register(meterRegistry)
                    .increment();
            throw e;
        }
    }

    private List<MonthlyActivity> computeCommitTrends(String owner, String repo, TrendPeriod period) {
        Instant end = clock.instant();
        Instant start = end.atZone(ZoneOffset.UTC).minusMonths(period.getMonths()).toInstant();

        CompletableFuture<List<Commit>> commits = CompletableFuture.supplyAsync(
                () -> sourceControlClient.listCommits(owner, repo, start, end), upstreamExecutor);
        CompletableFuture<List<PullRequest>> pullRequests = CompletableFuture.supplyAsync(
                        () -> sourceControlClient.listPullRequests(owner, repo, CacheOrchestrator.PULL_REQUEST_STATE),
                        upstreamExecutor)
                .exceptionally(e -> {
                    log.warn("Pull requests unavailable for {}/{}, counting commits only: {}", owner, repo, e.getMessage());
                    return List.of();
                });

        return aggregator.aggregateCommitsByMonth(
                join(commits, "listCommits"),
                join(pullRequests, "listPullRequests"),
                LocalDate.ofInstant(start, ZoneOffset.UTC),
                LocalDate.ofInstant(end, ZoneOffset.UTC));
    }

    /**
     * @param degrade whether a failing listing counts as empty instead of failing the call
     */
    private List<Sprint> computeAllSprints(String boardId, boolean degrade) {
        CompletableFuture<List<Sprint>> active = sprintsInState(boardId, SprintState.ACTIVE,
                () -> issueTrackerClient.listSprints(boardId, SprintState.ACTIVE), degrade);
        CompletableFuture<List<Sprint>> future = sprintsInState(boardId, SprintState.FUTURE,
                () -> issueTrackerClient.listSprints(boardId, SprintState.FUTURE), degrade);
        CompletableFuture<List<Sprint>> closed = sprintsInState(boardId, SprintState.CLOSED,
                () -> aggregator.getClosedSprints(boardId), degrade);

        return AnalyticsAggregator.combineAndSortSprints(
                join(active, "listSprints"),
                join(closed, "listSprints"),
                join(future, "listSprints"));
    }

    private CompletableFuture<List<Sprint>> sprintsInState(String boardId, SprintState state,
                                                           Supplier<List<Sprint>> listing, boolean degrade) {
        CompletableFuture<List<Sprint>> sprints = CompletableFuture.supplyAsync(listing, upstreamExecutor);
        return degrade ? sprints.exceptionally(e -> emptyOnFailure(boardId, state, e)) : sprints;
    }

    private List<Sprint> emptyOnFailure(String boardId, SprintState state, Throwable e) {
        log.warn("Could not list {} sprints for board {}: {}", state.value(), boardId, e.getMessage());
        return new ArrayList<>();
    }

    private <T> T join(CompletableFuture<T> future, String operation) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new UpstreamFetchException(operation, cause.getMessage(), cause);
        }
    }

    private void recordRequest(CacheKey<?> key, String result) {
        Counter.builder("cache.requests")
                .tag("namespace", key.getNamespace().getPrefix())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static void validateSprintCount(int sprintCount) {
        if (sprintCount < 1 || sprintCount > MAX_SPRINT_COUNT) {
            throw new IllegalArgumentException("Sprint count must be between 1 and " + MAX_SPRINT_COUNT);
        }
    }
}
