package com.sprintreport.domain.service;

import com.sprintreport.domain.model.ChangeLog;
import com.sprintreport.domain.model.ChangeLogItem;
import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.PullRequest;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintMetrics;
import com.sprintreport.domain.model.SprintSnapshot;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.infrastructure.cache.CacheKey;
import com.sprintreport.infrastructure.cache.CacheKeys;
import com.sprintreport.infrastructure.cache.CacheStore;
import com.sprintreport.infrastructure.cache.CacheWrite;
import com.sprintreport.infrastructure.cache.RefreshMetadata;
import com.sprintreport.infrastructure.upstream.IssueTrackerClient;
import com.sprintreport.infrastructure.upstream.SourceControlClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Warming, proactive refresh and invalidation. The only component that bulk-populates
 * or deletes cache state outside the normal read paths.
 *
 * Entry lifecycle:
 * cold -> warm -> (past half-life: refreshed in background) -> warm -> (expired) -> cold,
 * with explicit invalidation returning an entry to cold at any point.
 *
 * Failure Handling:
 * - Warming: logged and rethrown, callers may carry on without it
 * - Background refresh: logged and dropped, the entry stays serviceable until expiry
 * - Invalidation: best effort, each pattern independently
 */
@Slf4j
@Service
public class CacheOrchestrator {

    static final String PULL_REQUEST_STATE = "all";

    private final CacheStore cacheStore;
    private final IssueTrackerClient issueTrackerClient;
    private final SourceControlClient sourceControlClient;
    private final SprintTtlPolicy ttlPolicy;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();

    public CacheOrchestrator(CacheStore cacheStore,
                             IssueTrackerClient issueTrackerClient,
                             SourceControlClient sourceControlClient,
                             SprintTtlPolicy ttlPolicy,
                             @Qualifier("refreshExecutor") Executor refreshExecutor,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.cacheStore = cacheStore;
        this.issueTrackerClient = issueTrackerClient;
        this.sourceControlClient = sourceControlClient;
        this.ttlPolicy = ttlPolicy;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Eagerly populates every entry of a sprint that has reached its terminal state.
     *
     * Issues, metrics and the comprehensive snapshot are written with the closed TTL and
     * refresh metadata; the sprint state with the state TTL. All in one multi-set.
     */
    public SprintSnapshot warmSprintCache(String sprintId, String owner, String repo) {
        log.info("Warming sprint cache: {} ({}/{})", sprintId, owner, repo);

        try {
            Sprint sprint = issueTrackerClient.getSprint(sprintId);
            List<Issue> issues = issueTrackerClient.listSprintIssues(sprintId);
            List<Commit> commits = sourceControlClient.listCommits(owner, repo,
                    sprint.getStartDate(), sprint.getEndDate());
            List<PullRequest> pullRequests = inWindow(
                    sourceControlClient.listPullRequests(owner, repo, PULL_REQUEST_STATE), sprint);

            SprintMetrics metrics = IssueMetrics.summarize(sprintId, issues);
            SprintSnapshot snapshot = SprintSnapshot.builder()
                    .sprint(sprint)
                    .issues(issues)
                    .metrics(metrics)
                    .githubOwner(owner)
                    .githubRepo(repo)
                    .commitCount(commits.size())
                    .pullRequestCount(pullRequests.size())
                    .build();

            Duration ttl = ttlPolicy.resolveTtl(SprintState.CLOSED);
            SprintState state = sprint.getState() != null ? sprint.getState() : SprintState.CLOSED;
            long now = clock.millis();

            List<CacheWrite<?>> writes = new ArrayList<>();
            addWithMetadata(writes, CacheKeys.sprintIssues(sprintId), issues, ttl, now);
            addWithMetadata(writes, CacheKeys.sprintMetrics(sprintId), metrics, ttl, now);
            addWithMetadata(writes, CacheKeys.comprehensive(sprintId, owner, repo), snapshot, ttl, now);
            writes.add(CacheWrite.of(CacheKeys.sprintState(sprintId), state, SprintTtlPolicy.STATE_TTL));
            cacheStore.setMany(writes);

            log.info("Sprint cache warmed: {} ({} issues, {} commits, {} pull requests)",
                    sprintId, issues.size(), commits.size(), pullRequests.size());
            return snapshot;

        } catch (RuntimeException e) {
            log.error("Error warming sprint cache {}: {}", sprintId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Writes a value together with the metadata that makes it eligible for background refresh.
     */
    public <T> void cacheWithRefreshMetadata(CacheKey<T> key, T value, Duration ttl) {
        List<CacheWrite<?>> writes = new ArrayList<>(2);
        addWithMetadata(writes, key, value, ttl, clock.millis());
        cacheStore.setMany(writes);
    }

    /**
     * Submits {@code refreshFn} in the background when {@code key} is past half its TTL.
     * Never blocks the caller and never throws. A refreshed value rejected by
     * {@code cacheable} is dropped and the current entry stays until it expires.
     *
     * @return whether a refresh was submitted
     */
    public <T> boolean scheduleBackgroundRefresh(CacheKey<T> key, Supplier<T> refreshFn, Duration ttl,
                                                 Predicate<T> cacheable) {
        Optional<RefreshMetadata> metadata = cacheStore.get(CacheKeys.refreshMetadata(key));
        if (metadata.isEmpty()) {
            return false;
        }

        long age = clock.millis() - metadata.get().getCreatedAt();
        if (age <= ttl.toMillis() / 2) {
            return false;
        }

        if (!refreshing.add(key.getValue())) {
            log.debug("Refresh already in flight for {}", key);
            return false;
        }

        try {
            refreshExecutor.execute(() -> refresh(key, refreshFn, ttl, cacheable));
            log.debug("Background refresh scheduled for {} (age: {}ms)", key, age);
            return true;
        } catch (RejectedExecutionException e) {
            refreshing.remove(key.getValue());
            recordRefresh("rejected");
            log.warn("Refresh pool saturated, skipping refresh of {}", key);
            return false;
        }
    }

    /**
     * Removes every entry structurally derived from a sprint.
     *
     * @return number of entries removed
     */
    public long invalidateSprintCache(String sprintId) {
        long removed = 0;
        int failed = 0;

        for (String pattern : CacheKeys.sprintInvalidationPatterns(sprintId)) {
            try {
                removed += cacheStore.deletePattern(pattern);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to invalidate pattern {}: {}", pattern, e.getMessage());
            }
        }

        Counter.builder("cache.invalidation")
                .tag("result", failed == 0 ? "success" : "partial")
                .register(meterRegistry)
                .increment();

        log.info("Sprint cache invalidated: {} ({} entries removed, {} patterns failed)", sprintId, removed, failed);
        return removed;
    }

    /**
     * Invalidates the issue's current sprint and every sprint named on either side of a
     * sprint change in the change log.
     *
     * @return the sprint ids invalidated
     */
    public Set<String> invalidateIssueCache(Issue issue, ChangeLog changeLog) {
        Set<String> sprintIds = new LinkedHashSet<>();

        if (issue != null && issue.getSprint() != null) {
            addSprintIds(sprintIds, issue.getSprint().getId());
        }
        if (changeLog != null && changeLog.getItems() != null) {
            for (ChangeLogItem item : changeLog.getItems()) {
                if ("Sprint".equalsIgnoreCase(item.getField())) {
                    addSprintIds(sprintIds, item.getFrom());
                    addSprintIds(sprintIds, item.getTo());
                }
            }
        }

        for (String sprintId : sprintIds) {
            try {
                invalidateSprintCache(sprintId);
            } catch (RuntimeException e) {
                log.warn("Failed to invalidate sprint {}: {}", sprintId, e.getMessage());
            }
        }

        log.info("Issue cache invalidated: {} (sprints: {})", issue != null ? issue.getKey() : null, sprintIds);
        return sprintIds;
    }

    private <T> void refresh(CacheKey<T> key, Supplier<T> refreshFn, Duration ttl, Predicate<T> cacheable) {
        try {
            T value = refreshFn.get();
            if (value == null || !cacheable.test(value)) {
                recordRefresh("skipped");
                log.debug("Background refresh of {} produced a non-cacheable value, keeping current entry", key);
                return;
            }
            cacheWithRefreshMetadata(key, value, ttl);
            recordRefresh("success");
            log.debug("Background refresh completed for {}", key);
        } catch (RuntimeException e) {
            recordRefresh("failure");
            log.warn("Background refresh failed for {}: {}", key, e.getMessage());
        } finally {
            refreshing.remove(key.getValue());
        }
    }

    private <T> void addWithMetadata(List<CacheWrite<?>> writes, CacheKey<T> key, T value, Duration ttl, long now) {
        writes.add(CacheWrite.of(key, value, ttl));
        writes.add(CacheWrite.of(CacheKeys.refreshMetadata(key), RefreshMetadata.builder()
                .cacheKey(key.getValue())
                .createdAt(now)
                .ttlMillis(ttl.toMillis())
                .build(), ttl));
    }

    private List<PullRequest> inWindow(List<PullRequest> pullRequests, Sprint sprint) {
        Instant start = sprint.getStartDate();
        Instant end = sprint.getEndDate();
        if (start == null || end == null) {
            return pullRequests;
        }
        List<PullRequest> window = new ArrayList<>();
        for (PullRequest pr : pullRequests) {
            Instant date = AnalyticsAggregator.activityDate(pr);
            if (date != null && !date.isBefore(start) && !date.isAfter(end)) {
                window.add(pr);
            }
        }
        return window;
    }

    private void recordRefresh(String result) {
        Counter.builder("cache.refresh")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static void addSprintIds(Set<String> sprintIds, String value) {
        if (value == null) {
            return;
        }
        for (String id : value.split(",")) {
            if (!id.isBlank()) {
                sprintIds.add(id.trim());
            }
        }
    }

    int refreshesInFlight() {
        return refreshing.size();
    }
}
