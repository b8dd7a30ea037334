package com.sprintreport.domain.service;

import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.IssueTypeCount;
import com.sprintreport.domain.model.MonthlyActivity;
import com.sprintreport.domain.model.PullRequest;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.domain.model.SprintVelocity;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.domain.model.VelocityResult;
import com.sprintreport.domain.model.VelocityTrend;
import com.sprintreport.infrastructure.cache.BatchFillEngine;
import com.sprintreport.infrastructure.cache.CacheKey;
import com.sprintreport.infrastructure.cache.CacheKeys;
import com.sprintreport.infrastructure.cache.CacheStore;
import com.sprintreport.infrastructure.upstream.IssueTrackerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derived metrics over a window of recent closed sprints, and monthly commit activity.
 *
 * Window resolution:
 * 1. Closed sprint list for the board (cached 30 minutes)
 * 2. Newest first by start date, first N
 * 3. Issue set per sprint through {@link BatchFillEngine}
 * 4. Reduce
 *
 * Velocity trend is classified over the window in chronological order: the older half
 * is compared with the newer half. Fewer than three sprints is always stable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsAggregator {

    static final Duration CLOSED_SPRINTS_TTL = Duration.ofMinutes(30);
    static final String UNKNOWN_TYPE = "Unknown";
    static final String FALLBACK_COLOR = "#6b7280";

    private static final Map<String, String> TYPE_COLORS = Map.of(
            "Story", "#3b82f6",
            "Bug", "#ef4444",
            "Task", "#f59e0b",
            "Epic", "#8b5cf6",
            "Sub-task", "#06b6d4",
            "Improvement", "#10b981",
            UNKNOWN_TYPE, FALLBACK_COLOR);

    private static final double INCREASING_FACTOR = 1.1;
    private static final double DECREASING_FACTOR = 0.9;
    private static final int MIN_SPRINTS_FOR_TREND = 3;

    // Newest first; sprints without a start date sort last
    private static final Comparator<Sprint> NEWEST_FIRST = Comparator.comparing(
            Sprint::getStartDate, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final CacheStore cacheStore;
    private final IssueTrackerClient issueTrackerClient;
    private final BatchFillEngine batchFillEngine;
    private final SprintTtlPolicy ttlPolicy;

    public List<Sprint> getClosedSprints(String boardId) {
        CacheKey<List<Sprint>> key = CacheKeys.closedSprints(boardId);
        Optional<List<Sprint>> cached = cacheStore.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Sprint> sprints = issueTrackerClient.listSprints(boardId, SprintState.CLOSED);
        cacheStore.set(key, sprints, CLOSED_SPRINTS_TTL);
        log.debug("Fetched {} closed sprints for board {}", sprints.size(), boardId);
        return sprints;
    }

    public List<Sprint> getRecentClosedSprints(String boardId, int sprintCount) {
        List<Sprint> sorted = new ArrayList<>(getClosedSprints(boardId));
        sorted.sort(NEWEST_FIRST);
        return sorted.subList(0, Math.min(sprintCount, sorted.size()));
    }

    /**
     * Issue sets of closed sprints, keyed by sprint id. Every sprint in a closed window is
     * known to be closed, so the closed TTL applies without a state lookup.
     */
    public Map<String, List<Issue>> fetchSprintIssues(List<Sprint> sprints) {
        List<String> ids = sprints.stream().map(Sprint::getId).toList();
        return batchFillEngine.fillBatch(ids,
                CacheKeys::sprintIssues,
                issueTrackerClient::listSprintIssues,
                ttlPolicy.resolveTtl(SprintState.CLOSED));
    }

    public VelocityResult calculateVelocity(String boardId, int sprintCount) {
        List<Sprint> window = getRecentClosedSprints(boardId, sprintCount);
        Map<String, List<Issue>> issuesBySprint = fetchSprintIssues(window);

        List<SprintVelocity> sprints = new ArrayList<>();
        double total = 0;
        for (Sprint sprint : window) {
            List<Issue> issues = issuesBySprint.getOrDefault(sprint.getId(), List.of());
            double completed = IssueMetrics.completed(issues);
            total += completed;
            sprints.add(SprintVelocity.builder()
                    .id(sprint.getId())
                    .name(sprint.getName())
                    .velocity(completed)
                    .commitment(IssueMetrics.commitment(issues))
                    .completed(completed)
                    .build());
        }

        List<Double> chronological = new ArrayList<>();
        for (SprintVelocity sprint : sprints) {
            chronological.add(sprint.getVelocity());
        }
        Collections.reverse(chronological);

        return VelocityResult.builder()
                .sprints(sprints)
                .average(sprints.isEmpty() ? 0 : total / sprints.size())
                .trend(classifyTrend(chronological))
                .build();
    }

    public List<TeamPerformance> calculateTeamPerformance(String boardId, int sprintCount) {
        List<Sprint> window = getRecentClosedSprints(boardId, sprintCount);
        if (window.isEmpty()) {
            log.warn("No closed sprints for board {}, team performance is empty", boardId);
            return new ArrayList<>();
        }

        Map<String, List<Issue>> issuesBySprint = fetchSprintIssues(window);

        List<TeamPerformance> performance = new ArrayList<>();
        for (Sprint sprint : window) {
            List<Issue> issues = issuesBySprint.getOrDefault(sprint.getId(), List.of());
            double completed = IssueMetrics.completed(issues);
            performance.add(TeamPerformance.builder()
                    .name(sprint.getName())
                    .planned(IssueMetrics.commitment(issues))
                    .completed(completed)
                    .velocity(completed)
                    .build());
        }

        log.info("Team performance calculated for board {}: {} sprints", boardId, performance.size());
        return performance;
    }

    public List<IssueTypeCount> calculateIssueTypeDistribution(String boardId, int sprintCount) {
        List<Sprint> window = getRecentClosedSprints(boardId, sprintCount);
        Map<String, List<Issue>> issuesBySprint = fetchSprintIssues(window);

        List<Issue> issues = new ArrayList<>();
        issuesBySprint.values().forEach(issues::addAll);
        return distribution(issues);
    }

    /**
     * Counts issues by type, most frequent first (ties by name).
     */
    static List<IssueTypeCount> distribution(List<Issue> issues) {
        Map<String, Long> counts = new HashMap<>();
        issues.forEach(issue -> counts.merge(typeName(issue), 1L, Long::sum));

        List<IssueTypeCount> distribution = new ArrayList<>();
        counts.forEach((name, count) -> distribution.add(IssueTypeCount.builder()
                .name(name)
                .value(count)
                .color(TYPE_COLORS.getOrDefault(name, FALLBACK_COLOR))
                .build()));
        distribution.sort(Comparator.comparingLong(IssueTypeCount::getValue).reversed()
                .thenComparing(IssueTypeCount::getName));
        return distribution;
    }

    /**
     * Monthly commit and pull request counts.
     *
     * Every month from {@code start} to {@code end} (UTC, inclusive) appears, even with no
     * activity. Items dated outside the range still count in their own month. Commits are
     * dated by author date, then committer date; pull requests by merge, close, then
     * creation date. Undated items are skipped.
     */
    public List<MonthlyActivity> aggregateCommitsByMonth(List<Commit> commits,
                                                         List<PullRequest> pullRequests,
                                                         LocalDate start,
                                                         LocalDate end) {
        TreeMap<YearMonth, int[]> months = new TreeMap<>();

        if (start != null && end != null) {
            YearMonth last = YearMonth.from(end);
            for (YearMonth month = YearMonth.from(start); !month.isAfter(last); month = month.plusMonths(1)) {
                months.put(month, new int[2]);
            }
        }

        if (commits != null) {
            for (Commit commit : commits) {
                Instant date = commit.getDate() != null ? commit.getDate() : commit.getCommitterDate();
                if (date != null) {
                    months.computeIfAbsent(monthOf(date), m -> new int[2])[0]++;
                }
            }
        }

        if (pullRequests != null) {
            for (PullRequest pr : pullRequests) {
                Instant date = activityDate(pr);
                if (date != null) {
                    months.computeIfAbsent(monthOf(date), m -> new int[2])[1]++;
                }
            }
        }

        List<MonthlyActivity> activity = new ArrayList<>(months.size());
        months.forEach((month, count) -> activity.add(MonthlyActivity.builder()
                .date(month.toString())
                .commits(count[0])
                .prs(count[1])
                .build()));
        return activity;
    }

    /**
     * Concatenates sprint lists, newest first; sprints without a start date go last.
     */
    @SafeVarargs
    public static List<Sprint> combineAndSortSprints(List<Sprint>... lists) {
        List<Sprint> combined = new ArrayList<>();
        for (List<Sprint> list : lists) {
            if (list != null) {
                combined.addAll(list);
            }
        }
        combined.sort(NEWEST_FIRST);
        return combined;
    }

    /**
     * @param chronologicalVelocities velocities oldest first
     */
    static VelocityTrend classifyTrend(List<Double> chronologicalVelocities) {
        int size = chronologicalVelocities.size();
        if (size < MIN_SPRINTS_FOR_TREND) {
            return VelocityTrend.STABLE;
        }

        int half = size / 2;
        double olderMean = mean(chronologicalVelocities.subList(0, half));
        double newerMean = mean(chronologicalVelocities.subList(half, size));

        if (newerMean > olderMean * INCREASING_FACTOR) {
            return VelocityTrend.INCREASING;
        }
        if (newerMean < olderMean * DECREASING_FACTOR) {
            return VelocityTrend.DECREASING;
        }
        return VelocityTrend.STABLE;
    }

    static Instant activityDate(PullRequest pr) {
        if (pr.getMergedAt() != null) {
            return pr.getMergedAt();
        }
        if (pr.getClosedAt() != null) {
            return pr.getClosedAt();
        }
        return pr.getCreatedAt();
    }

    private static String typeName(Issue issue) {
        if (issue.getIssueType() != null && !issue.getIssueType().isBlank()) {
            return issue.getIssueType();
        }
        if (issue.getType() != null && !issue.getType().isBlank()) {
            return issue.getType();
        }
        return UNKNOWN_TYPE;
    }

    private static YearMonth monthOf(Instant instant) {
        return YearMonth.from(instant.atZone(ZoneOffset.UTC));
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
