package com.sprintreport.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.IssueTypeCount;
import com.sprintreport.domain.model.MonthlyActivity;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintMetrics;
import com.sprintreport.domain.model.SprintSnapshot;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.domain.model.VelocityResult;

import java.util.List;

/**
 * The only place cache keys and invalidation patterns are built.
 *
 * Key layout is {@code namespace:entity:qualifier...}. Segments containing the
 * separator or a glob character are rejected, so a caller-supplied id can never
 * address another key or widen a prefix delete.
 */
public final class CacheKeys {

    static final String SEPARATOR = ":";
    static final String METADATA_SUFFIX = "metadata";
    static final String WILDCARD = "*";

    private static final char[] RESERVED = {':', '*', '?'};

    private static final TypeReference<SprintState> SPRINT_STATE = new TypeReference<>() { };
    private static final TypeReference<List<Issue>> ISSUES = new TypeReference<>() { };
    private static final TypeReference<SprintMetrics> SPRINT_METRICS = new TypeReference<>() { };
    private static final TypeReference<List<Sprint>> SPRINTS = new TypeReference<>() { };
    private static final TypeReference<SprintSnapshot> SNAPSHOT = new TypeReference<>() { };
    private static final TypeReference<VelocityResult> VELOCITY = new TypeReference<>() { };
    private static final TypeReference<List<TeamPerformance>> TEAM_PERFORMANCE = new TypeReference<>() { };
    private static final TypeReference<List<IssueTypeCount>> ISSUE_TYPES = new TypeReference<>() { };
    private static final TypeReference<List<MonthlyActivity>> COMMIT_TRENDS = new TypeReference<>() { };
    private static final TypeReference<RefreshMetadata> METADATA = new TypeReference<>() { };

    private CacheKeys() {
    }

    // sprint:{id}:*

    public static CacheKey<SprintState> sprintState(String sprintId) {
        return new CacheKey<>(build(CacheNamespace.SPRINT, sprintId, "state"), CacheNamespace.SPRINT, SPRINT_STATE);
    }

    public static CacheKey<List<Issue>> sprintIssues(String sprintId) {
        return new CacheKey<>(build(CacheNamespace.SPRINT, sprintId, "issues", "all"), CacheNamespace.SPRINT, ISSUES);
    }

    public static CacheKey<SprintMetrics> sprintMetrics(String sprintId) {
        return new CacheKey<>(build(CacheNamespace.SPRINT, sprintId, "metrics", "summary"), CacheNamespace.SPRINT, SPRINT_METRICS);
    }

    // sprints:{state}:{boardId}

    public static CacheKey<List<Sprint>> closedSprints(String boardId) {
        return new CacheKey<>(build(CacheNamespace.SPRINTS, "closed", boardId), CacheNamespace.SPRINTS, SPRINTS);
    }

    public static CacheKey<List<Sprint>> allSprints(String boardId) {
        return new CacheKey<>(build(CacheNamespace.SPRINTS, "all", boardId), CacheNamespace.SPRINTS, SPRINTS);
    }

    // comprehensive:{sprintId}:{owner}:{repo}

    public static CacheKey<SprintSnapshot> comprehensive(String sprintId, String owner, String repo) {
        return new CacheKey<>(build(CacheNamespace.COMPREHENSIVE, sprintId, owner, repo), CacheNamespace.COMPREHENSIVE, SNAPSHOT);
    }

    // analytics:{metric}:...

    public static CacheKey<VelocityResult> velocity(String boardId, int sprintCount) {
        return new CacheKey<>(build(CacheNamespace.ANALYTICS, "velocity", boardId, String.valueOf(sprintCount)),
                CacheNamespace.ANALYTICS, VELOCITY);
    }

    public static CacheKey<List<TeamPerformance>> teamPerformance(String boardId, int sprintCount) {
        return new CacheKey<>(build(CacheNamespace.ANALYTICS, "team-performance", boardId, String.valueOf(sprintCount)),
                CacheNamespace.ANALYTICS, TEAM_PERFORMANCE);
    }

    public static CacheKey<List<IssueTypeCount>> issueTypes(String boardId, int sprintCount) {
        return new CacheKey<>(build(CacheNamespace.ANALYTICS, "issue-types", boardId, String.valueOf(sprintCount)),
                CacheNamespace.ANALYTICS, ISSUE_TYPES);
    }

    public static CacheKey<List<MonthlyActivity>> commitTrends(String owner, String repo, String period) {
        return new CacheKey<>(build(CacheNamespace.ANALYTICS, "commit-trends", owner, repo, period),
                CacheNamespace.ANALYTICS, COMMIT_TRENDS);
    }

    /**
     * Side record used to decide when {@code key} has crossed its half-life.
     * Lives under the same prefix as the key so invalidation removes both.
     */
    public static CacheKey<RefreshMetadata> refreshMetadata(CacheKey<?> key) {
        return new CacheKey<>(key.getValue() + SEPARATOR + METADATA_SUFFIX, key.getNamespace(), METADATA);
    }

    /**
     * Patterns covering every entry structurally derived from a sprint.
     */
    public static List<String> sprintInvalidationPatterns(String sprintId) {
        return List.of(
                build(CacheNamespace.SPRINT, sprintId, "issues") + SEPARATOR + WILDCARD,
                build(CacheNamespace.SPRINT, sprintId, "metrics") + SEPARATOR + WILDCARD,
                build(CacheNamespace.COMPREHENSIVE, sprintId) + SEPARATOR + WILDCARD,
                build(CacheNamespace.SPRINT, sprintId, "state"));
    }

    private static String build(CacheNamespace namespace, String... parts) {
        StringBuilder key = new StringBuilder(namespace.getPrefix());
        for (String part : parts) {
            key.append(SEPARATOR).append(segment(part));
        }
        return key.toString();
    }

    private static String segment(String part) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException("Cache key segment must not be blank");
        }
        String trimmed = part.trim();
        for (char reserved : RESERVED) {
            if (trimmed.indexOf(reserved) >= 0) {
                throw new IllegalArgumentException("Cache key segment must not contain '" + reserved + "': " + trimmed);
            }
        }
        return trimmed;
    }
}
