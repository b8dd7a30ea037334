package com.sprintreport.domain.service;

import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintState;
import com.sprintreport.infrastructure.cache.CacheKey;
import com.sprintreport.infrastructure.cache.CacheKeys;
import com.sprintreport.infrastructure.cache.CacheStore;
import com.sprintreport.infrastructure.upstream.IssueTrackerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps a sprint's lifecycle state to how long data derived from it may be trusted.
 *
 * TTL Table:
 * - active: 5 minutes (issues move, points change)
 * - closed: 30 days (immutable once closed)
 * - future: 15 minutes (may shift during planning)
 * - unknown: 10 minutes
 *
 * The state itself is cached for one hour under {@code sprint:{id}:state}, so only the
 * first resolution for a sprint goes upstream. Resolution never fails: any error falls
 * back to the default TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SprintTtlPolicy {

    public static final Duration ACTIVE_TTL = Duration.ofMinutes(5);
    public static final Duration CLOSED_TTL = Duration.ofDays(30);
    public static final Duration FUTURE_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final Duration STATE_TTL = Duration.ofHours(1);

    private final CacheStore cacheStore;
    private final IssueTrackerClient issueTrackerClient;

    public Duration resolveTtl(SprintState state) {
        if (state == null) {
            return DEFAULT_TTL;
        }
        return switch (state) {
            case ACTIVE -> ACTIVE_TTL;
            case CLOSED -> CLOSED_TTL;
            case FUTURE -> FUTURE_TTL;
            case UNKNOWN -> DEFAULT_TTL;
        };
    }

    public Duration resolveSprintTtl(String sprintId) {
        return resolveTtl(resolveSprintState(sprintId));
    }

    /**
     * Cached state of a sprint, fetched once from the issue tracker on a miss.
     *
     * @return the state, or {@link SprintState#UNKNOWN} if it cannot be determined
     */
    public SprintState resolveSprintState(String sprintId) {
        try {
            CacheKey<SprintState> key = CacheKeys.sprintState(sprintId);
            Optional<SprintState> cached = cacheStore.get(key);
            if (cached.isPresent()) {
                return cached.get();
            }

            Sprint sprint = issueTrackerClient.getSprint(sprintId);
            SprintState state = sprint != null && sprint.getState() != null ? sprint.getState() : SprintState.UNKNOWN;
            cacheStore.set(key, state, STATE_TTL);

            log.debug("Resolved state {} for sprint {}", state, sprintId);
            return state;

        } catch (Exception e) {
            log.warn("Could not resolve state for sprint {}, using default TTL: {}", sprintId, e.getMessage());
            return SprintState.UNKNOWN;
        }
    }
}
