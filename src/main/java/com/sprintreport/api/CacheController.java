package com.sprintreport.api;

import com.sprintreport.domain.model.CacheStats;
import com.sprintreport.domain.model.SprintSnapshot;
import com.sprintreport.domain.service.AnalyticsService;
import com.sprintreport.domain.service.WarmJobProcessor;
import com.sprintreport.infrastructure.persistence.entity.WarmJobEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Cache administration.
 *
 * Endpoints:
 * - POST /api/v1/cache/sprints/{sprintId}/warm - Warm synchronously
 * - POST /api/v1/cache/sprints/{sprintId}/warm-jobs - Queue a warm job
 * - GET /api/v1/cache/warm-jobs/{jobId} - Warm job status
 * - DELETE /api/v1/cache/sprints/{sprintId} - Invalidate a sprint
 * - GET /api/v1/cache/stats - Cache counters
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheController {

    private final AnalyticsService analyticsService;
    private final WarmJobProcessor warmJobProcessor;

    /**
     * POST /api/v1/cache/sprints/{sprintId}/warm?owner=xxx&repo=xxx
     *
     * Response:
     * {
     *   "sprintId": "...",
     *   "issues": 42,
     *   "commits": 120,
     *   "pullRequests": 18
     * }
     */
    @PostMapping("/sprints/{sprintId}/warm")
    public ResponseEntity<Map<String, Object>> warmSprint(
            @PathVariable String sprintId,
            @RequestParam String owner,
            @RequestParam String repo) {

        log.info("Warm sprint: sprintId={}, repo={}/{}", sprintId, owner, repo);

        SprintSnapshot snapshot = analyticsService.warmSprintCache(sprintId, owner, repo);

        return ResponseEntity.ok(Map.of(
                "sprintId", sprintId,
                "issues", snapshot.getIssues().size(),
                "commits", snapshot.getCommitCount(),
                "pullRequests", snapshot.getPullRequestCount()));
    }

    @PostMapping("/sprints/{sprintId}/warm-jobs")
    public ResponseEntity<Map<String, UUID>> submitWarmJob(
            @PathVariable String sprintId,
            @RequestParam String owner,
            @RequestParam String repo) {

        log.info("Submit warm job: sprintId={}, repo={}/{}", sprintId, owner, repo);

        UUID jobId = warmJobProcessor.submitWarmJob(sprintId, owner, repo);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    /**
     * GET /api/v1/cache/warm-jobs/{jobId}
     *
     * Response:
     * {
     *   "jobId": "uuid",
     *   "status": "PENDING|RUNNING|COMPLETED|FAILED",
     *   "errorMessage": "...",
     *   "executionTimeMs": 1234
     * }
     */
    @GetMapping("/warm-jobs/{jobId}")
    public ResponseEntity<WarmJobEntity> getWarmJob(@PathVariable UUID jobId) {
        log.info("Get warm job: jobId={}", jobId);

        return ResponseEntity.ok(warmJobProcessor.getJobStatus(jobId));
    }

    @DeleteMapping("/sprints/{sprintId}")
    public ResponseEntity<Map<String, Object>> invalidateSprint(@PathVariable String sprintId) {
        log.info("Invalidate sprint: sprintId={}", sprintId);

        long removed = analyticsService.invalidateSprintCache(sprintId);

        return ResponseEntity.ok(Map.of("sprintId", sprintId, "removed", removed));
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(analyticsService.getCacheStats());
    }
}
