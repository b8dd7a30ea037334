package com.sprintreport.api;

import com.sprintreport.domain.model.IssueUpdatedEvent;
import com.sprintreport.domain.model.SprintClosedEvent;
import com.sprintreport.domain.service.AnalyticsService;
import com.sprintreport.domain.service.WarmJobProcessor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Issue tracker webhooks driving cache invalidation.
 *
 * Endpoints:
 * - POST /api/v1/webhooks/jira/issue-updated - Invalidate the issue's sprints
 * - POST /api/v1/webhooks/jira/sprint-closed - Invalidate the sprint and queue a warm job
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/jira")
@RequiredArgsConstructor
public class WebhookController {

    private final AnalyticsService analyticsService;
    private final WarmJobProcessor warmJobProcessor;

    /**
     * Request body:
     * {
     *   "issue": { "key": "PROJ-1", "fields": { "sprint": { "id": "42" } } },
     *   "changelog": { "items": [ { "field": "Sprint", "from": "41", "to": "42" } ] }
     * }
     */
    @PostMapping("/issue-updated")
    public ResponseEntity<Map<String, Set<String>>> issueUpdated(@RequestBody IssueUpdatedEvent event) {
        log.info("Issue updated webhook: {}", event.getIssue() != null ? event.getIssue().getKey() : null);

        Set<String> sprintIds = analyticsService.invalidateIssueCache(event.toIssue(), event.getChangelog());

        return ResponseEntity.ok(Map.of("invalidatedSprints", sprintIds));
    }

    @PostMapping("/sprint-closed")
    public ResponseEntity<Map<String, UUID>> sprintClosed(@Valid @RequestBody SprintClosedEvent event) {
        log.info("Sprint closed webhook: sprintId={}", event.getSprintId());

        analyticsService.invalidateSprintCache(event.getSprintId());
        UUID jobId = warmJobProcessor.submitWarmJob(event.getSprintId(), event.getGithubOwner(), event.getGithubRepo());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }
}
