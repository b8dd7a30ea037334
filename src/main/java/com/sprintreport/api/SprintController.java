package com.sprintreport.api;

import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Cached sprint listings.
 *
 * Endpoints:
 * - GET /api/v1/sprints?boardId=xxx - Active, closed and future sprints, newest first
 * - GET /api/v1/sprints/{sprintId}/issues - Issues of one sprint
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sprints")
@RequiredArgsConstructor
public class SprintController {

    private final AnalyticsService analyticsService;

    @GetMapping
    public ResponseEntity<List<Sprint>> getSprints(@RequestParam String boardId) {
        log.info("Sprints: boardId={}", boardId);

        return ResponseEntity.ok(analyticsService.getAllSprints(boardId));
    }

    @GetMapping("/{sprintId}/issues")
    public ResponseEntity<List<Issue>> getSprintIssues(@PathVariable String sprintId) {
        log.info("Sprint issues: sprintId={}", sprintId);

        return ResponseEntity.ok(analyticsService.getSprintIssues(sprintId));
    }
}
