package com.sprintreport.api;

import com.sprintreport.domain.model.IssueTypeCount;
import com.sprintreport.domain.model.MonthlyActivity;
import com.sprintreport.domain.model.TeamPerformance;
import com.sprintreport.domain.model.VelocityResult;
import com.sprintreport.domain.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for sprint and repository analytics.
 *
 * Endpoints:
 * - GET /api/v1/analytics/velocity/{boardId} - Velocity over recent closed sprints
 * - GET /api/v1/analytics/team-performance/{boardId} - Planned vs completed per sprint
 * - GET /api/v1/analytics/issue-types/{boardId} - Issue-type distribution
 * - GET /api/v1/analytics/commit-trends/{owner}/{repo} - Monthly commits and pull requests
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    /**
     * GET /api/v1/analytics/velocity/{boardId}?sprints=10
     *
     * Response:
     * - sprints: newest first, with velocity, commitment and completed points
     * - average: mean velocity
     * - trend: increasing | decreasing | stable
     */
    @GetMapping("/velocity/{boardId}")
    public ResponseEntity<VelocityResult> getVelocity(
            @PathVariable String boardId,
            @RequestParam(name = "sprints", defaultValue = "10") int sprintCount) {

        log.info("Velocity: boardId={}, sprints={}", boardId, sprintCount);

        return ResponseEntity.ok(analyticsService.getVelocity(boardId, sprintCount));
    }

    @GetMapping("/team-performance/{boardId}")
    public ResponseEntity<List<TeamPerformance>> getTeamPerformance(
            @PathVariable String boardId,
            @RequestParam(name = "sprints", defaultValue = "10") int sprintCount) {

        log.info("Team performance: boardId={}, sprints={}", boardId, sprintCount);

        return ResponseEntity.ok(analyticsService.getTeamPerformance(boardId, sprintCount));
    }

    @GetMapping("/issue-types/{boardId}")
    public ResponseEntity<List<IssueTypeCount>> getIssueTypeDistribution(
            @PathVariable String boardId,
            @RequestParam(name = "sprints", defaultValue = "6") int sprintCount) {

        log.info("Issue types: boardId={}, sprints={}", boardId, sprintCount);

        return ResponseEntity.ok(analyticsService.getIssueTypeDistribution(boardId, sprintCount));
    }

    /**
     * GET /api/v1/analytics/commit-trends/{owner}/{repo}?period=6months
     *
     * Period: 1month | 3months | 6months | 1year. Every month in the period appears,
     * zero-filled when there was no activity.
     */
    @GetMapping("/commit-trends/{owner}/{repo}")
    public ResponseEntity<List<MonthlyActivity>> getCommitTrends(
            @PathVariable String owner,
            @PathVariable String repo,
            @RequestParam(defaultValue = "6months") String period) {

        log.info("Commit trends: {}/{}, period={}", owner, repo, period);

        return ResponseEntity.ok(analyticsService.getCommitTrends(owner, repo, period));
    }
}
