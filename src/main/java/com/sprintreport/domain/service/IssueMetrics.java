package com.sprintreport.domain.service;

import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.SprintMetrics;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-sprint reductions over an issue set.
 */
final class IssueMetrics {

    private static final Set<String> COMPLETED_STATUSES = Set.of("done", "closed", "resolved");

    private IssueMetrics() {
    }

    static boolean isCompleted(Issue issue) {
        return issue.getStatus() != null
                && COMPLETED_STATUSES.contains(issue.getStatus().trim().toLowerCase(Locale.ROOT));
    }

    static double points(Issue issue) {
        return issue.getStoryPoints() != null ? issue.getStoryPoints() : 0;
    }

    static double commitment(List<Issue> issues) {
        return issues.stream().mapToDouble(IssueMetrics::points).sum();
    }

    static double completed(List<Issue> issues) {
        return issues.stream().filter(IssueMetrics::isCompleted).mapToDouble(IssueMetrics::points).sum();
    }

    static SprintMetrics summarize(String sprintId, List<Issue> issues) {
        return SprintMetrics.builder()
                .sprintId(sprintId)
                .commitment(commitment(issues))
                .completed(completed(issues))
                .issueCount(issues.size())
                .completedIssueCount((int) issues.stream().filter(IssueMetrics::isCompleted).count())
                .build();
    }
}
