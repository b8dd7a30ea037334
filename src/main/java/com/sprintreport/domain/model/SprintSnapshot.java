package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the report generator needs for one sprint and repository.
 *
 * Deterministic in upstream state: two snapshots of an unchanged sprint are equal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintSnapshot {

    private Sprint sprint;
    private List<Issue> issues;
    private SprintMetrics metrics;
    private String githubOwner;
    private String githubRepo;
    private int commitCount;
    private int pullRequestCount;
}
