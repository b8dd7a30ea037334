package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only mirror of an issue-tracker issue.
 *
 * Issues are cached per sprint as a list; the sprint a list belongs to is the
 * unit of invalidation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Issue {

    private String key;
    private String status;
    private Double storyPoints;
    private String issueType;

    // Legacy payloads carry the type here instead of issueType
    private String type;

    private SprintRef sprint;
}
