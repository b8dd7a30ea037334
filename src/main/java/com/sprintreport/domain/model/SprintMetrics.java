package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintMetrics {

    private String sprintId;
    private double commitment;
    private double completed;
    private int issueCount;
    private int completedIssueCount;
}
