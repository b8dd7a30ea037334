package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Velocity over a rolling window of closed sprints.
 *
 * Sprints are listed newest first; the trend is classified chronologically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VelocityResult {

    private List<SprintVelocity> sprints;
    private double average;
    private VelocityTrend trend;
}
