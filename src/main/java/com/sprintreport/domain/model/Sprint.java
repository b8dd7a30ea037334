package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read-only mirror of an issue-tracker sprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sprint {

    private String id;
    private String name;
    private SprintState state;
    private Instant startDate;
    private Instant endDate;
    private String boardId;
}
