package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequest {

    private Integer number;
    private String state;
    private Instant mergedAt;
    private Instant closedAt;
    private Instant createdAt;
}
