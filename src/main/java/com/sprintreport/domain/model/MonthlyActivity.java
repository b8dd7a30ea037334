package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Commit and pull request counts for one calendar month ({@code YYYY-MM}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyActivity {

    private String date;
    private int commits;
    private int prs;
}
