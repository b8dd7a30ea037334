package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One slice of the issue-type pie chart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueTypeCount {

    private String name;
    private long value;
    private String color;
}
