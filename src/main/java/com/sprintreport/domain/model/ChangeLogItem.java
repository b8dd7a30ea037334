package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field transition of an issue change log, e.g. a move between sprints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeLogItem {

    private String field;
    private String from;
    private String to;
}
