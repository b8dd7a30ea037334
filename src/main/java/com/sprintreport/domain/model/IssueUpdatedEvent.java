package com.sprintreport.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Issue-updated webhook payload as the issue tracker delivers it.
 *
 * Only the fields that drive invalidation are mapped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueUpdatedEvent {

    private IssuePayload issue;
    private ChangeLog changelog;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IssuePayload {
        private String key;
        private Fields fields;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fields {
        private SprintRef sprint;
    }

    public Issue toIssue() {
        if (issue == null) {
            return null;
        }
        SprintRef sprint = issue.getFields() != null ? issue.getFields().getSprint() : null;
        return Issue.builder()
                .key(issue.getKey())
                .sprint(sprint)
                .build();
    }
}
