package com.sprintreport.infrastructure.upstream;

import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintState;

import java.util.List;

/**
 * Read-only view of the issue tracker. Failures surface as {@link UpstreamFetchException}.
 */
public interface IssueTrackerClient {

    /**
     * @param state filter, or {@code null} / {@link SprintState#UNKNOWN} for every state
     */
    List<Sprint> listSprints(String boardId, SprintState state);

    List<Issue> listSprintIssues(String sprintId);

    Sprint getSprint(String sprintId);
}
