package com.sprintreport.infrastructure.upstream;

import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.PullRequest;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the source control host. Failures surface as {@link UpstreamFetchException}.
 */
public interface SourceControlClient {

    List<Commit> listCommits(String owner, String repo, Instant since, Instant until);

    /**
     * @param state {@code open}, {@code closed} or {@code all}
     */
    List<PullRequest> listPullRequests(String owner, String repo, String state);
}
