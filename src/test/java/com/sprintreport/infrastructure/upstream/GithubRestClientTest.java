package com.sprintreport.infrastructure.upstream;

import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.PullRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.http.HttpStatus.FORBIDDEN;

class GithubRestClientTest {

    private static final String ROOT = "https://github.test";

    private MockRestServiceServer server;
    private GithubRestClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ROOT).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GithubRestClient(restTemplate, new SimpleMeterRegistry());
    }

    @Test
    void testListCommits_AuthorAndCommitterDates() {
        // Given
        server.expect(requestTo(ROOT + "/repos/acme/web/commits"
                        + "?since=2024-02-01T00:00:00Z&until=2024-02-14T00:00:00Z&per_page=100&page=1"))
                .andRespond(withSuccess("""
                        [
                          {"sha": "a1", "commit": {
                            "author": {"date": "2024-02-03T10:00:00Z"},
                            "committer": {"date": "2024-02-03T11:00:00Z"}}},
                          {"sha": "b2", "commit": {"committer": {"date": "2024-02-04T08:00:00Z"}}}
                        ]""", MediaType.APPLICATION_JSON));

        // When
        List<Commit> commits = client.listCommits("acme", "web",
                Instant.parse("2024-02-01T00:00:00Z"), Instant.parse("2024-02-14T00:00:00Z"));

        // Then
        server.verify();
        assertEquals(2, commits.size());
        assertEquals(Instant.parse("2024-02-03T10:00:00Z"), commits.get(0).getDate());
        assertEquals(Instant.parse("2024-02-03T11:00:00Z"), commits.get(0).getCommitterDate());
        assertNull(commits.get(1).getDate());
        assertEquals(Instant.parse("2024-02-04T08:00:00Z"), commits.get(1).getCommitterDate());
    }

    @Test
    void testListPullRequests_MergedStateFromMergeDate() {
        // Given
        server.expect(requestTo(ROOT + "/repos/acme/web/pulls?state=all&sort=updated&direction=desc&per_page=100&page=1"))
                .andRespond(withSuccess("""
                        [
                          {"number": 7, "state": "closed", "merged_at": "2024-02-05T10:00:00Z",
                           "closed_at": "2024-02-05T10:00:00Z", "created_at": "2024-02-01T10:00:00Z"},
                          {"number": 8, "state": "open", "merged_at": null, "closed_at": null,
                           "created_at": "2024-02-06T10:00:00Z"}
                        ]""", MediaType.APPLICATION_JSON));

        // When
        List<PullRequest> pullRequests = client.listPullRequests("acme", "web", "all");

        // Then
        server.verify();
        assertEquals("merged", pullRequests.get(0).getState());
        assertEquals(Instant.parse("2024-02-05T10:00:00Z"), pullRequests.get(0).getMergedAt());
        assertEquals("open", pullRequests.get(1).getState());
        assertNull(pullRequests.get(1).getMergedAt());
    }

    @Test
    void testListCommits_RateLimitedBecomesUpstreamFailure() {
        // Given
        server.expect(requestTo(ROOT + "/repos/acme/web/commits?per_page=100&page=1"))
                .andRespond(withStatus(FORBIDDEN));

        // When / Then
        UpstreamFetchException error = assertThrows(UpstreamFetchException.class,
                () -> client.listCommits("acme", "web", null, null));
        assertEquals("github.listCommits", error.getOperation());
    }
}
