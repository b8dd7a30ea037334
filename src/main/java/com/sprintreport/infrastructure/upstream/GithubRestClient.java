package com.sprintreport.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.sprintreport.domain.model.Commit;
import com.sprintreport.domain.model.PullRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * GitHub REST v3 adapter. Lists are read 100 per page, at most {@value #MAX_PAGES} pages.
 */
@Slf4j
@Component
public class GithubRestClient implements SourceControlClient {

    private static final int PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    private final RestTemplate restTemplate;
    private final MeterRegistry meterRegistry;

    public GithubRestClient(@Qualifier("githubRestTemplate") RestTemplate restTemplate, MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    @CircuitBreaker(name = "upstream")
    public List<Commit> listCommits(String owner, String repo, Instant since, Instant until) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromPath("/repos/{owner}/{repo}/commits");
        if (since != null) {
            uri.queryParam("since", since.toString());
        }
        if (until != null) {
            uri.queryParam("until", until.toString());
        }
        return fetchPages("github.listCommits", uri, owner, repo, this::toCommit);
    }

    @Override
    @CircuitBreaker(name = "upstream")
    public List<PullRequest> listPullRequests(String owner, String repo, String state) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromPath("/repos/{owner}/{repo}/pulls")
                .queryParam("state", state != null ? state : "all")
                .queryParam("sort", "updated")
                .queryParam("direction", "desc");
        return fetchPages("github.listPullRequests", uri, owner, repo, this::toPullRequest);
    }

    private <T> List<T> fetchPages(String operation, UriComponentsBuilder base, String owner, String repo,
                                   Function<JsonNode, T> mapper) {
        Timer.Sample sample = Timer.start(meterRegistry);
        List<T> items = new ArrayList<>();
        try {
            for (int page = 1; page <= MAX_PAGES; page++) {
                String uri = base.cloneBuilder()
                        .queryParam("per_page", PER_PAGE)
                        .queryParam("page", page)
                        .buildAndExpand(owner, repo)
                        .toUriString();

                JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
                if (body == null || !body.isArray() || body.isEmpty()) {
                    break;
                }
                body.forEach(node -> items.add(mapper.apply(node)));
                if (body.size() < PER_PAGE) {
                    break;
                }
            }
            log.debug("{} returned {} items for {}/{}", operation, items.size(), owner, repo);
            return items;
        } catch (RestClientException e) {
            log.error("GitHub call {} failed for {}/{}: {}", operation, owner, repo, e.getMessage());
            throw new UpstreamFetchException(operation, "Source control request failed", e);
        } finally {
            sample.stop(Timer.builder("upstream.fetch")
                    .tag("operation", operation)
                    .register(meterRegistry));
        }
    }

    private Commit toCommit(JsonNode node) {
        JsonNode commit = node.path("commit");
        return Commit.builder()
                .sha(node.path("sha").asText())
                .date(UpstreamDates.parse(commit.path("author").get("date")))
                .committerDate(UpstreamDates.parse(commit.path("committer").get("date")))
                .build();
    }

    private PullRequest toPullRequest(JsonNode node) {
        Instant mergedAt = UpstreamDates.parse(node.get("merged_at"));
        return PullRequest.builder()
                .number(node.path("number").asInt())
                .state(mergedAt != null ? "merged" : node.path("state").asText())
                .mergedAt(mergedAt)
                .closedAt(UpstreamDates.parse(node.get("closed_at")))
                .createdAt(UpstreamDates.parse(node.get("created_at")))
                .build();
    }
}
