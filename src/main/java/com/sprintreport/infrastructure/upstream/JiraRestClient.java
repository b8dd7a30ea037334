package com.sprintreport.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.sprintreport.domain.model.Issue;
import com.sprintreport.domain.model.Sprint;
import com.sprintreport.domain.model.SprintRef;
import com.sprintreport.domain.model.SprintState;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Jira Agile REST 1.0 adapter.
 *
 * Sprint and issue listings are paginated with startAt/maxResults. Issue pages stop
 * at a short page or after {@value #MAX_ISSUES} issues.
 */
@Slf4j
@Component
public class JiraRestClient implements IssueTrackerClient {

    private static final int PAGE_SIZE = 50;
    private static final int MAX_ISSUES = 1000;
    private static final List<String> STORY_POINT_FIELDS =
            List.of("customfield_10016", "customfield_10004", "customfield_10002");

    private final RestTemplate restTemplate;
    private final MeterRegistry meterRegistry;

    public JiraRestClient(@Qualifier("jiraRestTemplate") RestTemplate restTemplate, MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    @CircuitBreaker(name = "upstream")
    public List<Sprint> listSprints(String boardId, SprintState state) {
        return timed("jira.listSprints", () -> {
            List<Sprint> sprints = new ArrayList<>();
            int startAt = 0;
            boolean last = false;

            while (!last) {
                UriComponentsBuilder uri = UriComponentsBuilder
                        .fromPath("/rest/agile/1.0/board/{boardId}/sprint")
                        .queryParam("startAt", startAt)
                        .queryParam("maxResults", PAGE_SIZE);
                if (state != null && state != SprintState.UNKNOWN) {
                    uri.queryParam("state", state.value());
                }

                JsonNode page = restTemplate.getForObject(uri.buildAndExpand(boardId).toUriString(), JsonNode.class);
                JsonNode values = page != null ? page.path("values") : null;
                if (values == null || !values.isArray() || values.isEmpty()) {
                    break;
                }

                values.forEach(node -> sprints.add(toSprint(node, boardId)));
                startAt += values.size();
                last = page.path("isLast").asBoolean(values.size() < PAGE_SIZE);
            }

            log.debug("Fetched {} {} sprints for board {}", sprints.size(), state, boardId);
            return sprints;
        });
    }

    @Override
    @CircuitBreaker(name = "upstream")
    public List<Issue> listSprintIssues(String sprintId) {
        return timed("jira.listSprintIssues", () -> {
            List<Issue> issues = new ArrayList<>();
            int startAt = 0;

            while (issues.size() < MAX_ISSUES) {
                String uri = UriComponentsBuilder
                        .fromPath("/rest/agile/1.0/sprint/{sprintId}/issue")
                        .queryParam("startAt", startAt)
                        .queryParam("maxResults", PAGE_SIZE)
                        .buildAndExpand(sprintId)
                        .toUriString();

                JsonNode page = restTemplate.getForObject(uri, JsonNode.class);
                JsonNode values = page != null ? page.path("issues") : null;
                if (values == null || !values.isArray() || values.isEmpty()) {
                    break;
                }

                values.forEach(node -> issues.add(toIssue(node, sprintId)));
                if (values.size() < PAGE_SIZE) {
                    break;
                }
                startAt += PAGE_SIZE;
            }

            if (issues.size() >= MAX_ISSUES) {
                log.warn("Sprint {} reached the {} issue limit, remaining issues were not fetched", sprintId, MAX_ISSUES);
            }
            log.debug("Fetched {} issues for sprint {}", issues.size(), sprintId);
            return issues;
        });
    }

    @Override
    @CircuitBreaker(name = "upstream")
    public Sprint getSprint(String sprintId) {
        return timed("jira.getSprint", () -> {
            JsonNode node = restTemplate.getForObject("/rest/agile/1.0/sprint/{sprintId}", JsonNode.class, sprintId);
            if (node == null) {
                throw new UpstreamFetchException("jira.getSprint", "Empty response for sprint " + sprintId);
            }
            return toSprint(node, null);
        });
    }

    private <T> T timed(String operation, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return call.get();
        } catch (RestClientException e) {
            log.error("Jira call {} failed: {}", operation, e.getMessage());
            throw new UpstreamFetchException(operation, "Issue tracker request failed", e);
        } finally {
            sample.stop(Timer.builder("upstream.fetch")
                    .tag("operation", operation)
                    .register(meterRegistry));
        }
    }

    private Sprint toSprint(JsonNode node, String boardId) {
        JsonNode originBoard = node.path("originBoardId");
        return Sprint.builder()
                .id(node.path("id").asText())
                .name(node.path("name").asText(null))
                .state(SprintState.fromValue(node.path("state").asText(null)))
                .startDate(UpstreamDates.parse(node.get("startDate")))
                .endDate(UpstreamDates.parse(node.get("endDate")))
                .boardId(originBoard.isMissingNode() || originBoard.isNull() ? boardId : originBoard.asText())
                .build();
    }

    private Issue toIssue(JsonNode node, String sprintId) {
        JsonNode fields = node.path("fields");
        return Issue.builder()
                .key(node.path("key").asText())
                .status(fields.path("status").path("name").asText("Unknown"))
                .storyPoints(storyPoints(fields))
                .issueType(fields.path("issuetype").path("name").asText(null))
                .sprint(new SprintRef(sprintId))
                .build();
    }

    private Double storyPoints(JsonNode fields) {
        for (String field : STORY_POINT_FIELDS) {
            JsonNode value = fields.get(field);
            if (value != null && value.isNumber() && value.asDouble() >= 0) {
                return value.asDouble();
            }
        }
        return null;
    }
}
