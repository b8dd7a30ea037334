package com.sprintreport.infrastructure.upstream;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per upstream, each rooted at its base URL with its own credentials.
 */
@Configuration
public class UpstreamConfig {

    @Value("${app.upstream.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${app.upstream.read-timeout:30s}")
    private Duration readTimeout;

    @Bean("jiraRestTemplate")
    public RestTemplate jiraRestTemplate(RestTemplateBuilder builder,
                                         @Value("${app.upstream.jira.base-url}") String baseUrl,
                                         @Value("${app.upstream.jira.email:}") String email,
                                         @Value("${app.upstream.jira.api-token:}") String apiToken) {
        RestTemplateBuilder jira = builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .defaultHeader("Accept", "application/json");
        if (!email.isBlank() && !apiToken.isBlank()) {
            jira = jira.basicAuthentication(email, apiToken);
        }
        return jira.build();
    }

    @Bean("githubRestTemplate")
    public RestTemplate githubRestTemplate(RestTemplateBuilder builder,
                                           @Value("${app.upstream.github.base-url:https://api.github.com}") String baseUrl,
                                           @Value("${app.upstream.github.token:}") String token) {
        RestTemplateBuilder github = builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .defaultHeader("Accept", "application/vnd.github+json");
        if (!token.isBlank()) {
            github = github.defaultHeader("Authorization", "Bearer " + token);
        }
        return github.build();
    }
}
