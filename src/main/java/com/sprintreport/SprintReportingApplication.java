package com.sprintreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sprint and repository reporting backend.
 *
 * Architecture:
 * - REST APIs for velocity, team performance, issue types and commit trends
 * - Two-tier cache (Caffeine in front of Redis) with TTLs chosen by sprint state
 * - Batch fill of per-sprint issue sets with bounded upstream fan-out
 * - Half-life background refresh of cached metrics
 * - Webhook-driven invalidation and queued warming of closed sprints
 */
@SpringBootApplication
@EnableScheduling
public class SprintReportingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SprintReportingApplication.class, args);
    }
}
