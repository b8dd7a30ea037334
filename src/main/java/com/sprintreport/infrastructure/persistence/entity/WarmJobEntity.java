package com.sprintreport.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Queued cache warming for a closed sprint.
 *
 * Sprint-closed webhooks enqueue a job here; the processor picks it up and clients poll
 * this table for the outcome.
 */
@Entity
@Table(name = "warm_jobs", indexes = {
    @Index(name = "idx_warm_job_status", columnList = "status"),
    @Index(name = "idx_warm_job_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Column(nullable = false, length = 50)
    private String sprintId;

    @Column(nullable = false, length = 100)
    private String githubOwner;

    @Column(nullable = false, length = 100)
    private String githubRepo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(length = 500)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted(Instant now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(Instant now) {
        this.status = JobStatus.COMPLETED;
        this.completedAt = now;
    }

    public void markFailed(String error, Instant now) {
        this.status = JobStatus.FAILED;
        this.errorMessage = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        this.completedAt = now;
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
