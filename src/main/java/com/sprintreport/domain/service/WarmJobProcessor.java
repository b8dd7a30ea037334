package com.sprintreport.domain.service;

import com.sprintreport.infrastructure.persistence.entity.WarmJobEntity;
import com.sprintreport.infrastructure.persistence.repository.WarmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Queued cache warming for closed sprints.
 *
 * Processing Flow:
 * 1. Sprint-closed webhook (or an operator) submits a job, PENDING
 * 2. Caller receives the job ID immediately
 * 3. Poller picks up to 10 pending jobs, oldest first
 * 4. Job is marked RUNNING, the sprint is warmed
 * 5. Job is marked COMPLETED, or FAILED with the error message
 *
 * Warming is an optimization: a failed job leaves the cache cold and reads fall back
 * to upstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarmJobProcessor {

    private final WarmJobRepository warmJobRepository;
    private final CacheOrchestrator cacheOrchestrator;
    private final Clock clock;

    @Transactional
    public UUID submitWarmJob(String sprintId, String githubOwner, String githubRepo) {
        WarmJobEntity job = WarmJobEntity.builder()
                .sprintId(sprintId)
                .githubOwner(githubOwner)
                .githubRepo(githubRepo)
                .createdAt(clock.instant())
                .build();

        job = warmJobRepository.save(job);

        log.info("Warm job submitted: {} (sprint: {})", job.getJobId(), sprintId);

        return job.getJobId();
    }

    @Transactional(readOnly = true)
    public WarmJobEntity getJobStatus(UUID jobId) {
        return warmJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
    }

    /**
     * Picks up pending jobs. Jobs run one after another on the scheduler thread; warming
     * fans out to upstream on its own.
     */
    @Scheduled(fixedDelayString = "${app.warm.poll-interval-ms:5000}")
    public void processPendingJobs() {
        try {
            List<WarmJobEntity> pendingJobs = warmJobRepository
                    .findTop10ByStatusOrderByCreatedAtAsc(WarmJobEntity.JobStatus.PENDING);

            if (pendingJobs.isEmpty()) {
                return;
            }

            log.debug("Processing {} pending warm jobs", pendingJobs.size());

            for (WarmJobEntity job : pendingJobs) {
                processJob(job);
            }

        } catch (Exception e) {
            log.error("Error processing pending warm jobs: {}", e.getMessage(), e);
        }
    }

    void processJob(WarmJobEntity job) {
        try {
            log.info("Processing warm job: {} (sprint: {})", job.getJobId(), job.getSprintId());

            job.markStarted(clock.instant());
            warmJobRepository.save(job);

            cacheOrchestrator.warmSprintCache(job.getSprintId(), job.getGithubOwner(), job.getGithubRepo());

            job.markCompleted(clock.instant());
            warmJobRepository.save(job);

            log.info("Warm job completed: {} ({} ms)", job.getJobId(), job.getExecutionTimeMs());

        } catch (Exception e) {
            log.error("Error processing warm job {}: {}", job.getJobId(), e.getMessage(), e);

            job.markFailed(e.getMessage(), clock.instant());
            warmJobRepository.save(job);
        }
    }
}
