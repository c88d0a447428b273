package com.salesinsight.domain.importing;

import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity.JobStatus;
import com.salesinsight.infrastructure.persistence.repository.ImportJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background dispatch of submitted imports.
 *
 * Polls for jobs that never started, claims each one (only one instance can
 * win the PENDING -> PROCESSING update) and hands it to the async pipeline.
 * Jobs run concurrently with each other; rows within a job run in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportJobScheduler {

    private final ImportJobRepository jobRepository;
    private final ImportTracker tracker;
    private final ImportPipeline pipeline;

    @Scheduled(fixedDelayString = "${app.import.poll-interval-ms:1000}")
    public void dispatchPendingJobs() {
        try {
            List<ImportJobEntity> pendingJobs = jobRepository
                    .findTop10ByStatusAndStartedAtIsNullOrderByCreatedAtAsc(JobStatus.PENDING);

            if (pendingJobs.isEmpty()) {
                return;
            }

            log.debug("Dispatching {} pending imports", pendingJobs.size());

            for (ImportJobEntity job : pendingJobs) {
                if (tracker.claim(job.getJobId())) {
                    pipeline.runAsync(job.getJobId());
                } else {
                    log.debug("Import {} claimed elsewhere", job.getJobId());
                }
            }

        } catch (RuntimeException e) {
            log.error("Error dispatching pending imports: {}", e.getMessage(), e);
        }
    }

    /**
     * Stuck jobs are only reported; resetting them is an operator decision.
     */
    @Scheduled(fixedDelayString = "${app.import.stuck-check-interval-ms:60000}")
    public void reportStuckJobs() {
        try {
            List<ImportJobEntity> stuck = tracker.findStuck();
            for (ImportJobEntity job : stuck) {
                log.warn("Import {} ({}) has made no progress since {}",
                        job.getJobId(), job.getFilename(), job.getLastProgressAt());
            }
        } catch (RuntimeException e) {
            log.error("Error checking for stuck imports: {}", e.getMessage(), e);
        }
    }
}
