package com.salesinsight.domain.importing;

import com.salesinsight.domain.exception.CascadeDeleteException;
import com.salesinsight.domain.exception.ImportConflictException;
import com.salesinsight.domain.exception.ImportJobNotFoundException;
import com.salesinsight.domain.exception.ImportStorageException;
import com.salesinsight.domain.exception.InvalidQueryException;
import com.salesinsight.domain.model.ImportEntityType;
import com.salesinsight.domain.model.ResetSummary;
import com.salesinsight.domain.service.AnalyticsResultCache;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity.JobStatus;
import com.salesinsight.infrastructure.persistence.repository.CustomerRepository;
import com.salesinsight.infrastructure.persistence.repository.ImportJobRepository;
import com.salesinsight.infrastructure.persistence.repository.ProductRepository;
import com.salesinsight.infrastructure.persistence.repository.SalesFactRepository;
import com.salesinsight.infrastructure.persistence.repository.StoreRepository;
import com.salesinsight.infrastructure.storage.ImportFileStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the import job record.
 *
 * Lifecycle:
 * 1. submit: file stored, job created PENDING, id returned immediately
 * 2. claim: the scheduler moves PENDING -> PROCESSING with a conditional update
 * 3. begin / recordProgress: counters flushed while rows are processed
 * 4. complete / fail: terminal state, analytics cache invalidated on completion
 *
 * Recovery:
 * - A PROCESSING job without progress for app.import.stuck-timeout-minutes is stuck
 * - An operator may reset it to PENDING; it is not re-run automatically
 *
 * Deletion removes the job and every fact it wrote in one transaction.
 * Master-data entities and their aggregates are never touched. A full reset
 * removes every job and fact and zeroes the aggregates, keeping the entities.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportTracker {

    static final Set<String> ALLOWED_EXTENSIONS = Set.of(".xlsx", ".xls", ".csv");

    private final ImportJobRepository jobRepository;
    private final SalesFactRepository salesFactRepository;
    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final ImportFileStore fileStore;
    private final AnalyticsResultCache resultCache;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.import.max-file-size-bytes:104857600}")
    private long maxFileSizeBytes = 104857600L;

    @Value("${app.import.stuck-timeout-minutes:10}")
    private long stuckTimeoutMinutes = 10;

    @Value("${app.import.history-max-limit:100}")
    private int historyMaxLimit = 100;

    /**
     * Store an upload and create its PENDING job.
     *
     * Rejected before anything is stored: unsupported extension, oversized
     * file, or the same file (name and size) currently being imported.
     */
    public ImportJobEntity submit(String filename, long fileSize, ImportEntityType entityType, InputStream content) {
        if (filename == null || filename.isBlank()) {
            throw new InvalidQueryException("File name is required");
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (ALLOWED_EXTENSIONS.stream().noneMatch(lower::endsWith)) {
            throw new InvalidQueryException("Unsupported file type: " + filename + " (expected .xlsx, .xls or .csv)");
        }
        if (fileSize > maxFileSizeBytes) {
            throw new InvalidQueryException("File too large: " + fileSize + " bytes (limit " + maxFileSizeBytes + ")");
        }
        if (jobRepository.existsByFilenameAndFileSizeAndStatus(filename, fileSize, JobStatus.PROCESSING)) {
            throw new ImportConflictException("An import of " + filename + " is already running");
        }

        String storagePath;
        try {
            storagePath = fileStore.save(content, filename);
        } catch (IOException e) {
            log.error("Error storing upload {}: {}", filename, e.getMessage(), e);
            throw new ImportStorageException("Could not store upload " + filename, e);
        }

        ImportJobEntity job = ImportJobEntity.builder()
                .filename(filename)
                .fileSize(fileSize)
                .entityType(entityType)
                .storagePath(storagePath)
                .build();
        job = jobRepository.save(job);

        log.info("Import submitted: {} ({}, {} bytes, {})", job.getJobId(), filename, fileSize, entityType);
        countJob("submitted");
        return job;
    }

    /**
     * PENDING -> PROCESSING. Only one caller wins; the others get false.
     */
    @Transactional
    public boolean claim(UUID jobId) {
        return jobRepository.claim(jobId, JobStatus.PENDING, JobStatus.PROCESSING, Instant.now()) == 1;
    }

    @Transactional(readOnly = true)
    public ImportJobEntity getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ImportJobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<ImportJobEntity> history(int limit) {
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be positive: " + limit);
        }
        return jobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.min(limit, historyMaxLimit)));
    }

    @Transactional
    public void begin(UUID jobId, int totalRows) {
        ImportJobEntity job = getJob(jobId);
        job.setTotalRows(totalRows);
        job.setLastProgressAt(Instant.now());
        jobRepository.save(job);
        log.info("Import {} started: {} rows", jobId, totalRows);
    }

    @Transactional
    public void recordProgress(UUID jobId, ImportTally tally) {
        ImportJobEntity job = getJob(jobId);
        applyTally(job, tally);
        jobRepository.save(job);
        log.debug("Import {} progress: {}% ({} imported, {} failed)",
                jobId, job.getProgressPercent(), tally.getImported(), tally.getFailed());
    }

    /**
     * Terminal success. The job row is committed before the analytics cache
     * is cleared, so no reader can cache pre-import results afterwards.
     */
    public ImportJobEntity complete(UUID jobId, ImportTally tally) {
        ImportJobEntity job = transactionTemplate.execute(status -> {
            ImportJobEntity current = getJob(jobId);
            applyTally(current, tally);
            current.getRelatedEntityIds().addAll(tally.getCreatedEntityIds());
            current.markCompleted();
            return jobRepository.save(current);
        });

        log.info("Import {} completed: {} imported, {} failed of {} ({} ms)",
                jobId, tally.getImported(), tally.getFailed(), tally.getTotalRows(), job.getExecutionTimeMs());
        countJob("completed");

        resultCache.invalidateAll("import " + jobId + " completed");
        return job;
    }

    /**
     * Terminal failure. Partial counters are kept; facts already written stay
     * until the job is deleted.
     */
    @Transactional
    public void fail(UUID jobId, ImportTally tally, String error) {
        ImportJobEntity job = getJob(jobId);
        if (tally != null) {
            applyTally(job, tally);
            job.getRelatedEntityIds().addAll(tally.getCreatedEntityIds());
        }
        job.markFailed(error);
        jobRepository.save(job);

        log.error("Import {} failed: {}", jobId, error);
        countJob("failed");
    }

    @Transactional(readOnly = true)
    public List<ImportJobEntity> findStuck() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(stuckTimeoutMinutes));
        return jobRepository.findByStatusAndLastProgressAtBefore(JobStatus.PROCESSING, cutoff);
    }

    /**
     * Operator reset of one stuck job.
     */
    @Transactional
    public ImportJobEntity resetStuck(UUID jobId) {
        ImportJobEntity job = getJob(jobId);
        if (!isStuck(job)) {
            throw new ImportConflictException("Import " + jobId + " is not stuck (status " + job.getStatus() + ")");
        }
        job.resetToPending("Reset by operator after no progress since " + job.getLastProgressAt());
        log.warn("Import {} reset to PENDING", jobId);
        return jobRepository.save(job);
    }

    @Transactional
    public List<UUID> resetAllStuck() {
        List<UUID> reset = new ArrayList<>();
        for (ImportJobEntity job : findStuck()) {
            job.resetToPending("Reset by operator after no progress since " + job.getLastProgressAt());
            jobRepository.save(job);
            reset.add(job.getJobId());
        }
        if (!reset.isEmpty()) {
            log.warn("Reset {} stuck imports to PENDING: {}", reset.size(), reset);
        }
        return reset;
    }

    /**
     * Delete an import and every fact it wrote.
     *
     * The job row is locked before its status is checked, so a scheduler
     * claiming the job at the same time either wins first (and the delete is
     * refused) or waits and finds nothing to claim. Facts are bulk deleted,
     * then counted; if any remain the transaction is rolled back and the job
     * stays. On success the analytics cache is cleared and the stored upload
     * removed (best effort).
     *
     * @return number of facts removed
     */
    public int delete(UUID jobId) {
        Removal removal;
        try {
            removal = transactionTemplate.execute(status -> {
                ImportJobEntity job = jobRepository.findByIdForUpdate(jobId)
                        .orElseThrow(() -> new ImportJobNotFoundException(jobId));
                if (job.isActive()) {
                    throw new ImportConflictException("Import " + jobId + " is still processing");
                }

                int deleted = salesFactRepository.deleteAllByImportJobId(jobId);
                long remaining = salesFactRepository.countByImportJobId(jobId);
                if (remaining != 0) {
                    throw new CascadeDeleteException(jobId,
                            "Import " + jobId + " still owns " + remaining + " facts after deleting " + deleted);
                }
                jobRepository.delete(job);
                return new Removal(List.of(job), deleted);
            });
        } catch (DataAccessException e) {
            log.error("Error deleting import {}: {}", jobId, e.getMessage(), e);
            throw new CascadeDeleteException(jobId, "Deleting import " + jobId + " failed", e);
        }

        log.info("Import {} deleted with {} facts", jobId, removal.getFacts());
        countJob("deleted");
        resultCache.invalidateAll("import " + jobId + " deleted");
        removal.getJobs().forEach(this::removeStoredFile);
        return removal.getFacts();
    }

    /**
     * Remove every import and every sales fact.
     *
     * Customers, products and stores stay (they are master data) with their
     * running aggregates zeroed; plan targets stay. All job rows are locked
     * first and the reset is refused while any of them is processing.
     * Cache invalidation and file cleanup run after the commit.
     */
    public ResetSummary resetAll() {
        Removal removal;
        try {
            removal = transactionTemplate.execute(status -> {
                List<ImportJobEntity> jobs = jobRepository.findAllForUpdate();
                for (ImportJobEntity job : jobs) {
                    if (job.isActive()) {
                        throw new ImportConflictException("Import " + job.getJobId() + " is still processing");
                    }
                }

                int deleted = salesFactRepository.deleteAllFacts();
                customerRepository.resetAggregates();
                productRepository.resetAggregates();
                storeRepository.resetAggregates();
                jobRepository.deleteAll(jobs);
                return new Removal(jobs, deleted);
            });
        } catch (DataAccessException e) {
            log.error("Error resetting import data: {}", e.getMessage(), e);
            throw new ImportStorageException("Resetting import data failed", e);
        }

        resultCache.invalidateAll("all imports reset");
        int removedFiles = 0;
        for (ImportJobEntity job : removal.getJobs()) {
            if (removeStoredFile(job)) {
                removedFiles++;
            }
        }

        log.warn("Reset all import data: {} imports, {} facts, {} stored files",
                removal.getJobs().size(), removal.getFacts(), removedFiles);
        countJob("reset");
        return ResetSummary.builder()
                .deletedFacts(removal.getFacts())
                .deletedImports(removal.getJobs().size())
                .removedFiles(removedFiles)
                .build();
    }

    boolean isStuck(ImportJobEntity job) {
        if (job.getStatus() != JobStatus.PROCESSING) {
            return false;
        }
        Instant lastProgress = job.getLastProgressAt() != null ? job.getLastProgressAt() : job.getStartedAt();
        return lastProgress == null
                || lastProgress.isBefore(Instant.now().minus(Duration.ofMinutes(stuckTimeoutMinutes)));
    }

    private static void applyTally(ImportJobEntity job, ImportTally tally) {
        job.recordProgress(tally.getImported(), tally.getFailed(), tally.percent());
        job.getErrorLog().clear();
        job.getErrorLog().addAll(tally.getErrors());
    }

    private boolean removeStoredFile(ImportJobEntity job) {
        if (job.getStoragePath() == null) {
            return false;
        }
        try {
            return fileStore.delete(job.getStoragePath());
        } catch (IOException e) {
            log.warn("Could not remove stored upload {} of import {}: {}",
                    job.getStoragePath(), job.getJobId(), e.getMessage());
            return false;
        }
    }

    private void countJob(String event) {
        Counter.builder("import.jobs")
                .tag("event", event)
                .register(meterRegistry)
                .increment();
    }

    @Getter
    @AllArgsConstructor
    private static class Removal {
        private final List<ImportJobEntity> jobs;
        private final int facts;
    }
}
