package com.salesinsight.infrastructure.persistence.entity;

import com.salesinsight.domain.model.ImportEntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle record of one uploaded file.
 *
 * The import tracker is the only writer. Clients poll this row for progress:
 * PENDING -> PROCESSING -> COMPLETED | FAILED.
 *
 * Facts created by the job point back at it (sales_facts.import_job_id),
 * which is what cascade deletion keys on.
 */
@Entity
@Table(name = "import_jobs", indexes = {
    @Index(name = "idx_import_jobs_status", columnList = "status"),
    @Index(name = "idx_import_jobs_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ImportEntityType entityType = ImportEntityType.SALES;

    @Column(length = 1000)
    private String storagePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int totalRows;

    @Column(nullable = false)
    private int importedRows;

    @Column(nullable = false)
    private int failedRows;

    @Column(nullable = false)
    private int progressPercent;

    @Column(length = 1000)
    private String errorMessage;

    /**
     * Per-row failure messages in row order. Capped by app.import.max-logged-errors,
     * failedRows is not.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "import_job_errors", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "message", length = 1000)
    @Builder.Default
    private List<String> errorLog = new ArrayList<>();

    /**
     * Master-data entities first created by this job.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "import_job_entities", joinColumns = @JoinColumn(name = "job_id"))
    @Column(name = "entity_id", columnDefinition = "UUID")
    @Builder.Default
    private Set<UUID> relatedEntityIds = new LinkedHashSet<>();

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant lastProgressAt;

    @Column
    private Instant completedAt;

    public enum JobStatus {
        PENDING,
        PROCESSING,
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

    public void recordProgress(int imported, int failed, int percent) {
        this.importedRows = imported;
        this.failedRows = failed;
        // never move backwards, polling clients rely on it
        this.progressPercent = Math.max(this.progressPercent, percent);
        this.lastProgressAt = Instant.now();
    }

    public void markCompleted() {
        this.status = JobStatus.COMPLETED;
        this.progressPercent = 100;
        this.completedAt = Instant.now();
        this.lastProgressAt = this.completedAt;
    }

    public void markFailed(String error) {
        this.status = JobStatus.FAILED;
        this.errorMessage = truncate(error);
        this.completedAt = Instant.now();
    }

    /**
     * Operator escape hatch for a job stuck in PROCESSING. Counters and written
     * facts are left as they are.
     */
    public void resetToPending(String reason) {
        this.status = JobStatus.PENDING;
        this.errorMessage = truncate(reason);
        this.lastProgressAt = Instant.now();
    }

    public boolean isActive() {
        return status == JobStatus.PROCESSING;
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 997) + "...";
    }
}
