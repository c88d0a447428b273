package com.salesinsight.infrastructure.persistence.repository;

import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ImportJobRepository extends JpaRepository<ImportJobEntity, UUID> {

    /**
     * Jobs waiting for their first run. A job reset by an operator keeps its
     * startedAt and is therefore not picked up again.
     */
    List<ImportJobEntity> findTop10ByStatusAndStartedAtIsNullOrderByCreatedAtAsc(JobStatus status);

    List<ImportJobEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ImportJobEntity> findByStatusAndLastProgressAtBefore(JobStatus status, Instant cutoff);

    boolean existsByFilenameAndFileSizeAndStatus(String filename, long fileSize, JobStatus status);

    /**
     * The job with a row lock held until the transaction ends. A concurrent
     * claim blocks on the lock and afterwards sees the committed state.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM ImportJobEntity j WHERE j.jobId = :jobId")
    Optional<ImportJobEntity> findByIdForUpdate(@Param("jobId") UUID jobId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM ImportJobEntity j")
    List<ImportJobEntity> findAllForUpdate();

    /**
     * Conditional PENDING -> PROCESSING transition. Returns 1 for the caller
     * that won the claim, 0 for everyone else.
     */
    @Modifying
    @Query("UPDATE ImportJobEntity j SET j.status = :processing, j.startedAt = :now, j.lastProgressAt = :now " +
           "WHERE j.jobId = :jobId AND j.status = :pending AND j.startedAt IS NULL")
    int claim(
            @Param("jobId") UUID jobId,
            @Param("pending") JobStatus pending,
            @Param("processing") JobStatus processing,
            @Param("now") Instant now
    );
}
