package com.salesinsight.domain.importing;

import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity.JobStatus;
import com.salesinsight.infrastructure.persistence.repository.ImportJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportJobSchedulerTest {

    @Mock
    private ImportJobRepository jobRepository;

    @Mock
    private ImportTracker tracker;

    @Mock
    private ImportPipeline pipeline;

    private ImportJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ImportJobScheduler(jobRepository, tracker, pipeline);
    }

    @Test
    void testDispatch_RunsOnlyClaimedJobs() {
        // Given: the second job was claimed by another instance
        ImportJobEntity won = pending();
        ImportJobEntity lost = pending();
        when(jobRepository.findTop10ByStatusAndStartedAtIsNullOrderByCreatedAtAsc(JobStatus.PENDING))
                .thenReturn(List.of(won, lost));
        when(tracker.claim(won.getJobId())).thenReturn(true);
        when(tracker.claim(lost.getJobId())).thenReturn(false);

        // When
        scheduler.dispatchPendingJobs();

        // Then
        verify(pipeline).runAsync(won.getJobId());
        verify(pipeline, never()).runAsync(lost.getJobId());
    }

    @Test
    void testDispatch_DatabaseDown_DoesNotThrow() {
        // Given
        when(jobRepository.findTop10ByStatusAndStartedAtIsNullOrderByCreatedAtAsc(JobStatus.PENDING))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When/Then
        assertDoesNotThrow(() -> scheduler.dispatchPendingJobs());
        verifyNoInteractions(pipeline);
    }

    @Test
    void testReportStuckJobs_OnlyReads() {
        // Given
        when(tracker.findStuck()).thenReturn(List.of(pending()));

        // When
        scheduler.reportStuckJobs();

        // Then
        verify(tracker, never()).resetStuck(any());
        verify(tracker, never()).resetAllStuck();
    }

    private ImportJobEntity pending() {
        return ImportJobEntity.builder()
                .jobId(UUID.randomUUID())
                .filename("sales.csv")
                .status(JobStatus.PENDING)
                .build();
    }
}
