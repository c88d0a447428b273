package com.salesinsight.api;

import com.salesinsight.domain.exception.CascadeDeleteException;
import com.salesinsight.domain.exception.ImportConflictException;
import com.salesinsight.domain.exception.ImportJobNotFoundException;
import com.salesinsight.domain.importing.ImportTracker;
import com.salesinsight.domain.model.ImportEntityType;
import com.salesinsight.domain.model.ResetSummary;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Request mapping and error translation of the import endpoints.
 */
@ExtendWith(MockitoExtension.class)
class ImportControllerTest {

    @Mock
    private ImportTracker importTracker;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImportController(importTracker))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testUpload_Accepted() throws Exception {
        // Given
        UUID jobId = UUID.randomUUID();
        MockMultipartFile file = new MockMultipartFile("file", "sales.csv", "text/csv",
                "date;customer;amount\n15.01.2024;Ivanov;100\n".getBytes());
        when(importTracker.submit(eq("sales.csv"), eq(file.getSize()), eq(ImportEntityType.SALES), any()))
                .thenReturn(ImportJobEntity.builder().jobId(jobId).filename("sales.csv").build());

        // When/Then
        mockMvc.perform(multipart("/api/v1/imports").file(file))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.importId").value(jobId.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void testUpload_UnknownEntityType() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "sales.csv", "text/csv", new byte[]{1});

        mockMvc.perform(multipart("/api/v1/imports").file(file).param("entityType", "invoices"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported entity type: invoices"));
        verifyNoInteractions(importTracker);
    }

    @Test
    void testGetImport_NotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(importTracker.getJob(jobId)).thenThrow(new ImportJobNotFoundException(jobId));

        mockMvc.perform(get("/api/v1/imports/{id}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void testGetImport_Progress() throws Exception {
        // Given
        UUID jobId = UUID.randomUUID();
        ImportJobEntity job = ImportJobEntity.builder()
                .jobId(jobId)
                .filename("sales.csv")
                .status(ImportJobEntity.JobStatus.PROCESSING)
                .totalRows(200)
                .importedRows(50)
                .progressPercent(25)
                .createdAt(Instant.now())
                .build();
        when(importTracker.getJob(jobId)).thenReturn(job);

        // When/Then
        mockMvc.perform(get("/api/v1/imports/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.progressPercent").value(25))
                .andExpect(jsonPath("$.totalRows").value(200));
    }

    @Test
    void testDelete_Success() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(importTracker.delete(jobId)).thenReturn(42);

        mockMvc.perform(delete("/api/v1/imports/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedFacts").value(42));
    }

    @Test
    void testDelete_StillProcessing_Conflict() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(importTracker.delete(jobId)).thenThrow(new ImportConflictException("Import " + jobId + " is still processing"));

        mockMvc.perform(delete("/api/v1/imports/{id}", jobId))
                .andExpect(status().isConflict());
    }

    @Test
    void testDelete_CascadeFailure() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(importTracker.delete(jobId)).thenThrow(new CascadeDeleteException(jobId, "facts remain"));

        mockMvc.perform(delete("/api/v1/imports/{id}", jobId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("facts remain"));
    }

    @Test
    void testResetAllStuck() throws Exception {
        UUID first = UUID.randomUUID();
        when(importTracker.resetAllStuck()).thenReturn(List.of(first));

        mockMvc.perform(post("/api/v1/imports/reset-stuck"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(1))
                .andExpect(jsonPath("$.importIds[0]").value(first.toString()));
    }

    @Test
    void testResetAll() throws Exception {
        // Given
        when(importTracker.resetAll()).thenReturn(ResetSummary.builder()
                .deletedFacts(1200).deletedImports(3).removedFiles(2).build());

        // When/Then
        mockMvc.perform(delete("/api/v1/imports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedFacts").value(1200))
                .andExpect(jsonPath("$.deletedImports").value(3))
                .andExpect(jsonPath("$.removedFiles").value(2));
    }

    @Test
    void testResetAll_ImportRunning_Conflict() throws Exception {
        when(importTracker.resetAll()).thenThrow(new ImportConflictException("Import x is still processing"));

        mockMvc.perform(delete("/api/v1/imports"))
                .andExpect(status().isConflict());
    }
}
