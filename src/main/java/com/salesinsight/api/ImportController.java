package com.salesinsight.api;

import com.salesinsight.domain.exception.ImportStorageException;
import com.salesinsight.domain.importing.ImportTracker;
import com.salesinsight.domain.model.ImportEntityType;
import com.salesinsight.domain.model.ResetSummary;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for file imports.
 *
 * Endpoints:
 * - POST /api/v1/imports - Upload a file, returns the import id immediately
 * - GET /api/v1/imports/{importId} - Job status and progress
 * - GET /api/v1/imports - Recent imports
 * - GET /api/v1/imports/stuck - Jobs without progress past the timeout
 * - POST /api/v1/imports/{importId}/reset - Reset one stuck job
 * - POST /api/v1/imports/reset-stuck - Reset every stuck job
 * - DELETE /api/v1/imports/{importId} - Delete the import and all its facts
 * - DELETE /api/v1/imports - Remove every import and every sales fact
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/imports")
@RequiredArgsConstructor
public class ImportController {

    private final ImportTracker importTracker;

    /**
     * Upload a file for import.
     *
     * POST /api/v1/imports (multipart: file, entityType=SALES|CUSTOMERS|PRODUCTS)
     *
     * Response (202):
     * {
     *   "importId": "uuid",
     *   "status": "PENDING"
     * }
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String entityType) {

        ImportEntityType type = ImportEntityType.parse(entityType);
        log.info("Upload: filename={}, size={}, entityType={}", file.getOriginalFilename(), file.getSize(), type);

        ImportJobEntity job;
        try (InputStream content = file.getInputStream()) {
            job = importTracker.submit(file.getOriginalFilename(), file.getSize(), type, content);
        } catch (IOException e) {
            throw new ImportStorageException("Could not read upload " + file.getOriginalFilename(), e);
        }

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("importId", job.getJobId(), "status", job.getStatus()));
    }

    @GetMapping("/{importId}")
    public ResponseEntity<ImportJobEntity> getImport(@PathVariable UUID importId) {
        return ResponseEntity.ok(importTracker.getJob(importId));
    }

    @GetMapping
    public ResponseEntity<List<ImportJobEntity>> history(
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(importTracker.history(limit));
    }

    @GetMapping("/stuck")
    public ResponseEntity<List<ImportJobEntity>> stuck() {
        return ResponseEntity.ok(importTracker.findStuck());
    }

    @PostMapping("/{importId}/reset")
    public ResponseEntity<ImportJobEntity> reset(@PathVariable UUID importId) {
        log.info("Reset stuck import: importId={}", importId);
        return ResponseEntity.ok(importTracker.resetStuck(importId));
    }

    @PostMapping("/reset-stuck")
    public ResponseEntity<Map<String, Object>> resetAllStuck() {
        List<UUID> reset = importTracker.resetAllStuck();
        return ResponseEntity.ok(Map.of("reset", reset.size(), "importIds", reset));
    }

    /**
     * Delete an import.
     *
     * DELETE /api/v1/imports/{importId}
     *
     * Removes the job and every sales fact it created, or nothing at all.
     * Customers, products and stores are kept.
     */
    @DeleteMapping("/{importId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable UUID importId) {
        log.info("Delete import: importId={}", importId);
        int removed = importTracker.delete(importId);
        return ResponseEntity.ok(Map.of("importId", importId, "deletedFacts", removed));
    }

    /**
     * Reset all imported data.
     *
     * DELETE /api/v1/imports
     *
     * Response:
     * {
     *   "deletedFacts": 1200,
     *   "deletedImports": 3,
     *   "removedFiles": 3
     * }
     */
    @DeleteMapping
    public ResponseEntity<ResetSummary> resetAll() {
        log.warn("Reset of all import data requested");
        return ResponseEntity.ok(importTracker.resetAll());
    }
}
