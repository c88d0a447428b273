package com.salesinsight.domain.importing;

import com.salesinsight.domain.exception.ImportStorageException;
import com.salesinsight.domain.exception.RowValidationException;
import com.salesinsight.domain.model.ImportEntityType;
import com.salesinsight.infrastructure.parsing.RawRow;
import com.salesinsight.infrastructure.parsing.SpreadsheetReader;
import com.salesinsight.infrastructure.persistence.entity.ImportJobEntity;
import com.salesinsight.infrastructure.storage.ImportFileStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs one claimed import job: file -> raw rows -> validated candidates ->
 * resolved entities -> facts.
 *
 * Processing Flow:
 * 1. Read the stored file into raw rows (blank rows dropped)
 * 2. For each row: validate, then resolve entities, bump aggregates and
 *    write the fact in one transaction
 * 3. Fold each row's outcome into the tally, flush it every N rows
 * 4. Complete, or fail with partial counters on a storage error
 *
 * Failure Handling:
 * - A validation error skips the row (counted, logged) and the loop goes on
 * - A database or file error aborts the job; rows already committed stay
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportPipeline {

    private final ImportTracker tracker;
    private final ImportFileStore fileStore;
    private final SpreadsheetReader spreadsheetReader;
    private final RowValidator rowValidator;
    private final EntityResolver entityResolver;
    private final FactWriter factWriter;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.import.progress-flush-interval:100}")
    private int progressFlushInterval = 100;

    @Value("${app.import.max-logged-errors:1000}")
    private int maxLoggedErrors = 1000;

    /**
     * Process a claimed job on the async executor.
     */
    @Async
    public void runAsync(UUID jobId) {
        run(jobId);
    }

    /**
     * Process a claimed job on the calling thread.
     *
     * @return the final tally, or null when the file could not be read
     */
    public ImportTally run(UUID jobId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ImportTally tally = null;

        try {
            ImportJobEntity job = tracker.getJob(jobId);
            log.info("Processing import: {} ({}, {})", jobId, job.getFilename(), job.getEntityType());

            List<RawRow> rows;
            try (InputStream in = fileStore.open(job.getStoragePath())) {
                rows = spreadsheetReader.read(in, job.getFilename());
            } catch (IOException e) {
                log.error("Error reading upload of import {}: {}", jobId, e.getMessage(), e);
                tracker.fail(jobId, null, "Could not read file: " + e.getMessage());
                return null;
            }

            tally = new ImportTally(rows.size(), maxLoggedErrors);
            tracker.begin(jobId, rows.size());

            ResolverSession session = entityResolver.openSession();
            for (RawRow row : rows) {
                RowOutcome outcome = processRow(job.getEntityType(), row, jobId, session);
                tally.record(outcome);
                countRow(outcome);

                if (tally.isAborted()) {
                    break;
                }
                if (tally.processed() % progressFlushInterval == 0) {
                    tracker.recordProgress(jobId, tally);
                }
            }
            tally.addCreatedEntities(session.getCreatedEntityIds());

            if (tally.isAborted()) {
                tracker.fail(jobId, tally, tally.getFatalError());
            } else {
                tracker.complete(jobId, tally);
            }
            return tally;

        } catch (RuntimeException e) {
            // tracker writes failing means the database is gone; record what we can
            log.error("Error processing import {}: {}", jobId, e.getMessage(), e);
            failQuietly(jobId, tally, e);
            return tally;

        } finally {
            sample.stop(Timer.builder("import.duration")
                    .register(meterRegistry));
        }
    }

    /**
     * One row, one transaction. Validation runs before the transaction opens.
     */
    RowOutcome processRow(ImportEntityType entityType, RawRow row, UUID jobId, ResolverSession session) {
        int rowNumber = row.getRowNumber();
        try {
            switch (entityType) {
                case SALES: {
                    SalesRowCandidate candidate = rowValidator.validateSale(row);
                    transactionTemplate.executeWithoutResult(status -> {
                        ResolvedEntities entities = entityResolver.resolve(candidate, session);
                        entityResolver.applyContribution(entities, candidate.getAmount(), candidate.getSaleDate());
                        factWriter.write(candidate, entities, jobId);
                    });
                    break;
                }
                case CUSTOMERS: {
                    MasterDataCandidate candidate = rowValidator.validateCustomer(row);
                    transactionTemplate.executeWithoutResult(status -> entityResolver.upsertCustomer(candidate, session));
                    break;
                }
                case PRODUCTS: {
                    MasterDataCandidate candidate = rowValidator.validateProduct(row);
                    transactionTemplate.executeWithoutResult(status -> entityResolver.upsertProduct(candidate, session));
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown entity type: " + entityType);
            }
            return RowOutcome.imported(rowNumber);

        } catch (RowValidationException e) {
            log.debug("Import {} row {} rejected: {}", jobId, rowNumber, e.getMessage());
            return RowOutcome.rejected(rowNumber, e.getMessage());

        } catch (DataAccessException | TransactionException | ImportStorageException e) {
            log.error("Storage error in import {} at row {}: {}", jobId, rowNumber, e.getMessage(), e);
            return RowOutcome.storageFailure(rowNumber, e.getMessage());
        }
    }

    private void failQuietly(UUID jobId, ImportTally tally, RuntimeException cause) {
        try {
            tracker.fail(jobId, tally, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.error("Could not mark import {} as failed, it will show up as stuck: {}", jobId, e.getMessage());
        }
    }

    private void countRow(RowOutcome outcome) {
        Counter.builder("import.rows")
                .tag("outcome", outcome.getType().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }
}
