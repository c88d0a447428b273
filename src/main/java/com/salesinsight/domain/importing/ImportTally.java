package com.salesinsight.domain.importing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Running counters of one import, folded from {@link RowOutcome}s.
 *
 * imported + failed never exceeds total. The error log keeps the first
 * maxLoggedErrors messages; failed keeps counting past that.
 */
public class ImportTally {

    private final int totalRows;
    private final int maxLoggedErrors;

    private int imported;
    private int failed;
    private final List<String> errors = new ArrayList<>();
    private final Set<UUID> createdEntityIds = new LinkedHashSet<>();
    private String fatalError;

    public ImportTally(int totalRows, int maxLoggedErrors) {
        this.totalRows = totalRows;
        this.maxLoggedErrors = maxLoggedErrors;
    }

    public void record(RowOutcome outcome) {
        switch (outcome.getType()) {
            case IMPORTED:
                imported++;
                break;
            case REJECTED:
                failed++;
                logError(outcome.getMessage());
                break;
            case STORAGE_FAILURE:
                // the row is not counted, it was neither imported nor rejected
                fatalError = outcome.getMessage();
                break;
            default:
                throw new IllegalStateException("Unknown outcome: " + outcome.getType());
        }
    }

    public void addCreatedEntities(Set<UUID> ids) {
        createdEntityIds.addAll(ids);
    }

    public boolean isAborted() {
        return fatalError != null;
    }

    public int processed() {
        return imported + failed;
    }

    /**
     * Integer percent of rows imported, rounded down.
     */
    public int percent() {
        if (totalRows == 0) {
            return 0;
        }
        return (int) ((long) imported * 100 / totalRows);
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getImported() {
        return imported;
    }

    public int getFailed() {
        return failed;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Set<UUID> getCreatedEntityIds() {
        return Collections.unmodifiableSet(createdEntityIds);
    }

    public String getFatalError() {
        return fatalError;
    }

    private void logError(String message) {
        if (errors.size() < maxLoggedErrors) {
            errors.add(message);
        }
    }
}
