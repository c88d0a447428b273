package com.salesinsight.domain.importing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of processing one row. REJECTED rows are skipped and the import
 * goes on; a STORAGE_FAILURE stops the whole job.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RowOutcome {

    public enum Type {
        IMPORTED,
        REJECTED,
        STORAGE_FAILURE
    }

    int rowNumber;
    Type type;
    String message;

    public static RowOutcome imported(int rowNumber) {
        return new RowOutcome(rowNumber, Type.IMPORTED, null);
    }

    public static RowOutcome rejected(int rowNumber, String reason) {
        return new RowOutcome(rowNumber, Type.REJECTED, "Row " + rowNumber + ": " + reason);
    }

    public static RowOutcome storageFailure(int rowNumber, String reason) {
        return new RowOutcome(rowNumber, Type.STORAGE_FAILURE, "Row " + rowNumber + ": " + reason);
    }
}
