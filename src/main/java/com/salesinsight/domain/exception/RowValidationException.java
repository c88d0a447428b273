package com.salesinsight.domain.exception;

/**
 * A single input row cannot be imported. Recovered inside the import loop:
 * the row is counted as failed and the message goes to the job's error log.
 */
public class RowValidationException extends RuntimeException {

    public RowValidationException(String message) {
        super(message);
    }

    public RowValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
