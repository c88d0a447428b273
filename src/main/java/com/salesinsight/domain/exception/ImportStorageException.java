package com.salesinsight.domain.exception;

/**
 * Persistence or file I/O failure during an import. Fatal to the job.
 */
public class ImportStorageException extends RuntimeException {

    public ImportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
