package com.salesinsight.domain.exception;

/**
 * The requested import operation clashes with the job's current state, e.g.
 * deleting a job that is still processing or re-uploading a file whose
 * import is running.
 */
public class ImportConflictException extends RuntimeException {

    public ImportConflictException(String message) {
        super(message);
    }
}
