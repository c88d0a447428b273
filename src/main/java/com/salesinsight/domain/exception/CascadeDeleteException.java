package com.salesinsight.domain.exception;

import java.util.UUID;

/**
 * Deleting an import did not remove all of its facts. The deletion is rolled
 * back and the job stays in place.
 */
public class CascadeDeleteException extends RuntimeException {

    private final UUID jobId;

    public CascadeDeleteException(UUID jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public CascadeDeleteException(UUID jobId, String message) {
        this(jobId, message, null);
    }

    public UUID getJobId() {
        return jobId;
    }
}
