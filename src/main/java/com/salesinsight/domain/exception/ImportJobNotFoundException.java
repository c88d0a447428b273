package com.salesinsight.domain.exception;

import java.util.UUID;

public class ImportJobNotFoundException extends RuntimeException {

    public ImportJobNotFoundException(UUID jobId) {
        super("Import job not found: " + jobId);
    }
}
