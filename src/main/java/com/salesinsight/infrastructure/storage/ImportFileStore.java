package com.salesinsight.infrastructure.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where uploaded files wait until their import job runs. The returned path
 * is opaque to callers; only the store interprets it.
 */
public interface ImportFileStore {

    /**
     * Saves the uploaded content.
     * @param content The file data.
     * @param filename The name the client uploaded it under.
     * @return The path to record on the import job.
     */
    String save(InputStream content, String filename) throws IOException;

    InputStream open(String storagePath) throws IOException;

    /**
     * @return false when there was nothing to delete
     */
    boolean delete(String storagePath) throws IOException;
}
