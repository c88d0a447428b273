package com.salesinsight.infrastructure.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Stores uploads on the local filesystem under app.import.storage-path.
 * Each upload gets a random prefix so two uploads of the same name never
 * overwrite each other.
 */
@Slf4j
@Service
public class LocalImportFileStore implements ImportFileStore {

    private final Path root;

    public LocalImportFileStore(@Value("${app.import.storage-path:./uploads/}") String storagePath) {
        this.root = Paths.get(storagePath).toAbsolutePath().normalize();
    }

    @Override
    public String save(InputStream content, String filename) throws IOException {
        if (!Files.exists(root)) {
            Files.createDirectories(root);
        }
        Path path = root.resolve(UUID.randomUUID() + "_" + sanitize(filename));
        Files.copy(content, path, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Stored upload {} at {}", filename, path);
        return path.toString();
    }

    @Override
    public InputStream open(String storagePath) throws IOException {
        return Files.newInputStream(resolve(storagePath));
    }

    @Override
    public boolean delete(String storagePath) throws IOException {
        return Files.deleteIfExists(resolve(storagePath));
    }

    private Path resolve(String storagePath) throws IOException {
        Path path = Paths.get(storagePath).toAbsolutePath().normalize();
        if (!path.startsWith(root)) {
            throw new IOException("Path outside upload storage: " + storagePath);
        }
        return path;
    }

    private static String sanitize(String filename) {
        String name = filename == null ? "upload" : Paths.get(filename).getFileName().toString();
        return name.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    }
}
