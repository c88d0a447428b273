package com.salesinsight.infrastructure.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalImportFileStoreTest {

    @TempDir
    Path tempDir;

    private LocalImportFileStore store;

    @BeforeEach
    void setUp() {
        store = new LocalImportFileStore(tempDir.resolve("uploads").toString());
    }

    @Test
    void testSaveOpenDelete() throws IOException {
        // When
        String path = store.save(stream("date;customer;amount\n"), "../../sales 2024.csv");

        // Then: stored inside the root, name sanitized
        assertTrue(Path.of(path).startsWith(tempDir.resolve("uploads").toAbsolutePath().normalize()));
        assertTrue(path.endsWith("_sales_2024.csv"));
        try (InputStream in = store.open(path)) {
            assertEquals("date;customer;amount\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }

        assertTrue(store.delete(path));
        assertFalse(Files.exists(Path.of(path)));
        assertFalse(store.delete(path));
    }

    @Test
    void testOpen_OutsideRootRejected() {
        assertThrows(IOException.class, () -> store.open(tempDir.resolve("other.csv").toString()));
    }

    @Test
    void testSave_SameNameTwice_DistinctPaths() throws IOException {
        String first = store.save(stream("a"), "sales.csv");
        String second = store.save(stream("b"), "sales.csv");

        assertNotEquals(first, second);
    }

    private InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
