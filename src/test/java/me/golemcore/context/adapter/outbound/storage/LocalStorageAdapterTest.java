package me.golemcore.context.adapter.outbound.storage;

import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "test-dir";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateRecordDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("entities")));
        assertTrue(Files.isDirectory(tempDir.resolve("conversations")));
        assertTrue(Files.isDirectory(tempDir.resolve("audit")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "nested/test-file.jsonl", "Hello, World!").get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "nested/test-file.jsonl").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.jsonl").get());
    }

    @Test
    void putText_overwritesExistingContent() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "file.txt", "first").get();
        storageAdapter.putText(TEST_DIR, "file.txt", "second").get();

        assertEquals("second", storageAdapter.getText(TEST_DIR, "file.txt").get());
    }

    @Test
    void appendText_appendsToFile() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText(TEST_DIR, "log.jsonl", "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText(TEST_DIR, "log.jsonl").get());
    }

    @Test
    void exists_reflectsFilePresence() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "existing.txt", CONTENT_DEFAULT).get();

        assertTrue(storageAdapter.exists(TEST_DIR, "existing.txt").get());
        assertFalse(storageAdapter.exists(TEST_DIR, "non-existing.txt").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../outside.txt").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertTrue(error.getCause().getMessage().startsWith("Path traversal blocked"));
    }
}
