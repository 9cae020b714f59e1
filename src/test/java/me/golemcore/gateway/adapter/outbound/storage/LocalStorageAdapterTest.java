package me.golemcore.gateway.adapter.outbound.storage;

import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SESSIONS = "sessions";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesSessionsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve(SESSIONS)));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(SESSIONS, "sess_1.json", "{\"id\":\"sess_1\"}").get();

        assertEquals("{\"id\":\"sess_1\"}", storageAdapter.getText(SESSIONS, "sess_1.json").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SESSIONS, "missing.json").get());
    }

    @Test
    void appendText_keepsEarlierLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(SESSIONS, "sess_1.messages.jsonl", "{\"n\":1}\n").get();
        storageAdapter.appendText(SESSIONS, "sess_1.messages.jsonl", "{\"n\":2}\n").get();

        assertEquals("{\"n\":1}\n{\"n\":2}\n", storageAdapter.getText(SESSIONS, "sess_1.messages.jsonl").get());
    }

    @Test
    void putTextAtomic_replacesContentAndKeepsBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "sess_1.json", "v1", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "sess_1.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(SESSIONS, "sess_1.json").get());
        assertEquals("v1", storageAdapter.getText(SESSIONS, "sess_1.json.bak").get());
        assertFalse(storageAdapter.exists(SESSIONS, "sess_1.json.tmp").get());
    }

    @Test
    void listObjects_returnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putText(SESSIONS, "b.json", "b").get();
        storageAdapter.putText(SESSIONS, "a.json", "a").get();

        assertEquals(List.of("a.json", "b.json"), storageAdapter.listObjects(SESSIONS, "").get());
        assertEquals(List.of(), storageAdapter.listObjects("nowhere", "").get());
    }

    @Test
    void exists_reflectsWrites() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(SESSIONS, "x.json").get());
        storageAdapter.putText(SESSIONS, "x.json", "x").get();
        assertTrue(storageAdapter.exists(SESSIONS, "x.json").get());
    }

    @Test
    void ensureDirectory_createsNestedDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("exports/2026").get();

        assertTrue(Files.isDirectory(tempDir.resolve("exports/2026")));
    }

    @Test
    void pathTraversalIsBlocked() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(SESSIONS, "../../etc/passwd").join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
