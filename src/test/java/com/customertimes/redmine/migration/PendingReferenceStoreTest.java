package com.customertimes.redmine.migration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingReferenceStoreTest {

    @TempDir
    Path tempDir;

    private final ReferenceScanner scanner = new ReferenceScanner("acme/demo");

    @Test
    @DisplayName("Saved references load back with location, text and tokens")
    void saveAndLoad() throws Exception {
        Path file = tempDir.resolve("pending.json");
        PendingReferenceStore store = new PendingReferenceStore(file);
        store.save(Arrays.asList(
                scanner.capture("Duplicate of #482\n\"quoted\"", 16, null),
                scanner.capture("see #12 and #7", 17, 555L)));

        List<DeferredReference> loaded = new PendingReferenceStore(file).load();

        assertEquals(2, loaded.size());
        DeferredReference body = loaded.get(0);
        assertTrue(body.isIssueBody());
        assertEquals("acme/demo", body.getRepository());
        assertEquals(16, body.getIssueNumber());
        assertEquals("Duplicate of #482\n\"quoted\"", body.getOriginalText());
        assertEquals(482L, body.getTokens().get(0).getSourceId());
        DeferredReference comment = loaded.get(1);
        assertEquals(Long.valueOf(555), comment.getCommentId());
        assertEquals(2, comment.getTokens().size());
        assertEquals("#7", comment.getTokens().get(1).getToken());
    }

    @Test
    @DisplayName("Clear removes the file")
    void clear() throws Exception {
        Path file = tempDir.resolve("pending.json");
        PendingReferenceStore store = new PendingReferenceStore(file);
        store.save(Arrays.asList(scanner.capture("#1", 1, null)));
        assertTrue(Files.exists(file));

        store.clear();

        assertFalse(Files.exists(file));
        assertTrue(store.load().isEmpty());
    }

    @Test
    @DisplayName("Without a file nothing is stored")
    void noFile() throws Exception {
        PendingReferenceStore store = new PendingReferenceStore(null);
        store.save(Arrays.asList(scanner.capture("#1", 1, null)));
        assertTrue(store.load().isEmpty());
        store.clear();
    }

    @Test
    @DisplayName("Corrupt file is fatal")
    void corrupt() throws Exception {
        Path file = tempDir.resolve("pending.json");
        Files.write(file, "[{\"issue\":1}]".getBytes(StandardCharsets.UTF_8));
        assertThrows(MigrationException.class, () -> new PendingReferenceStore(file).load());
    }
}
