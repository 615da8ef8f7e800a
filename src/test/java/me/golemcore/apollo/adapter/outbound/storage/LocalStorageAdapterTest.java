package me.golemcore.apollo.adapter.outbound.storage;

import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        ApolloProperties properties = new ApolloProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateKnownDirectoriesOnInit() {
        for (String directory : LocalStorageAdapter.KNOWN_DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(directory)));
        }
    }

    @Test
    void shouldWriteAndReadText() {
        adapter.putTextAtomic("conversations", "c1.json", "{\"id\":\"c1\"}", false).join();

        assertEquals("{\"id\":\"c1\"}", adapter.getText("conversations", "c1.json").join());
        assertTrue(adapter.exists("conversations", "c1.json").join());
        assertFalse(Files.exists(tempDir.resolve("conversations/c1.json.tmp")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText("conversations", "missing.json").join());
        assertFalse(adapter.exists("conversations", "missing.json").join());
    }

    @Test
    void shouldKeepBackupWhenRequested() throws Exception {
        adapter.putTextAtomic("entities", "e1.json", "v1", false).join();
        adapter.putTextAtomic("entities", "e1.json", "v2", true).join();

        assertEquals("v2", adapter.getText("entities", "e1.json").join());
        assertEquals("v1", Files.readString(tempDir.resolve("entities/e1.json.bak"), StandardCharsets.UTF_8));
    }

    @Test
    void shouldListFilesRelativeToDirectory() {
        adapter.putTextAtomic("entities", "a.json", "a", false).join();
        adapter.putTextAtomic("entities", "b.json", "b", false).join();

        List<String> files = adapter.listObjects("entities", "").join();

        assertEquals(2, files.size());
        assertTrue(files.containsAll(List.of("a.json", "b.json")));
    }

    @Test
    void shouldDeleteFile() {
        adapter.putTextAtomic("entities", "a.json", "a", false).join();

        adapter.deleteObject("entities", "a.json").join();

        assertFalse(adapter.exists("entities", "a.json").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.getText("conversations", "../../etc/passwd").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
