package villagecompute.screening.integration.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import villagecompute.screening.api.types.SourceDescriptorType;
import villagecompute.screening.exceptions.SourceNotFoundException;

/**
 * Unit tests for {@link FileSystemSourceStore}.
 */
class FileSystemSourceStoreTest {

    @TempDir
    Path workDir;

    private Path uploads;
    private FileSystemSourceStore store;

    @BeforeEach
    void setUp() throws Exception {
        uploads = Files.createDirectory(workDir.resolve("uploads"));
        store = new FileSystemSourceStore(uploads);
    }

    @Test
    void testDescribe_existingFile() throws Exception {
        Files.writeString(uploads.resolve("list.csv"), "a,b\n", StandardCharsets.UTF_8);

        Optional<SourceDescriptorType> source = store.describe("list.csv");

        assertTrue(source.isPresent());
        assertEquals(4, source.get().sizeBytes());
    }

    @Test
    void testDescribe_missingOrBlankReference() {
        assertTrue(store.describe("missing.csv").isEmpty());
        assertTrue(store.describe("").isEmpty());
        assertTrue(store.describe(null).isEmpty());
    }

    @Test
    void testDescribe_directoryIsNotASource() throws Exception {
        Files.createDirectory(uploads.resolve("nested"));

        assertTrue(store.describe("nested").isEmpty());
    }

    @Test
    void testReferencesOutsideRootAreRejected() throws Exception {
        Path secret = Files.writeString(workDir.resolve("secret.csv"), "x\n", StandardCharsets.UTF_8);

        assertTrue(store.describe("../secret.csv").isEmpty());
        assertThrows(SourceNotFoundException.class, () -> store.openStream("../secret.csv"));
        assertFalse(store.delete("../secret.csv"));
        assertTrue(Files.exists(secret));
    }

    @Test
    void testOpenStream_missingFile() {
        assertThrows(SourceNotFoundException.class, () -> store.openStream("missing.csv"));
    }

    @Test
    void testDelete() throws Exception {
        Files.writeString(uploads.resolve("list.csv"), "a\n", StandardCharsets.UTF_8);

        assertTrue(store.delete("list.csv"));
        assertFalse(store.delete("list.csv"));
    }
}
