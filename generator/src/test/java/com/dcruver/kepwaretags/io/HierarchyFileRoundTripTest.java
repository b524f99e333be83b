package com.dcruver.kepwaretags.io;

import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.NodeId;
import com.dcruver.kepwaretags.domain.TagDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Saving and loading hierarchy files on disk.
 */
class HierarchyFileRoundTripTest {

    private HierarchyJsonCodec codec;
    private HierarchyFileStore fileStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        codec = new HierarchyJsonCodec();
        fileStore = new HierarchyFileStore(codec, true);
    }

    @Test
    void testSaveThenLoadPreservesHierarchy() throws Exception {
        Hierarchy hierarchy = new Hierarchy();
        NodeId line1 = hierarchy.addFolder(hierarchy.getRootId(), "Linie Ä");
        hierarchy.addTag(line1, "Drehzahl", TagDataType.INTEGER);
        hierarchy.addTag(line1, "Läuft", TagDataType.BOOLEAN);

        Path file = tempDir.resolve("kepware_hierarchy.json");
        fileStore.saveHierarchy(hierarchy, file);
        Hierarchy loaded = fileStore.loadHierarchy(file);

        assertEquals(codec.serialize(hierarchy), codec.serialize(loaded));
        assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("Läuft"));
    }

    @Test
    void testOverwriteKeepsBackup() throws Exception {
        Path file = tempDir.resolve("kepware_tags.csv");
        fileStore.writeCsv("first\n", file);
        fileStore.writeCsv("second\n", file);

        assertEquals("second\n", Files.readString(file));
        assertEquals("first\n", Files.readString(HierarchyFileStore.backupPath(file)));
    }

    @Test
    void testNoBackupWhenDisabled() throws Exception {
        HierarchyFileStore store = new HierarchyFileStore(codec, false);
        Path file = tempDir.resolve("kepware_tags.csv");
        store.writeCsv("first\n", file);
        store.writeCsv("second\n", file);

        assertFalse(Files.exists(HierarchyFileStore.backupPath(file)));
    }

    @Test
    void testWriteCreatesMissingDirectories() throws Exception {
        Path file = tempDir.resolve("exports/line1/kepware_tags.csv");
        fileStore.writeCsv("data\n", file);

        assertEquals("data\n", Files.readString(file));
    }

    @Test
    void testLoadingMissingFileIsIoError() {
        assertThrows(IOException.class, () -> fileStore.loadHierarchy(tempDir.resolve("missing.json")));
    }

    @Test
    void testLoadingCorruptFileIsLoadError() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"name\": ");

        assertThrows(HierarchyLoadException.class, () -> fileStore.loadHierarchy(file));
    }
}
