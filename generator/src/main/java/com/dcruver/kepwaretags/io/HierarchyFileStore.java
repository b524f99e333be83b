package com.dcruver.kepwaretags.io;

import com.dcruver.kepwaretags.config.GeneratorProperties;
import com.dcruver.kepwaretags.domain.Hierarchy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Whole-file reads and writes of hierarchy JSON and exported CSV, always UTF-8.
 * An existing target is copied to {@code <name>.bak} before it is overwritten.
 */
@Component
@Slf4j
public class HierarchyFileStore {

    private final HierarchyJsonCodec codec;
    private final boolean backupOnOverwrite;

    public HierarchyFileStore(HierarchyJsonCodec codec, boolean backupOnOverwrite) {
        this.codec = codec;
        this.backupOnOverwrite = backupOnOverwrite;
    }

    @Autowired
    public HierarchyFileStore(HierarchyJsonCodec codec, GeneratorProperties properties) {
        this(codec, properties.getFiles().isBackupOnOverwrite());
    }

    /**
     * Save a hierarchy as pretty-printed JSON.
     */
    public void saveHierarchy(Hierarchy hierarchy, Path path) throws IOException {
        writeText(codec.serialize(hierarchy), path);
        log.info("Saved hierarchy ({} nodes) to {}", hierarchy.size(), path);
    }

    /**
     * Read and parse a hierarchy file into a new hierarchy.
     */
    public Hierarchy loadHierarchy(Path path) throws IOException, HierarchyLoadException {
        Hierarchy hierarchy = codec.deserialize(readText(path));
        log.info("Loaded hierarchy ({} nodes) from {}", hierarchy.size(), path);
        return hierarchy;
    }

    public void writeCsv(String csv, Path path) throws IOException {
        writeText(csv, path);
        log.info("Wrote CSV to {}", path);
    }

    public String readText(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Backup file used when {@code path} is overwritten.
     */
    public static Path backupPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".bak");
    }

    private void writeText(String content, Path path) throws IOException {
        if (backupOnOverwrite && Files.exists(path)) {
            Path backup = backupPath(path);
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Backed up {} to {}", path, backup);
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
