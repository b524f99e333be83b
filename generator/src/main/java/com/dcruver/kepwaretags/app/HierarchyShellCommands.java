package com.dcruver.kepwaretags.app;

import com.dcruver.kepwaretags.config.GeneratorProperties;
import com.dcruver.kepwaretags.domain.AuditFinding;
import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.HierarchyAuditor;
import com.dcruver.kepwaretags.domain.HierarchyException;
import com.dcruver.kepwaretags.domain.NodeId;
import com.dcruver.kepwaretags.domain.TagDataType;
import com.dcruver.kepwaretags.domain.TagFlattener;
import com.dcruver.kepwaretags.domain.TagRecord;
import com.dcruver.kepwaretags.export.AddressAllocator;
import com.dcruver.kepwaretags.export.CsvExporter;
import com.dcruver.kepwaretags.export.ExportDiffer;
import com.dcruver.kepwaretags.export.NoTagsException;
import com.dcruver.kepwaretags.io.HierarchyFileStore;
import com.dcruver.kepwaretags.io.HierarchyLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for editing the session hierarchy, saving and loading it,
 * and exporting it as Kepware CSV.
 *
 * Node arguments take a path below the root ({@code Line1/Speed}), {@code /} for the root,
 * or a node id as shown by {@code tree} ({@code #3}).
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class HierarchyShellCommands {

    private final HierarchySession session;
    private final NodePathResolver pathResolver;
    private final TreeRenderer treeRenderer;
    private final TagFlattener tagFlattener;
    private final CsvExporter csvExporter;
    private final ExportDiffer exportDiffer;
    private final HierarchyFileStore fileStore;
    private final HierarchyAuditor auditor;
    private final GeneratorProperties properties;

    @ShellMethod(key = {"tree", "show"}, value = "Show the folder/tag hierarchy")
    public String tree() {
        Hierarchy hierarchy = session.current();
        int tags = hierarchy.countTags();
        // root not counted
        int folders = hierarchy.size() - tags - 1;
        return treeRenderer.render(hierarchy)
            + String.format("%n%d folder(s), %d tag(s)%n", folders, tags);
    }

    @ShellMethod(key = "add-folder", value = "Add a folder (a tag as parent means the tag's folder)")
    public String addFolder(
            @ShellOption(value = "--name") String name,
            @ShellOption(value = "--parent", defaultValue = "/") String parent) {
        try {
            Hierarchy hierarchy = session.current();
            NodeId parentId = pathResolver.resolveContainer(hierarchy, parent);
            NodeId id = hierarchy.addFolder(parentId, name);
            return "Added folder " + pathResolver.pathOf(hierarchy, id) + " " + id;
        } catch (Exception e) {
            return failure("Add folder", e);
        }
    }

    @ShellMethod(key = "add-tag", value = "Add a tag (a tag as parent means the tag's folder)")
    public String addTag(
            @ShellOption(value = "--name") String name,
            @ShellOption(value = "--type", defaultValue = "String", help = "String, Integer or Boolean") String type,
            @ShellOption(value = "--parent", defaultValue = "/") String parent) {
        try {
            Hierarchy hierarchy = session.current();
            TagDataType dataType = TagDataType.parse(type);
            NodeId parentId = pathResolver.resolveContainer(hierarchy, parent);
            NodeId id = hierarchy.addTag(parentId, name, dataType);
            return String.format("Added %s tag %s %s", dataType.getDisplayName(),
                pathResolver.pathOf(hierarchy, id), id);
        } catch (Exception e) {
            return failure("Add tag", e);
        }
    }

    @ShellMethod(key = "rename", value = "Rename a folder or tag")
    public String rename(
            @ShellOption(value = "--node") String node,
            @ShellOption(value = "--name") String name) {
        try {
            Hierarchy hierarchy = session.current();
            NodeId id = pathResolver.resolve(hierarchy, node);
            String oldName = hierarchy.getNode(id).getName();
            hierarchy.rename(id, name);
            return String.format("Renamed '%s' to '%s'", oldName, hierarchy.getNode(id).getName());
        } catch (Exception e) {
            return failure("Rename", e);
        }
    }

    @ShellMethod(key = "remove", value = "Remove a folder or tag and everything below it")
    public String remove(@ShellOption(value = "--node") String node) {
        try {
            Hierarchy hierarchy = session.current();
            NodeId id = pathResolver.resolve(hierarchy, node);
            String path = pathResolver.pathOf(hierarchy, id);
            int before = hierarchy.size();
            hierarchy.remove(id);
            return String.format("Removed %s (%d node(s))", path, before - hierarchy.size());
        } catch (Exception e) {
            return failure("Remove", e);
        }
    }

    @ShellMethod(key = "duplicate", value = "Copy a folder with all its contents next to itself")
    public String duplicate(@ShellOption(value = "--node") String node) {
        try {
            Hierarchy hierarchy = session.current();
            NodeId id = pathResolver.resolve(hierarchy, node);
            NodeId copy = hierarchy.duplicate(id);
            return "Created " + pathResolver.pathOf(hierarchy, copy) + " " + copy;
        } catch (Exception e) {
            return failure("Duplicate", e);
        }
    }

    @ShellMethod(key = "move", value = "Move a folder or tag into another folder (a tag target means its folder)")
    public String move(
            @ShellOption(value = "--node") String node,
            @ShellOption(value = "--target") String target) {
        try {
            Hierarchy hierarchy = session.current();
            NodeId id = pathResolver.resolve(hierarchy, node);
            NodeId targetId = pathResolver.resolveContainer(hierarchy, target);
            if (!hierarchy.move(id, targetId)) {
                return "Move rejected: a node cannot be moved into itself or one of its descendants";
            }
            return "Moved to " + pathResolver.pathOf(hierarchy, id);
        } catch (Exception e) {
            return failure("Move", e);
        }
    }

    @ShellMethod(key = "tags", value = "List the tags as they will be exported, with addresses")
    public String tags() {
        List<TagRecord> tags = tagFlattener.flatten(session.current());
        if (tags.isEmpty()) {
            return "No tags.";
        }

        AddressAllocator allocator = new AddressAllocator();
        StringBuilder sb = new StringBuilder();
        for (TagRecord tag : tags) {
            sb.append(String.format("%-10s %-8s %s%n",
                allocator.next(tag.getDataType()), tag.getDataType().getCsvName(), tag.getFullName()));
        }
        sb.append(String.format("%nTotal: %d tags%n", tags.size()));
        return sb.toString();
    }

    @ShellMethod(key = {"export", "export csv"}, value = "Export the tags as Kepware CSV")
    public String export(@ShellOption(value = "--file", defaultValue = ShellOption.NULL) String file) {
        try {
            Path path = Path.of(file != null ? file : properties.getExport().getCsvFile());
            List<TagRecord> tags = tagFlattener.flatten(session.current());
            String csv = csvExporter.export(tags);
            fileStore.writeCsv(csv, path);
            return String.format("Exported %d tags to %s", tags.size(), path.toAbsolutePath());
        } catch (Exception e) {
            return failure("Export", e);
        }
    }

    @ShellMethod(key = "export-diff", value = "Show how a new export would differ from an existing CSV file")
    public String exportDiff(@ShellOption(value = "--file", defaultValue = ShellOption.NULL) String file) {
        try {
            Path path = Path.of(file != null ? file : properties.getExport().getCsvFile());
            String current = csvExporter.export(tagFlattener.flatten(session.current()));
            String previous = Files.exists(path) ? fileStore.readText(path) : "";
            String diff = exportDiffer.diff(previous, current, path.getFileName().toString());
            return diff.isEmpty() ? "No changes since " + path : diff;
        } catch (Exception e) {
            return failure("Export diff", e);
        }
    }

    @ShellMethod(key = {"save", "save json"}, value = "Save the hierarchy as JSON")
    public String save(@ShellOption(value = "--file", defaultValue = ShellOption.NULL) String file) {
        try {
            Path path = Path.of(file != null ? file : properties.getFiles().getJsonFile());
            fileStore.saveHierarchy(session.current(), path);
            return "Hierarchy saved to " + path.toAbsolutePath();
        } catch (Exception e) {
            return failure("Save", e);
        }
    }

    @ShellMethod(key = {"load", "load json"}, value = "Replace the hierarchy with one loaded from JSON")
    public String load(@ShellOption(value = "--file", defaultValue = ShellOption.NULL) String file) {
        try {
            Path path = Path.of(file != null ? file : properties.getFiles().getJsonFile());
            Hierarchy loaded = fileStore.loadHierarchy(path);
            session.replace(loaded);
            return String.format("Loaded %s: %d tag(s)", path.toAbsolutePath(), loaded.countTags());
        } catch (Exception e) {
            return failure("Load", e);
        }
    }

    @ShellMethod(key = "new", value = "Discard the hierarchy and start with an empty root folder")
    public String newHierarchy() {
        Hierarchy hierarchy = session.reset();
        return "Started new hierarchy '" + hierarchy.getRoot().getName() + "'";
    }

    @ShellMethod(key = "audit", value = "Check names and structure before exporting")
    public String audit() {
        Hierarchy hierarchy = session.current();
        List<AuditFinding> findings = auditor.audit(hierarchy);
        if (findings.isEmpty()) {
            return "No problems found.";
        }

        StringBuilder sb = new StringBuilder("Audit findings:\n\n");
        for (AuditFinding finding : findings) {
            sb.append(String.format("[%s] %s %s%n", finding.getSeverity(), finding.getType(), finding.getPath()));
            sb.append("  ").append(finding.getMessage()).append("\n");
        }
        long errors = findings.stream()
            .filter(f -> f.getSeverity() == AuditFinding.Severity.ERROR)
            .count();
        sb.append(String.format("%nTotal: %d finding(s), %d error(s)%n", findings.size(), errors));
        return sb.toString();
    }

    private String failure(String verb, Exception e) {
        if (e instanceof HierarchyException || e instanceof NoTagsException
                || e instanceof HierarchyLoadException || e instanceof IllegalArgumentException) {
            log.warn("{} failed: {}", verb, e.getMessage());
        } else if (e instanceof NoSuchFileException) {
            log.warn("{} failed: file not found {}", verb, e.getMessage());
            return verb + " failed: file not found: " + e.getMessage();
        } else {
            log.error("{} failed", verb, e);
        }
        return verb + " failed: " + e.getMessage();
    }
}
