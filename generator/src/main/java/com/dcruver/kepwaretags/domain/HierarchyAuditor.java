package com.dcruver.kepwaretags.domain;

import com.dcruver.kepwaretags.domain.AuditFinding.FindingType;
import com.dcruver.kepwaretags.domain.AuditFinding.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inspects a hierarchy for names that would produce a broken or ambiguous CSV.
 * Never modifies the hierarchy.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HierarchyAuditor {

    private final TagFlattener tagFlattener;

    public List<AuditFinding> audit(Hierarchy hierarchy) {
        List<AuditFinding> findings = new ArrayList<>();
        for (Node child : hierarchy.getChildren(hierarchy.getRootId())) {
            inspect(hierarchy, child, child.getName(), findings);
        }
        checkSiblings(hierarchy, hierarchy.getRoot(), "", findings);

        List<TagRecord> tags = tagFlattener.flatten(hierarchy);
        if (tags.isEmpty()) {
            findings.add(AuditFinding.builder()
                .type(FindingType.NO_TAGS)
                .severity(Severity.ERROR)
                .path("/")
                .message("Hierarchy contains no tags; export will fail")
                .build());
        }
        checkFullNames(tags, findings);

        log.debug("Audit produced {} finding(s)", findings.size());
        return findings;
    }

    /**
     * Characters the Kepware CSV cannot carry because fields are written unquoted.
     */
    public static boolean hasUnsafeCsvCharacters(String value) {
        return value.indexOf(',') >= 0 || value.indexOf('"') >= 0
            || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }

    private void inspect(Hierarchy hierarchy, Node node, String path, List<AuditFinding> findings) {
        String name = node.getName();

        if (hasUnsafeCsvCharacters(name)) {
            findings.add(finding(FindingType.UNSAFE_CSV_CHARACTERS, Severity.ERROR, node, path,
                "Name contains a comma, quote or line break, which breaks the CSV row"));
        }
        if (name.contains(TagFlattener.SEPARATOR)) {
            findings.add(finding(FindingType.DOT_IN_NAME, Severity.WARNING, node, path,
                "Name contains '.', so the exported full name is ambiguous"));
        }

        if (node instanceof FolderNode folder) {
            List<Node> children = hierarchy.getChildren(folder.getId());
            if (children.isEmpty()) {
                findings.add(finding(FindingType.EMPTY_FOLDER, Severity.INFO, node, path,
                    "Folder is empty and contributes nothing to the export"));
            }
            checkSiblings(hierarchy, folder, path, findings);
            for (Node child : children) {
                inspect(hierarchy, child, path + "/" + child.getName(), findings);
            }
        }
    }

    private void checkSiblings(Hierarchy hierarchy, FolderNode folder, String path, List<AuditFinding> findings) {
        Map<String, Node> seen = new HashMap<>();
        for (Node child : hierarchy.getChildren(folder.getId())) {
            Node previous = seen.putIfAbsent(nameKey(child.getName()), child);
            if (previous != null) {
                String childPath = path.isEmpty() ? child.getName() : path + "/" + child.getName();
                findings.add(finding(FindingType.DUPLICATE_SIBLING_NAME, Severity.WARNING, child, childPath,
                    "Another node in the same folder is already named '" + previous.getName() + "'"));
            }
        }
    }

    private void checkFullNames(List<TagRecord> tags, List<AuditFinding> findings) {
        Map<String, Integer> counts = new HashMap<>();
        for (TagRecord tag : tags) {
            counts.merge(nameKey(tag.getFullName()), 1, Integer::sum);
        }
        for (TagRecord tag : tags) {
            Integer count = counts.remove(nameKey(tag.getFullName()));
            if (count != null && count > 1) {
                findings.add(AuditFinding.builder()
                    .type(FindingType.DUPLICATE_FULL_NAME)
                    .severity(Severity.ERROR)
                    .path(tag.getFullName())
                    .message(count + " tags export as '" + tag.getFullName() + "'")
                    .build());
            }
        }
    }

    /**
     * Case-folded key under which two names collide exactly when {@link String#equalsIgnoreCase} matches them.
     */
    static String nameKey(String name) {
        StringBuilder key = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            key.append(Character.toLowerCase(Character.toUpperCase(name.charAt(i))));
        }
        return key.toString();
    }

    private static AuditFinding finding(FindingType type, Severity severity, Node node, String path, String message) {
        return AuditFinding.builder()
            .type(type)
            .severity(severity)
            .nodeId(node.getId())
            .path(path)
            .message(message)
            .build();
    }
}
