package com.dcruver.kepwaretags.domain;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a hierarchy depth-first (pre-order) and lists its tags with dotted full names.
 * The root's own name never appears in a full name.
 */
@Component
public class TagFlattener {

    public static final String SEPARATOR = ".";

    public List<TagRecord> flatten(Hierarchy hierarchy) {
        List<TagRecord> records = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        for (Node child : hierarchy.getChildren(hierarchy.getRootId())) {
            visit(hierarchy, child, path, records);
        }
        return records;
    }

    private void visit(Hierarchy hierarchy, Node node, Deque<String> path, List<TagRecord> out) {
        if (node instanceof TagNode tag) {
            out.add(new TagRecord(fullName(path, tag.getName()), tag.getDataType()));
            return;
        }
        path.addLast(node.getName());
        for (Node child : hierarchy.getChildren(node.getId())) {
            visit(hierarchy, child, path, out);
        }
        path.removeLast();
    }

    private static String fullName(Deque<String> path, String tagName) {
        if (path.isEmpty()) {
            return tagName;
        }
        return String.join(SEPARATOR, path) + SEPARATOR + tagName;
    }
}
