package com.dcruver.kepwaretags.app;

import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.InvalidTargetException;
import com.dcruver.kepwaretags.domain.Node;
import com.dcruver.kepwaretags.domain.NodeId;
import org.springframework.stereotype.Component;

/**
 * Turns shell node references into node ids.
 *
 * Accepted forms: {@code #12} (node id), {@code Line1/Speed} (names below the root,
 * matched ignoring case, first match wins) and {@code /} or an empty reference for the root.
 */
@Component
public class NodePathResolver {

    public NodeId resolve(Hierarchy hierarchy, String reference) {
        String ref = reference == null ? "" : reference.trim();

        if (ref.startsWith("#")) {
            NodeId id = parseId(ref);
            if (!hierarchy.contains(id)) {
                throw new InvalidTargetException("No node with id " + ref);
            }
            return id;
        }

        NodeId current = hierarchy.getRootId();
        for (String segment : ref.split("/")) {
            if (segment.isBlank()) {
                continue;
            }
            Node parent = hierarchy.getNode(current);
            if (!parent.isFolder()) {
                throw new InvalidTargetException("'" + parent.getName() + "' is a tag and has no children");
            }
            current = hierarchy.findChild(current, segment)
                .map(Node::getId)
                .orElseThrow(() -> new InvalidTargetException("No node named '" + segment.trim()
                    + "' in '" + parent.getName() + "'"));
        }
        return current;
    }

    /**
     * Like {@link #resolve}, but a tag resolves to the folder that contains it.
     */
    public NodeId resolveContainer(Hierarchy hierarchy, String reference) {
        NodeId id = resolve(hierarchy, reference);
        Node node = hierarchy.getNode(id);
        if (node.isFolder()) {
            return id;
        }
        return node.getParentId().orElseThrow();
    }

    /**
     * Slash-separated path of a node, "/" for the root.
     */
    public String pathOf(Hierarchy hierarchy, NodeId id) {
        StringBuilder path = new StringBuilder();
        Node node = hierarchy.getNode(id);
        while (!node.isRoot()) {
            path.insert(0, "/" + node.getName());
            node = hierarchy.getNode(node.getParentId().orElseThrow());
        }
        return path.length() == 0 ? "/" : path.substring(1);
    }

    private static NodeId parseId(String ref) {
        try {
            return new NodeId(Long.parseLong(ref.substring(1)));
        } catch (NumberFormatException e) {
            throw new InvalidTargetException("Invalid node id: " + ref);
        }
    }
}
