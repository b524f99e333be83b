package com.dcruver.kepwaretags.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Folder/tag tree held as an arena of nodes keyed by {@link NodeId}.
 *
 * Folders own ordered child id lists and every node records its parent id,
 * so ownership and cycle checks never rely on object back-references.
 * The root is a folder that cannot be removed, moved or duplicated.
 */
@Slf4j
public class Hierarchy {

    public static final String DEFAULT_ROOT_NAME = "Root";

    private final Map<NodeId, Node> nodes = new HashMap<>();
    private final NodeId rootId;
    private long nextId;

    @Getter
    @Setter
    private DuplicateNamePolicy duplicateNamePolicy;

    public Hierarchy() {
        this(DEFAULT_ROOT_NAME, DuplicateNamePolicy.ALLOW);
    }

    public Hierarchy(String rootName, DuplicateNamePolicy duplicateNamePolicy) {
        this.duplicateNamePolicy = Objects.requireNonNull(duplicateNamePolicy, "duplicateNamePolicy");
        this.rootId = allocateId();
        nodes.put(rootId, new FolderNode(rootId, normalizeName(rootName), null));
    }

    // ---------------------------------------------------------------- queries

    public FolderNode getRoot() {
        return (FolderNode) nodes.get(rootId);
    }

    public NodeId getRootId() {
        return rootId;
    }

    /**
     * Look up a node, failing if the id does not belong to this hierarchy.
     */
    public Node getNode(NodeId id) {
        Node node = id != null ? nodes.get(id) : null;
        if (node == null) {
            throw new InvalidTargetException("Node " + id + " is not part of the hierarchy");
        }
        return node;
    }

    public Optional<Node> findNode(NodeId id) {
        return Optional.ofNullable(id != null ? nodes.get(id) : null);
    }

    public boolean contains(NodeId id) {
        return id != null && nodes.containsKey(id);
    }

    public Optional<FolderNode> getParent(NodeId id) {
        return getNode(id).getParentId().map(parentId -> (FolderNode) nodes.get(parentId));
    }

    /**
     * Children in insertion order; empty for tags.
     */
    public List<Node> getChildren(NodeId id) {
        Node node = getNode(id);
        if (!(node instanceof FolderNode folder)) {
            return List.of();
        }
        return folder.getChildIds().stream().map(nodes::get).toList();
    }

    /**
     * First child of {@code parentId} whose name equals {@code name} ignoring case.
     */
    public Optional<Node> findChild(NodeId parentId, String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return getChildren(parentId).stream()
            .filter(child -> child.getName().equalsIgnoreCase(wanted))
            .findFirst();
    }

    /**
     * True if {@code candidate} sits somewhere below {@code ancestor}.
     * Walks the parent chain of the candidate up to the root.
     */
    public boolean isDescendant(NodeId candidate, NodeId ancestor) {
        Optional<NodeId> current = getNode(candidate).getParentId();
        while (current.isPresent()) {
            if (current.get().equals(ancestor)) {
                return true;
            }
            current = nodes.get(current.get()).getParentId();
        }
        return false;
    }

    /**
     * Number of nodes, root included.
     */
    public int size() {
        return nodes.size();
    }

    public int countTags() {
        return (int) nodes.values().stream().filter(node -> !node.isFolder()).count();
    }

    // ---------------------------------------------------------------- edits

    public NodeId addFolder(NodeId parentId, String name) {
        FolderNode parent = requireFolder(parentId, "add a folder to");
        String folderName = normalizeName(name);
        checkSiblingName(parent, folderName, null);

        NodeId id = allocateId();
        nodes.put(id, new FolderNode(id, folderName, parent.getId()));
        parent.children().add(id);
        log.debug("Added folder {} '{}' under {}", id, folderName, parent.getId());
        return id;
    }

    public NodeId addTag(NodeId parentId, String name, TagDataType dataType) {
        Objects.requireNonNull(dataType, "dataType");
        FolderNode parent = requireFolder(parentId, "add a tag to");
        String tagName = normalizeName(name);
        checkSiblingName(parent, tagName, null);

        NodeId id = allocateId();
        nodes.put(id, new TagNode(id, tagName, parent.getId(), dataType));
        parent.children().add(id);
        log.debug("Added tag {} '{}' ({}) under {}", id, tagName, dataType, parent.getId());
        return id;
    }

    /**
     * Change the display name only; kind and data type are kept.
     */
    public void rename(NodeId id, String newName) {
        Node node = getNode(id);
        String name = normalizeName(newName);
        if (!node.isRoot()) {
            checkSiblingName((FolderNode) nodes.get(node.getParentId().orElseThrow()), name, id);
        }
        log.debug("Renamed {} '{}' -> '{}'", id, node.getName(), name);
        node.setName(name);
    }

    /**
     * Detach the node and discard its whole subtree.
     */
    public void remove(NodeId id) {
        Node node = getNode(id);
        if (node.isRoot()) {
            throw new InvalidTargetException("The root folder cannot be removed");
        }
        FolderNode parent = (FolderNode) nodes.get(node.getParentId().orElseThrow());
        parent.children().remove(id);

        List<NodeId> subtree = new ArrayList<>();
        collectSubtree(id, subtree);
        subtree.forEach(nodes::remove);
        log.debug("Removed {} '{}' and {} descendant(s)", id, node.getName(), subtree.size() - 1);
    }

    /**
     * Deep-copy a non-root folder next to itself under a generated name
     * "{name} (1)", "{name} (2)", ... that no sibling uses.
     *
     * @return id of the copy
     */
    public NodeId duplicate(NodeId folderId) {
        Node source = getNode(folderId);
        if (!source.isFolder()) {
            throw new InvalidTargetException("Only folders can be duplicated: " + source.getName());
        }
        if (source.isRoot()) {
            throw new InvalidTargetException("The root folder cannot be duplicated");
        }
        FolderNode parent = (FolderNode) nodes.get(source.getParentId().orElseThrow());
        String copyName = uniqueCopyName(parent, source.getName());

        NodeId copyId = copySubtree(source, parent.getId(), copyName);
        List<NodeId> siblings = parent.children();
        siblings.add(siblings.indexOf(folderId) + 1, copyId);
        log.debug("Duplicated folder {} '{}' as {} '{}'", folderId, source.getName(), copyId, copyName);
        return copyId;
    }

    /**
     * Re-parent a node as the last child of {@code newParentId}.
     *
     * @return false when the move would drop the node onto itself or into its own subtree;
     *         the hierarchy is left unchanged in that case
     */
    public boolean move(NodeId id, NodeId newParentId) {
        Node node = getNode(id);
        if (node.isRoot()) {
            throw new InvalidTargetException("The root folder cannot be moved");
        }
        FolderNode target = requireFolder(newParentId, "move into");

        if (id.equals(newParentId) || isDescendant(newParentId, id)) {
            log.info("Rejected move of '{}' into '{}': target is the node itself or one of its descendants",
                node.getName(), target.getName());
            return false;
        }
        checkSiblingName(target, node.getName(), id);

        FolderNode oldParent = (FolderNode) nodes.get(node.getParentId().orElseThrow());
        oldParent.children().remove(id);
        target.children().add(id);
        node.setParentId(target.getId());
        log.debug("Moved {} '{}' from {} to {}", id, node.getName(), oldParent.getId(), target.getId());
        return true;
    }

    // ---------------------------------------------------------------- helpers

    private NodeId allocateId() {
        return new NodeId(nextId++);
    }

    private FolderNode requireFolder(NodeId id, String action) {
        Node node = getNode(id);
        if (node instanceof FolderNode folder) {
            return folder;
        }
        throw new InvalidTargetException("Cannot " + action + " tag '" + node.getName() + "': not a folder");
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidNameException("Name must not be blank");
        }
        return name.trim();
    }

    private void checkSiblingName(FolderNode parent, String name, NodeId self) {
        boolean taken = parent.children().stream()
            .filter(childId -> !childId.equals(self))
            .map(nodes::get)
            .anyMatch(child -> child.getName().equalsIgnoreCase(name));
        if (!taken) {
            return;
        }
        if (duplicateNamePolicy == DuplicateNamePolicy.REJECT) {
            throw new NameCollisionException("'" + parent.getName() + "' already contains '" + name + "'");
        }
        log.debug("Keeping duplicate sibling name '{}' under '{}'", name, parent.getName());
    }

    private String uniqueCopyName(FolderNode parent, String original) {
        List<String> taken = parent.children().stream()
            .map(childId -> nodes.get(childId).getName())
            .toList();
        for (int i = 1; ; i++) {
            String candidate = original + " (" + i + ")";
            if (taken.stream().noneMatch(candidate::equalsIgnoreCase)) {
                return candidate;
            }
        }
    }

    private NodeId copySubtree(Node source, NodeId parentId, String name) {
        NodeId id = allocateId();
        if (source instanceof TagNode tag) {
            nodes.put(id, new TagNode(id, name, parentId, tag.getDataType()));
            return id;
        }
        FolderNode copy = new FolderNode(id, name, parentId);
        nodes.put(id, copy);
        for (NodeId childId : ((FolderNode) source).getChildIds()) {
            Node child = nodes.get(childId);
            copy.children().add(copySubtree(child, id, child.getName()));
        }
        return id;
    }

    private void collectSubtree(NodeId id, List<NodeId> out) {
        out.add(id);
        if (nodes.get(id) instanceof FolderNode folder) {
            for (NodeId childId : folder.getChildIds()) {
                collectSubtree(childId, out);
            }
        }
    }
}
