package com.dcruver.kepwaretags.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Optional;

/**
 * A folder or tag held in a {@link Hierarchy} arena.
 * Only the owning hierarchy creates or mutates a node.
 */
@Getter
public abstract class Node {

    private final NodeId id;

    @Setter(AccessLevel.PACKAGE)
    private String name;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private NodeId parentId;

    Node(NodeId id, String name, NodeId parentId) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
    }

    /**
     * Parent folder id, empty for the root.
     */
    public Optional<NodeId> getParentId() {
        return Optional.ofNullable(parentId);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public abstract boolean isFolder();
}
