package com.dcruver.kepwaretags.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container node. Children are kept in insertion order.
 */
public final class FolderNode extends Node {

    private final List<NodeId> children = new ArrayList<>();

    FolderNode(NodeId id, String name, NodeId parentId) {
        super(id, name, parentId);
    }

    @Override
    public boolean isFolder() {
        return true;
    }

    public List<NodeId> getChildIds() {
        return Collections.unmodifiableList(children);
    }

    List<NodeId> children() {
        return children;
    }

    @Override
    public String toString() {
        return "Folder[" + getId() + " " + getName() + "]";
    }
}
