package com.dcruver.kepwaretags.domain;

import lombok.Getter;

/**
 * Leaf node exported as one CSV row.
 */
@Getter
public final class TagNode extends Node {

    private final TagDataType dataType;

    TagNode(NodeId id, String name, NodeId parentId, TagDataType dataType) {
        super(id, name, parentId);
        this.dataType = dataType;
    }

    @Override
    public boolean isFolder() {
        return false;
    }

    @Override
    public String toString() {
        return "Tag[" + getId() + " " + getName() + ":" + dataType.getDisplayName() + "]";
    }
}
