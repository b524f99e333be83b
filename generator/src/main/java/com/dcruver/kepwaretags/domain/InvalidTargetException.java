package com.dcruver.kepwaretags.domain;

/**
 * Operation applied to the wrong kind of node, to the root where the root is not allowed,
 * or to a node that is not in the hierarchy.
 */
public class InvalidTargetException extends HierarchyException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
