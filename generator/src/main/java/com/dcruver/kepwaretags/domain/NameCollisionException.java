package com.dcruver.kepwaretags.domain;

/**
 * A sibling already uses the name and the hierarchy runs with {@link DuplicateNamePolicy#REJECT}.
 */
public class NameCollisionException extends HierarchyException {

    public NameCollisionException(String message) {
        super(message);
    }
}
