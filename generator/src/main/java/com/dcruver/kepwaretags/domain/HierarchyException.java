package com.dcruver.kepwaretags.domain;

/**
 * Base type for rejected structural edits. The hierarchy is unchanged when one is thrown.
 */
public class HierarchyException extends RuntimeException {

    public HierarchyException(String message) {
        super(message);
    }
}
