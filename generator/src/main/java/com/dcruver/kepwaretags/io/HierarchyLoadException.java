package com.dcruver.kepwaretags.io;

/**
 * A hierarchy document could not be turned into a hierarchy.
 * Whatever hierarchy the caller already holds stays in place.
 */
public class HierarchyLoadException extends Exception {

    public HierarchyLoadException(String message) {
        super(message);
    }

    public HierarchyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
