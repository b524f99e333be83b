package com.dcruver.kepwaretags.export;

/**
 * Export was requested for a hierarchy without any tags.
 */
public class NoTagsException extends RuntimeException {

    public NoTagsException() {
        super("No tags found. Add tags before exporting.");
    }
}
