package com.dcruver.kepwaretags.domain;

/**
 * Stable index of a node inside one {@link Hierarchy}. Ids are never reused.
 */
public record NodeId(long value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
