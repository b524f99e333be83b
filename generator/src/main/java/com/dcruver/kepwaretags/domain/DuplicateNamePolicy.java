package com.dcruver.kepwaretags.domain;

/**
 * How add, rename and move treat a name already used by a sibling (compared ignoring case).
 */
public enum DuplicateNamePolicy {
    /**
     * Keep the colliding name as entered.
     */
    ALLOW,

    /**
     * Fail with {@link NameCollisionException}.
     */
    REJECT
}
