package com.dcruver.kepwaretags.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A problem spotted in a hierarchy before it is exported.
 */
@Data
@Builder
public class AuditFinding {
    private final FindingType type;
    private final Severity severity;
    private final NodeId nodeId;   // null for findings about the whole hierarchy
    private final String path;
    private final String message;

    public enum FindingType {
        DUPLICATE_SIBLING_NAME,
        UNSAFE_CSV_CHARACTERS,
        DOT_IN_NAME,
        DUPLICATE_FULL_NAME,
        EMPTY_FOLDER,
        NO_TAGS
    }

    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }
}
