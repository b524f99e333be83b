package com.dcruver.kepwaretags.domain;

import lombok.Data;

/**
 * One exported tag: its dotted full name and data type.
 */
@Data
public class TagRecord {
    private final String fullName;
    private final TagDataType dataType;
}
