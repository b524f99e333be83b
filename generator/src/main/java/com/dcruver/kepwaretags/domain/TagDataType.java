package com.dcruver.kepwaretags.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Data types a Kepware tag can be exported with.
 */
public enum TagDataType {
    STRING("String"),
    INTEGER("Integer"),
    BOOLEAN("Boolean");

    private final String displayName;

    TagDataType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Value written to the "Data Type" column of the CSV.
     */
    public String getCsvName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a user-supplied type name, ignoring case ("integer", "Integer", "INTEGER").
     */
    public static TagDataType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Data type must not be blank");
        }
        for (TagDataType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + value
            + " (expected String, Integer or Boolean)");
    }

    /**
     * Accepts the type names and the numeric ordinals older hierarchy files were written with.
     */
    @JsonCreator
    public static TagDataType fromJson(Object value) {
        if (value instanceof Number number) {
            int ordinal = number.intValue();
            TagDataType[] types = values();
            if (ordinal < 0 || ordinal >= types.length || number.doubleValue() != ordinal) {
                throw new IllegalArgumentException("Unknown data type ordinal: " + value);
            }
            return types[ordinal];
        }
        if (value instanceof String text) {
            return parse(text);
        }
        throw new IllegalArgumentException("Unsupported data type value: " + value);
    }
}
