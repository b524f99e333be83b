package com.dcruver.kepwaretags.io;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * JSON shape of one hierarchy node as stored in a saved hierarchy file.
 * Folders carry a placeholder data type; tags carry an empty child list.
 *
 * {@code dataType} holds the value as read (a type name or an ordinal) and is only
 * interpreted for tags, so whatever a folder carries there is ignored.
 */
@Data
@Builder
@JsonPropertyOrder({"name", "isFolder", "dataType", "children"})
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class HierarchyDocument {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("isFolder")
    private final Boolean folder;

    @JsonProperty("dataType")
    private final Object dataType;

    @JsonProperty("children")
    private final List<HierarchyDocument> children;

    @JsonCreator
    public HierarchyDocument(
            @JsonProperty(value = "name", required = true) String name,
            @JsonProperty(value = "isFolder", required = true) Boolean folder,
            @JsonProperty("dataType") Object dataType,
            @JsonProperty("children") List<HierarchyDocument> children) {
        this.name = name;
        this.folder = folder;
        this.dataType = dataType;
        this.children = children != null ? children : List.of();
    }
}
