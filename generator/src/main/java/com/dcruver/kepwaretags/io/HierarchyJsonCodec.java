package com.dcruver.kepwaretags.io;

import com.dcruver.kepwaretags.domain.DuplicateNamePolicy;
import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.HierarchyException;
import com.dcruver.kepwaretags.domain.Node;
import com.dcruver.kepwaretags.domain.NodeId;
import com.dcruver.kepwaretags.domain.TagDataType;
import com.dcruver.kepwaretags.domain.TagNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts a {@link Hierarchy} to and from its JSON document form.
 *
 * Reading is lenient about letter case of property names and accepts numeric data types,
 * so files saved by the earlier desktop generator still load.
 */
@Component
@Slf4j
public class HierarchyJsonCodec {

    private final ObjectMapper objectMapper;

    public HierarchyJsonCodec() {
        this.objectMapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * Pretty-printed JSON for the whole hierarchy, root included.
     */
    public String serialize(Hierarchy hierarchy) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(toDocument(hierarchy, hierarchy.getRootId()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize hierarchy", e);
        }
    }

    /**
     * Build a new hierarchy from JSON text. Nothing is shared with any existing hierarchy,
     * so a failure here leaves the caller's current state untouched.
     */
    public Hierarchy deserialize(String json) throws HierarchyLoadException {
        HierarchyDocument root;
        try {
            root = objectMapper.readValue(json, HierarchyDocument.class);
        } catch (JsonProcessingException e) {
            throw new HierarchyLoadException("Invalid hierarchy JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null) {
            throw new HierarchyLoadException("Hierarchy JSON is empty");
        }
        if (!Boolean.TRUE.equals(root.getFolder())) {
            throw new HierarchyLoadException("The root node must be a folder");
        }

        try {
            Hierarchy hierarchy = new Hierarchy(root.getName(), DuplicateNamePolicy.ALLOW);
            addChildren(hierarchy, hierarchy.getRootId(), root.getChildren(), root.getName());
            log.debug("Deserialized hierarchy with {} nodes", hierarchy.size());
            return hierarchy;
        } catch (HierarchyException e) {
            throw new HierarchyLoadException("Invalid hierarchy: " + e.getMessage(), e);
        }
    }

    HierarchyDocument toDocument(Hierarchy hierarchy, NodeId id) {
        Node node = hierarchy.getNode(id);
        if (node instanceof TagNode tag) {
            return HierarchyDocument.builder()
                .name(tag.getName())
                .folder(false)
                .dataType(tag.getDataType())
                .children(List.of())
                .build();
        }
        return HierarchyDocument.builder()
            .name(node.getName())
            .folder(true)
            .dataType(TagDataType.STRING)
            .children(hierarchy.getChildren(id).stream()
                .map(child -> toDocument(hierarchy, child.getId()))
                .toList())
            .build();
    }

    private static TagDataType tagDataType(HierarchyDocument tag, String path) throws HierarchyLoadException {
        if (tag.getDataType() == null) {
            throw new HierarchyLoadException("Tag '" + path + "' has no dataType");
        }
        try {
            return TagDataType.fromJson(tag.getDataType());
        } catch (IllegalArgumentException e) {
            throw new HierarchyLoadException("Tag '" + path + "': " + e.getMessage(), e);
        }
    }

    private void addChildren(Hierarchy hierarchy, NodeId parentId, List<HierarchyDocument> children, String path)
            throws HierarchyLoadException {
        for (HierarchyDocument child : children) {
            if (child == null) {
                throw new HierarchyLoadException("Null child under '" + path + "'");
            }
            String childPath = path + "/" + child.getName();
            if (child.getFolder() == null) {
                throw new HierarchyLoadException("Node '" + childPath + "' has no isFolder value");
            }

            if (child.getFolder()) {
                NodeId folderId = hierarchy.addFolder(parentId, child.getName());
                addChildren(hierarchy, folderId, child.getChildren(), childPath);
                continue;
            }

            hierarchy.addTag(parentId, child.getName(), tagDataType(child, childPath));
            if (!child.getChildren().isEmpty()) {
                log.warn("Dropping {} child node(s) of tag '{}'", child.getChildren().size(), childPath);
            }
        }
    }
}
