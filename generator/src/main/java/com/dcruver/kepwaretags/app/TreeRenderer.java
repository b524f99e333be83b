package com.dcruver.kepwaretags.app;

import com.dcruver.kepwaretags.domain.Hierarchy;
import com.dcruver.kepwaretags.domain.Node;
import com.dcruver.kepwaretags.domain.TagNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Draws the hierarchy as an indented tree for the shell.
 */
@Component
public class TreeRenderer {

    public String render(Hierarchy hierarchy) {
        StringBuilder sb = new StringBuilder();
        sb.append(label(hierarchy.getRoot())).append("\n");
        renderChildren(hierarchy, hierarchy.getRoot(), "", sb);
        return sb.toString();
    }

    private void renderChildren(Hierarchy hierarchy, Node folder, String indent, StringBuilder sb) {
        List<Node> children = hierarchy.getChildren(folder.getId());
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            boolean last = i == children.size() - 1;
            sb.append(indent).append(last ? "└── " : "├── ").append(label(child)).append("\n");
            if (child.isFolder()) {
                renderChildren(hierarchy, child, indent + (last ? "    " : "│   "), sb);
            }
        }
    }

    private static String label(Node node) {
        if (node instanceof TagNode tag) {
            return String.format("%s : %s  %s", tag.getName(), tag.getDataType().getDisplayName(), tag.getId());
        }
        return String.format("%s/  %s", node.getName(), node.getId());
    }
}
