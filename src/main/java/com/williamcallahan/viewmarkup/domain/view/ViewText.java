package com.williamcallahan.viewmarkup.domain.view;

import java.util.List;
import java.util.Objects;

/**
 * Leaf node carrying character data.
 */
public final class ViewText extends ViewNode {

    private final String data;

    public ViewText(String data) {
        this.data = Objects.requireNonNull(data, "Text data cannot be null");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TEXT;
    }

    public String data() {
        return data;
    }

    @Override
    public List<ViewNode> children() {
        return List.of();
    }

    @Override
    public int maxOffset() {
        return data.length();
    }

    @Override
    public boolean sameStructureAs(ViewNode other) {
        return other instanceof ViewText text && data.equals(text.data);
    }

    @Override
    public String toString() {
        return "ViewText{" + data + "}";
    }
}
