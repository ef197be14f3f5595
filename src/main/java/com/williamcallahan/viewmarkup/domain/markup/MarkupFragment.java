package com.williamcallahan.viewmarkup.domain.markup;

import java.util.List;
import java.util.Objects;

/**
 * Top-level sequence of tokenized nodes.
 *
 * @param children nodes in document order
 */
public record MarkupFragment(List<MarkupNode> children) implements MarkupNode {

    public MarkupFragment {
        Objects.requireNonNull(children, "Fragment children cannot be null");
        children = List.copyOf(children);
    }
}
