package com.williamcallahan.viewmarkup.domain.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tokenized element with its raw tag name.
 *
 * @param tagName tag name exactly as written, type tag segments included
 * @param attributes attributes in declaration order
 * @param children nodes in document order
 */
public record MarkupElement(String tagName, Map<String, String> attributes, List<MarkupNode> children)
    implements MarkupNode {

    public MarkupElement {
        Objects.requireNonNull(tagName, "Tag name cannot be null");
        Objects.requireNonNull(attributes, "Attributes cannot be null");
        Objects.requireNonNull(children, "Element children cannot be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }
}
