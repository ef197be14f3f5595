package com.williamcallahan.viewmarkup.domain.view;

import java.util.Optional;

/**
 * Kind of a view element.
 *
 * <p>Plain elements carry no type prefix in the markup, container and attribute elements are
 * written as {@code container:name} and {@code attribute:name} when types are shown.
 */
public enum ElementType {
    PLAIN(null),
    CONTAINER("container"),
    ATTRIBUTE("attribute");

    private final String tagPrefix;

    ElementType(String tagPrefix) {
        this.tagPrefix = tagPrefix;
    }

    /**
     * Returns the prefix used in type tags, empty for plain elements.
     *
     * @return tag prefix
     */
    public Optional<String> tagPrefix() {
        return Optional.ofNullable(tagPrefix);
    }

    /**
     * Resolves a type tag prefix. Matching is exact and case-sensitive.
     *
     * @param rawPrefix first segment of a type tag
     * @return element type, empty when the segment is not a known prefix
     */
    public static Optional<ElementType> fromTagPrefix(String rawPrefix) {
        if (rawPrefix == null) {
            return Optional.empty();
        }
        for (ElementType type : values()) {
            if (rawPrefix.equals(type.tagPrefix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
