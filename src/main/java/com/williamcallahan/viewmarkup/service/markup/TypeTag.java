package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.TagGrammarException;
import com.williamcallahan.viewmarkup.domain.view.ElementType;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Element type, name and priority encoded in a colon separated tag name.
 *
 * <ul>
 *   <li>{@code b}: plain element</li>
 *   <li>{@code container:p}, {@code attribute:b}: typed element</li>
 *   <li>{@code b:20}: attribute element with priority</li>
 *   <li>{@code attribute:b:20}: typed element with priority</li>
 * </ul>
 *
 * @param type element type
 * @param name element name
 * @param priority priority segment, when present
 */
record TypeTag(ElementType type, String name, OptionalInt priority) {

    private static final String SEPARATOR = ":";

    TypeTag {
        Objects.requireNonNull(type, "Tag type cannot be null");
        Objects.requireNonNull(name, "Tag name cannot be null");
        Objects.requireNonNull(priority, "Tag priority cannot be null");
    }

    /**
     * Decodes a raw tag name.
     *
     * @param rawTag tag name as found in markup
     * @return decoded tag
     * @throws TagGrammarException when the tag matches none of the accepted shapes
     */
    static TypeTag parse(String rawTag) {
        String[] segments = rawTag.split(SEPARATOR, -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new TagGrammarException(rawTag);
            }
        }

        if (segments.length == 1) {
            return new TypeTag(ElementType.PLAIN, segments[0], OptionalInt.empty());
        }

        if (segments.length == 2) {
            Optional<ElementType> type = ElementType.fromTagPrefix(segments[0]);
            if (type.isPresent()) {
                return new TypeTag(type.get(), segments[1], OptionalInt.empty());
            }
            OptionalInt priority = parsePriority(segments[1]);
            if (priority.isPresent()) {
                return new TypeTag(ElementType.ATTRIBUTE, segments[0], priority);
            }
            throw new TagGrammarException(rawTag);
        }

        if (segments.length == 3) {
            Optional<ElementType> type = ElementType.fromTagPrefix(segments[0]);
            OptionalInt priority = parsePriority(segments[2]);
            if (type.isPresent() && priority.isPresent()) {
                return new TypeTag(type.get(), segments[1], priority);
            }
        }

        throw new TagGrammarException(rawTag);
    }

    /**
     * Reads the tag of an existing element.
     *
     * @param element element to describe
     * @return tag carrying the element's type, name and priority
     */
    static TypeTag of(ViewElement element) {
        return new TypeTag(element.type(), element.name(), element.priority());
    }

    /**
     * Builds a detached element for this tag. Priorities on plain and container tags are dropped.
     *
     * @return new element
     * @throws IllegalArgumentException when the name is not a valid element name
     */
    ViewElement toElement() {
        return ViewElement.of(type, name, priority);
    }

    /**
     * Encodes this tag. Without both flags only the bare name remains, which loses type and
     * priority and is meant for human-readable output.
     *
     * @param showType emit the {@code container:} or {@code attribute:} prefix
     * @param showPriority emit the priority suffix of attribute elements
     * @return tag name
     */
    String encode(boolean showType, boolean showPriority) {
        List<String> segments = new ArrayList<>(3);
        if (showType) {
            type.tagPrefix().ifPresent(segments::add);
        }
        segments.add(name);
        if (showPriority && type == ElementType.ATTRIBUTE && priority.isPresent()) {
            segments.add(Integer.toString(priority.getAsInt()));
        }
        return String.join(SEPARATOR, segments);
    }

    private static OptionalInt parsePriority(String segment) {
        try {
            return OptionalInt.of(Integer.parseInt(segment));
        } catch (NumberFormatException notANumber) {
            return OptionalInt.empty();
        }
    }
}
