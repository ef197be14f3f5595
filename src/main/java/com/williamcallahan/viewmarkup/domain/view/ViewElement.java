package com.williamcallahan.viewmarkup.domain.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Named view element with a type, attributes and ordered children.
 *
 * <p>Attribute elements always carry a priority, {@link #DEFAULT_PRIORITY} unless given. Other
 * element types carry none. Attributes keep their insertion order, which is also the order they are
 * written in markup.
 */
public final class ViewElement extends ViewNode {

    /**
     * Priority assigned to attribute elements created without an explicit one.
     */
    public static final int DEFAULT_PRIORITY = 10;

    private final String name;
    private final ElementType type;
    private final int priority;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final ChildNodes children = new ChildNodes(this);

    private ViewElement(String name, ElementType type, int priority) {
        this.name = requireValidName(name, "Element name", true);
        this.type = Objects.requireNonNull(type, "Element type cannot be null");
        this.priority = priority;
    }

    public static ViewElement plain(String name) {
        return new ViewElement(name, ElementType.PLAIN, 0);
    }

    public static ViewElement container(String name) {
        return new ViewElement(name, ElementType.CONTAINER, 0);
    }

    public static ViewElement attribute(String name) {
        return attribute(name, DEFAULT_PRIORITY);
    }

    public static ViewElement attribute(String name, int priority) {
        return new ViewElement(name, ElementType.ATTRIBUTE, priority);
    }

    /**
     * Creates an element of the given type. The priority is used by attribute elements only and
     * defaults to {@link #DEFAULT_PRIORITY} when absent.
     *
     * @param type element type
     * @param name element name
     * @param priority optional priority
     * @return new detached element
     */
    public static ViewElement of(ElementType type, String name, OptionalInt priority) {
        return switch (type) {
            case PLAIN -> plain(name);
            case CONTAINER -> container(name);
            case ATTRIBUTE -> attribute(name, priority.orElse(DEFAULT_PRIORITY));
        };
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ELEMENT;
    }

    public String name() {
        return name;
    }

    public ElementType type() {
        return type;
    }

    /**
     * Returns the priority of an attribute element.
     *
     * @return priority, empty for plain and container elements
     */
    public OptionalInt priority() {
        return type == ElementType.ATTRIBUTE ? OptionalInt.of(priority) : OptionalInt.empty();
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<String> getAttribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public ViewElement setAttribute(String key, String value) {
        attributes.put(requireValidName(key, "Attribute name", false),
            Objects.requireNonNull(value, "Attribute value cannot be null"));
        return this;
    }

    @Override
    public List<ViewNode> children() {
        return children.asList();
    }

    public ViewNode child(int index) {
        return children.asList().get(index);
    }

    public int childCount() {
        return children.size();
    }

    @Override
    public int maxOffset() {
        return children.size();
    }

    /**
     * Appends nodes at the end of this element.
     *
     * @param nodes detached nodes to append
     * @return this element
     * @throws IllegalStateException when a node already has a parent
     */
    public ViewElement appendChildren(ViewNode... nodes) {
        for (ViewNode node : nodes) {
            children.append(node);
        }
        return this;
    }

    public boolean removeChild(ViewNode node) {
        return children.remove(node);
    }

    @Override
    public boolean sameStructureAs(ViewNode other) {
        return other instanceof ViewElement element
            && name.equals(element.name)
            && type == element.type
            && priority().equals(element.priority())
            && attributes.equals(element.attributes)
            && children.sameStructureAs(element.children());
    }

    @Override
    public String toString() {
        return "ViewElement{" + type + ":" + name + ", attributes=" + attributes + ", children=" + children.size() + "}";
    }

    /**
     * Tag names open with an ASCII letter and carry no colon, which separates type tag segments.
     * Attribute names open with a letter or {@code _} and may be namespaced.
     */
    private static String requireValidName(String candidate, String label, boolean isTagName) {
        if (candidate == null || candidate.isEmpty()) {
            throw new IllegalArgumentException(label + " cannot be empty");
        }
        char first = candidate.charAt(0);
        boolean validStart = isTagName
            ? (first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z')
            : Character.isLetter(first) || first == '_';
        if (!validStart) {
            throw new IllegalArgumentException(label + " starts with an illegal character: " + candidate);
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (Character.isWhitespace(c) || (c == ':' && isTagName) || c == '<' || c == '>' || c == '/'
                || c == '"' || c == '\'' || c == '=') {
                throw new IllegalArgumentException(label + " contains an illegal character: " + candidate);
            }
        }
        return candidate;
    }
}
