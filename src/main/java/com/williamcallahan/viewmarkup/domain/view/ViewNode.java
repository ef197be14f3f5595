package com.williamcallahan.viewmarkup.domain.view;

import java.util.List;
import java.util.Optional;

/**
 * Node of the typed view tree: a fragment, an element or a text.
 *
 * <p>Containers own their children exclusively. Every node keeps a non-owning back-reference to
 * its parent, used to compute indices and position paths. Identity is reference identity; use
 * {@link #sameStructureAs(ViewNode)} for deep structural comparison.
 */
public abstract sealed class ViewNode permits ViewFragment, ViewElement, ViewText {

    private ViewNode parent;

    ViewNode() {
    }

    /**
     * Returns the variant of this node.
     *
     * @return node type
     */
    public abstract NodeType nodeType();

    /**
     * Returns the children of this node. Always empty for text nodes.
     *
     * @return unmodifiable child list
     */
    public abstract List<ViewNode> children();

    /**
     * Returns the largest valid offset inside this node: the child count for containers and the
     * data length for text nodes.
     *
     * @return maximum offset
     */
    public abstract int maxOffset();

    /**
     * Compares this subtree with another one by kind, name, type, priority, attributes, child
     * order and text content.
     *
     * @param other node to compare with
     * @return true when both subtrees are structurally equal
     */
    public abstract boolean sameStructureAs(ViewNode other);

    public Optional<ViewNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Returns the index of this node among its siblings.
     *
     * @return index in the parent, or -1 for a detached node
     */
    public int index() {
        if (parent == null) {
            return -1;
        }
        List<ViewNode> siblings = parent.children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        throw new IllegalStateException("Node is not listed among its parent's children");
    }

    /**
     * Returns the topmost ancestor of this node, or the node itself when detached.
     *
     * @return tree root
     */
    public ViewNode root() {
        ViewNode current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * Checks whether this node is {@code ancestor} or lies in its subtree.
     *
     * @param ancestor candidate ancestor
     * @return true when this node is inside the given subtree
     */
    public boolean isInside(ViewNode ancestor) {
        for (ViewNode current = this; current != null; current = current.parent) {
            if (current == ancestor) {
                return true;
            }
        }
        return false;
    }

    void attachTo(ViewNode newParent) {
        if (parent != null) {
            throw new IllegalStateException("Node already belongs to another parent");
        }
        parent = newParent;
    }

    void detach() {
        parent = null;
    }
}
