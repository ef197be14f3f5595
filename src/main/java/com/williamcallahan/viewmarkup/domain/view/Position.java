package com.williamcallahan.viewmarkup.domain.view;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Location in a view tree.
 *
 * <p>Inside a fragment or element the offset is a child index (the position sits before that
 * child). Inside a text node it is a character boundary. Equality compares the owning node by
 * identity, so two positions are equal only when they point into the same tree.
 *
 * @param parent owning node
 * @param offset child index or character offset
 */
public record Position(ViewNode parent, int offset) {

    public Position {
        Objects.requireNonNull(parent, "Position parent cannot be null");
        if (offset < 0 || offset > parent.maxOffset()) {
            throw new IllegalArgumentException(
                "Offset " + offset + " is out of bounds [0, " + parent.maxOffset() + "] for " + parent);
        }
    }

    public ViewNode root() {
        return parent.root();
    }

    /**
     * Returns the index path from the tree root to this position: the index of each ancestor below
     * the root followed by the offset. Two positions in structurally equal trees have equal paths.
     *
     * @return index path
     */
    public List<Integer> path() {
        Deque<Integer> path = new ArrayDeque<>();
        path.addFirst(offset);
        for (ViewNode node = parent; node.parent().isPresent(); node = node.parent().get()) {
            path.addFirst(node.index());
        }
        return List.copyOf(path);
    }

    /**
     * Checks whether both positions point to the same offset of the same node.
     *
     * @param other position to compare with, may be null
     * @return true for the same node and offset
     */
    public boolean isEqual(Position other) {
        return equals(other);
    }
}
