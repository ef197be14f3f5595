package com.williamcallahan.viewmarkup.domain.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered child list shared by fragments and elements. Keeps parent back-references in sync.
 */
final class ChildNodes {

    private final ViewNode owner;
    private final List<ViewNode> nodes = new ArrayList<>();
    private final List<ViewNode> view = Collections.unmodifiableList(nodes);

    ChildNodes(ViewNode owner) {
        this.owner = owner;
    }

    List<ViewNode> asList() {
        return view;
    }

    int size() {
        return nodes.size();
    }

    void append(ViewNode child) {
        if (child == null) {
            throw new IllegalArgumentException("Child node cannot be null");
        }
        if (owner.isInside(child)) {
            throw new IllegalArgumentException("Cannot append a node to its own subtree");
        }
        child.attachTo(owner);
        nodes.add(child);
    }

    boolean remove(ViewNode child) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == child) {
                nodes.remove(i);
                child.detach();
                return true;
            }
        }
        return false;
    }

    boolean sameStructureAs(List<ViewNode> others) {
        if (nodes.size() != others.size()) {
            return false;
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (!nodes.get(i).sameStructureAs(others.get(i))) {
                return false;
            }
        }
        return true;
    }
}
