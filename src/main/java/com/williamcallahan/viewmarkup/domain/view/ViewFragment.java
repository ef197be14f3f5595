package com.williamcallahan.viewmarkup.domain.view;

import java.util.List;

/**
 * Unnamed ordered sequence of nodes, used as root when markup has no single top-level element.
 */
public final class ViewFragment extends ViewNode {

    private final ChildNodes children = new ChildNodes(this);

    public ViewFragment(ViewNode... nodes) {
        appendChildren(nodes);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.FRAGMENT;
    }

    @Override
    public List<ViewNode> children() {
        return children.asList();
    }

    @Override
    public int maxOffset() {
        return children.size();
    }

    public ViewNode child(int index) {
        return children.asList().get(index);
    }

    public int childCount() {
        return children.size();
    }

    /**
     * Appends nodes at the end of this fragment.
     *
     * @param nodes detached nodes to append
     * @return this fragment
     * @throws IllegalStateException when a node already has a parent
     */
    public ViewFragment appendChildren(ViewNode... nodes) {
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
        return other instanceof ViewFragment fragment && children.sameStructureAs(fragment.children());
    }

    @Override
    public String toString() {
        return "ViewFragment{children=" + children.size() + "}";
    }
}
