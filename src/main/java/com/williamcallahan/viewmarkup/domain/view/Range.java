package com.williamcallahan.viewmarkup.domain.view;

import java.util.Objects;

/**
 * Span between two positions of the same tree.
 *
 * @param start start boundary
 * @param end end boundary
 */
public record Range(Position start, Position end) {

    public Range {
        Objects.requireNonNull(start, "Range start cannot be null");
        Objects.requireNonNull(end, "Range end cannot be null");
        if (start.root() != end.root()) {
            throw new IllegalArgumentException("Range boundaries belong to different trees");
        }
    }

    /**
     * Creates a collapsed range at the given position.
     *
     * @param position both boundaries
     * @return collapsed range
     */
    public static Range collapsedAt(Position position) {
        return new Range(position, position);
    }

    public static Range fromParentsAndOffsets(ViewNode startParent, int startOffset, ViewNode endParent, int endOffset) {
        return new Range(new Position(startParent, startOffset), new Position(endParent, endOffset));
    }

    public boolean isCollapsed() {
        return start.equals(end);
    }

    /**
     * Compares two ranges by boundary index paths, so ranges from structurally equal trees match.
     *
     * @param other range to compare with
     * @return true when both boundaries resolve to the same paths
     */
    public boolean hasSamePathsAs(Range other) {
        return start.path().equals(other.start.path())
            && end.path().equals(other.end.path())
            && isCollapsed() == other.isCollapsed();
    }
}
