package com.williamcallahan.viewmarkup.domain.view;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered ranges plus the direction of the last one.
 *
 * @param ranges ranges in selection order
 * @param lastRangeBackward whether the last range was made from its end towards its start
 */
public record Selection(List<Range> ranges, boolean lastRangeBackward) {

    public Selection {
        Objects.requireNonNull(ranges, "Selection ranges cannot be null");
        ranges = List.copyOf(ranges);
    }

    public static Selection of(Range... ranges) {
        return new Selection(List.of(ranges), false);
    }

    public int rangeCount() {
        return ranges.size();
    }

    public Optional<Range> firstRange() {
        return ranges.isEmpty() ? Optional.empty() : Optional.of(ranges.get(0));
    }

    public Optional<Range> lastRange() {
        return ranges.isEmpty() ? Optional.empty() : Optional.of(ranges.get(ranges.size() - 1));
    }

    /**
     * A selection is backward only when it has ranges and its last range is backward.
     *
     * @return true for a non-empty backward selection
     */
    public boolean isBackward() {
        return lastRangeBackward && !ranges.isEmpty();
    }

    /**
     * Returns where the selection was started: the end of the last range when backward, its start
     * otherwise.
     *
     * @return anchor position, empty for an empty selection
     */
    public Optional<Position> anchor() {
        return lastRange().map(range -> isBackward() ? range.end() : range.start());
    }

    /**
     * Returns where the selection was finished, the opposite boundary of {@link #anchor()}.
     *
     * @return focus position, empty for an empty selection
     */
    public Optional<Position> focus() {
        return lastRange().map(range -> isBackward() ? range.start() : range.end());
    }

    /**
     * Compares two selections range by range using boundary index paths and the direction flag.
     *
     * @param other selection to compare with
     * @return true when both selections resolve to the same ranges
     */
    public boolean hasSamePathsAs(Selection other) {
        if (ranges.size() != other.ranges.size() || isBackward() != other.isBackward()) {
            return false;
        }
        for (int i = 0; i < ranges.size(); i++) {
            if (!ranges.get(i).hasSamePathsAs(other.ranges.get(i))) {
                return false;
            }
        }
        return true;
    }
}
