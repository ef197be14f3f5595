package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.InvalidRangeOrderException;
import com.williamcallahan.viewmarkup.domain.errors.RangeCountMismatchException;
import com.williamcallahan.viewmarkup.domain.errors.UnbalancedRangeException;
import com.williamcallahan.viewmarkup.domain.view.Position;
import com.williamcallahan.viewmarkup.domain.view.Range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pairs boundary markers into ranges. At most one range may be open at a time, so ranges never
 * nest or overlap.
 */
final class RangeBuilder {

    private RangeBuilder() {
    }

    /**
     * Builds ranges from markers in document order.
     *
     * @param markers markers as recorded by the scanner
     * @return ranges in document order
     * @throws UnbalancedRangeException for an end without a start, a start inside an open range or
     *     a range left open
     */
    static List<Range> build(List<BoundaryMarker> markers) {
        List<Range> ranges = new ArrayList<>();
        Slot slot = Slot.EMPTY;

        for (int i = 0; i < markers.size(); i++) {
            BoundaryMarker marker = markers.get(i);
            char symbol = marker.token().symbol();

            if (marker.collapsed() || marker.token().isStart()) {
                if (slot instanceof Open) {
                    throw new UnbalancedRangeException("Start of range was found '" + symbol
                        + "' but one range is already started. Nested ranges are not permitted.", symbol, i);
                }
                if (marker.collapsed()) {
                    ranges.add(Range.collapsedAt(marker.position()));
                } else {
                    slot = new Open(marker.position());
                }
                continue;
            }

            if (!(slot instanceof Open open)) {
                throw new UnbalancedRangeException("End of range was found '" + symbol
                    + "' but range was not started before.", symbol, i);
            }
            ranges.add(new Range(open.start(), marker.position()));
            slot = Slot.EMPTY;
        }

        if (slot instanceof Open) {
            BoundaryMarker last = markers.get(markers.size() - 1);
            throw new UnbalancedRangeException("Range was started but no end delimiter was found.",
                last.token().symbol(), markers.size() - 1);
        }
        return ranges;
    }

    /**
     * Moves each range to its requested place. {@code order.get(i)} is the 1-based target index of
     * the i-th range in document order.
     *
     * @param ranges ranges in document order
     * @param order target indices, empty to keep document order
     * @return reordered ranges
     * @throws RangeCountMismatchException when the order does not have one entry per range
     * @throws InvalidRangeOrderException when an entry is out of bounds or repeated
     */
    static List<Range> reorder(List<Range> ranges, List<Integer> order) {
        if (order.isEmpty()) {
            return ranges;
        }
        if (order.size() != ranges.size()) {
            throw new RangeCountMismatchException(ranges.size(), order.size());
        }

        Range[] sorted = new Range[ranges.size()];
        for (int i = 0; i < order.size(); i++) {
            int target = order.get(i) - 1;
            if (target < 0 || target >= sorted.length || sorted[target] != null) {
                throw new InvalidRangeOrderException(order, i);
            }
            sorted[target] = ranges.get(i);
        }
        return Arrays.asList(sorted);
    }

    private sealed interface Slot permits Empty, Open {
        Slot EMPTY = new Empty();
    }

    private record Empty() implements Slot {
    }

    private record Open(Position start) implements Slot {
    }
}
