package com.williamcallahan.viewmarkup.domain.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a range order entry is missing, out of range or repeats an earlier entry.
 */
public class InvalidRangeOrderException extends ViewMarkupException {

    private final List<Integer> order;
    private final int entryIndex;

    public InvalidRangeOrderException(List<Integer> order, int entryIndex) {
        super("Provided ranges order is invalid: entry " + entryIndex + " of " + order);
        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.entryIndex = entryIndex;
    }

    public List<Integer> getOrder() {
        return order;
    }

    public int getEntryIndex() {
        return entryIndex;
    }
}
