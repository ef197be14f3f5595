package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Thrown when a requested range order does not list exactly one entry per range found.
 */
public class RangeCountMismatchException extends ViewMarkupException {

    private final int rangesFound;
    private final int orderLength;

    public RangeCountMismatchException(int rangesFound, int orderLength) {
        super("There are " + rangesFound + " ranges found, but ranges order array contains "
            + orderLength + " elements.");
        this.rangesFound = rangesFound;
        this.orderLength = orderLength;
    }

    public int getRangesFound() {
        return rangesFound;
    }

    public int getOrderLength() {
        return orderLength;
    }
}
