package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Thrown when range start and end markers do not pair up: an end without a start, a start while
 * another range is open, or a start that is never closed.
 */
public class UnbalancedRangeException extends ViewMarkupException {

    private final char token;
    private final int markerIndex;

    /**
     * Creates an unbalanced range exception.
     *
     * @param message failure summary
     * @param token marker character that broke the pairing
     * @param markerIndex index of that marker among all markers found, in document order
     */
    public UnbalancedRangeException(String message, char token, int markerIndex) {
        super(message);
        this.token = token;
        this.markerIndex = markerIndex;
    }

    public char getToken() {
        return token;
    }

    public int getMarkerIndex() {
        return markerIndex;
    }
}
