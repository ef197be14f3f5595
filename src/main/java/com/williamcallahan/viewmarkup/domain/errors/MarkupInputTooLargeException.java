package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Thrown when markup exceeds the configured maximum input length.
 */
public class MarkupInputTooLargeException extends ViewMarkupException {

    private final int length;
    private final int limit;

    public MarkupInputTooLargeException(int length, int limit) {
        super("Markup input exceeds maximum length: " + length + " > " + limit);
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
