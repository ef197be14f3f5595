package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Thrown when a range marker sits where no position can be derived from it: an element marker
 * strictly inside text, or a text marker in text that is empty once markers are removed.
 */
public class MarkerPlacementException extends ViewMarkupException {

    private final char token;
    private final int textOffset;

    public MarkerPlacementException(String message, char token, int textOffset) {
        super(message);
        this.token = token;
        this.textOffset = textOffset;
    }

    public char getToken() {
        return token;
    }

    /**
     * Returns the offset of the marker in the text once all markers are removed.
     *
     * @return character offset
     */
    public int getTextOffset() {
        return textOffset;
    }
}
