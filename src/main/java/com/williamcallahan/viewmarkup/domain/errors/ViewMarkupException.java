package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Signals markup that cannot be converted to a view tree. Malformed input is a caller error, so
 * these failures are never retried.
 */
public class ViewMarkupException extends IllegalArgumentException {

    /**
     * Creates a view markup exception with a diagnostic message.
     *
     * @param message failure summary
     */
    public ViewMarkupException(String message) {
        super(message);
    }
}
