package com.williamcallahan.viewmarkup.web;

/**
 * Markup parsed and written back with the requested display options.
 *
 * @param status fixed status indicator ("success")
 * @param markup normalized markup
 * @param rangeCount number of ranges recovered
 * @param backward whether the recovered selection is backward
 */
public record NormalizedMarkupResponse(String status, String markup, int rangeCount, boolean backward)
    implements ApiResponse {

    public static NormalizedMarkupResponse success(String markup, int rangeCount, boolean backward) {
        return new NormalizedMarkupResponse("success", markup, rangeCount, backward);
    }
}
