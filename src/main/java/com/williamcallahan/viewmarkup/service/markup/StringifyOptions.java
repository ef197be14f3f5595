package com.williamcallahan.viewmarkup.service.markup;

/**
 * Display options for {@link ViewMarkupService#stringify}.
 *
 * @param showType write element types as tag prefixes ({@code <container:p>})
 * @param showPriority write attribute element priorities as tag suffixes ({@code <b:20>})
 */
public record StringifyOptions(boolean showType, boolean showPriority) {

    /**
     * Bare element names, the human-readable default.
     */
    public static final StringifyOptions DEFAULTS = new StringifyOptions(false, false);

    /**
     * Full type and priority information, the form that parses back into an equal tree.
     */
    public static final StringifyOptions LOSSLESS = new StringifyOptions(true, true);
}
