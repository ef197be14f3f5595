package com.williamcallahan.viewmarkup.domain.markup;

import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;

import java.util.Objects;

/**
 * Result of parsing view markup. Markup without range markers yields {@link TreeOnly}; markup with at
 * least one range yields {@link WithSelection}.
 */
public sealed interface ParsedView {

    /**
     * Returns the parsed root node.
     *
     * @return root of the parsed tree
     */
    ViewNode view();

    /**
     * Parsed tree without any range markers.
     *
     * @param view root of the parsed tree
     */
    record TreeOnly(ViewNode view) implements ParsedView {

        public TreeOnly {
            Objects.requireNonNull(view, "Parsed view cannot be null");
        }
    }

    /**
     * Parsed tree with the selection recovered from its range markers.
     *
     * @param view root of the parsed tree
     * @param selection recovered ranges, never empty
     */
    record WithSelection(ViewNode view, Selection selection) implements ParsedView {

        public WithSelection {
            Objects.requireNonNull(view, "Parsed view cannot be null");
            Objects.requireNonNull(selection, "Parsed selection cannot be null");
        }
    }
}
