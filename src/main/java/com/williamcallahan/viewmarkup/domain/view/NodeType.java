package com.williamcallahan.viewmarkup.domain.view;

/**
 * Closed set of view node variants.
 *
 * <p>Traversals switch over this enum with switch expressions so that adding a variant fails
 * compilation at every site that has not been updated.
 */
public enum NodeType {
    FRAGMENT,
    ELEMENT,
    TEXT
}
