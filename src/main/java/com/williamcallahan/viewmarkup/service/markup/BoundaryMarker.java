package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.view.Position;

/**
 * Range marker found in text, resolved to a position of the parsed tree.
 *
 * @param token marker found; the opening token for a collapsed pair
 * @param collapsed whether the marker was an adjacent opening and closing pair
 * @param position resolved position
 */
record BoundaryMarker(BoundaryToken token, boolean collapsed, Position position) {
}
