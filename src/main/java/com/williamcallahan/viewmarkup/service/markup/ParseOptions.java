package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.InvalidRangeOrderException;

import java.util.List;

/**
 * Options for {@link ViewMarkupService#parse}.
 *
 * @param order 1-based target index of each range in document order, empty to keep document order;
 *     a null entry raises {@link InvalidRangeOrderException}
 * @param lastRangeBackward mark the last range of the parsed selection as backward
 */
public record ParseOptions(List<Integer> order, boolean lastRangeBackward) {

    public static final ParseOptions DEFAULTS = new ParseOptions(List.of(), false);

    public ParseOptions {
        if (order == null) {
            order = List.of();
        }
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i) == null) {
                throw new InvalidRangeOrderException(order, i);
            }
        }
        order = List.copyOf(order);
    }

    public static ParseOptions withOrder(Integer... order) {
        return new ParseOptions(List.of(order), false);
    }
}
