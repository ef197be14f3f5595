package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.markup.MarkupFragment;

/**
 * Turns raw markup into a generic element/text tree. Tag names are returned unchanged so the
 * view codec can interpret type tags itself.
 */
public interface MarkupTokenizer {

    /**
     * Tokenizes markup.
     *
     * @param markup raw markup
     * @return top-level nodes in document order
     */
    MarkupFragment tokenize(String markup);
}
