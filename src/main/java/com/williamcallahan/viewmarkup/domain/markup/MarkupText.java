package com.williamcallahan.viewmarkup.domain.markup;

import java.util.Objects;

/**
 * Tokenized character data with entities already decoded.
 *
 * @param content text content, range markers included
 */
public record MarkupText(String content) implements MarkupNode {

    public MarkupText {
        Objects.requireNonNull(content, "Text content cannot be null");
    }
}
