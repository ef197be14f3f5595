package com.williamcallahan.viewmarkup.domain.errors;

/**
 * Thrown when a tag name is not a valid type tag ({@code name}, {@code type:name}, {@code name:priority}
 * or {@code type:name:priority}).
 */
public class TagGrammarException extends ViewMarkupException {

    private final String rawTag;

    public TagGrammarException(String rawTag) {
        super("Cannot parse element's tag name: " + rawTag);
        this.rawTag = rawTag;
    }

    public String getRawTag() {
        return rawTag;
    }
}
