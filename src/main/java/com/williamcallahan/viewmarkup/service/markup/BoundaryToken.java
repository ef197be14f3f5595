package com.williamcallahan.viewmarkup.service.markup;

import java.util.Optional;

/**
 * Fixed range marker alphabet. Element markers denote positions between nodes, text markers denote
 * character offsets inside a text node.
 */
enum BoundaryToken {
    ELEMENT_START('['),
    ELEMENT_END(']'),
    TEXT_START('{'),
    TEXT_END('}');

    private final char symbol;

    BoundaryToken(char symbol) {
        this.symbol = symbol;
    }

    char symbol() {
        return symbol;
    }

    boolean isStart() {
        return this == ELEMENT_START || this == TEXT_START;
    }

    boolean isTextToken() {
        return this == TEXT_START || this == TEXT_END;
    }

    BoundaryToken closing() {
        return switch (this) {
            case ELEMENT_START, ELEMENT_END -> ELEMENT_END;
            case TEXT_START, TEXT_END -> TEXT_END;
        };
    }

    String collapsedPair() {
        BoundaryToken opening = isTextToken() ? TEXT_START : ELEMENT_START;
        return "" + opening.symbol + opening.closing().symbol;
    }

    static Optional<BoundaryToken> fromSymbol(char candidate) {
        for (BoundaryToken token : values()) {
            if (token.symbol == candidate) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
