package com.williamcallahan.viewmarkup.domain.markup;

/**
 * Generic tree produced by a markup tokenizer, before element tags are interpreted as view types.
 */
public sealed interface MarkupNode permits MarkupFragment, MarkupElement, MarkupText {
}
