package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.TagGrammarException;
import com.williamcallahan.viewmarkup.domain.markup.MarkupElement;
import com.williamcallahan.viewmarkup.domain.markup.MarkupFragment;
import com.williamcallahan.viewmarkup.domain.markup.MarkupNode;
import com.williamcallahan.viewmarkup.domain.markup.MarkupText;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;
import com.williamcallahan.viewmarkup.domain.view.ViewFragment;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;

import java.util.List;
import java.util.Map;

/**
 * Builds a fresh view tree from a tokenized markup tree.
 *
 * <p>A fragment holding a single element collapses to that element. Tags are decoded with
 * {@link TypeTag}, attributes are copied in declaration order and text goes through the
 * {@link BracketScanner}, which strips range markers as nodes are appended. The markup tree is
 * never modified.
 */
final class ViewTreeBuilder {

    private final BracketScanner scanner;

    ViewTreeBuilder(BracketScanner scanner) {
        this.scanner = scanner;
    }

    ViewNode build(MarkupFragment fragment) {
        List<MarkupNode> children = fragment.children();
        if (children.size() == 1 && children.get(0) instanceof MarkupElement single) {
            return convertElement(single);
        }
        ViewFragment root = new ViewFragment();
        appendConverted(root, children);
        return root;
    }

    private ViewElement convertElement(MarkupElement markupElement) {
        ViewElement element = createElement(markupElement.tagName());
        for (Map.Entry<String, String> attribute : markupElement.attributes().entrySet()) {
            element.setAttribute(attribute.getKey(), attribute.getValue());
        }
        appendConverted(element, markupElement.children());
        return element;
    }

    private void appendConverted(ViewNode parent, List<MarkupNode> children) {
        for (MarkupNode child : children) {
            if (child instanceof MarkupElement markupElement) {
                append(parent, convertElement(markupElement));
            } else if (child instanceof MarkupText markupText) {
                scanner.consumeText(markupText.content(), parent, node -> append(parent, node));
            } else if (child instanceof MarkupFragment nested) {
                appendConverted(parent, nested.children());
            }
        }
    }

    private static ViewElement createElement(String rawTag) {
        TypeTag tag = TypeTag.parse(rawTag);
        try {
            return tag.toElement();
        } catch (IllegalArgumentException invalidName) {
            throw new TagGrammarException(rawTag);
        }
    }

    private static void append(ViewNode parent, ViewNode child) {
        switch (parent.nodeType()) {
            case FRAGMENT -> ((ViewFragment) parent).appendChildren(child);
            case ELEMENT -> ((ViewElement) parent).appendChildren(child);
            case TEXT -> throw new IllegalStateException("Text nodes cannot have children");
        }
    }
}
