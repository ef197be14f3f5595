package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.view.Position;
import com.williamcallahan.viewmarkup.domain.view.Range;
import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;
import com.williamcallahan.viewmarkup.domain.view.ViewText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a view tree as markup, interleaving range markers at their positions.
 *
 * <p>At every offset closing markers come first, then collapsed pairs, then opening markers, so
 * that adjacent ranges never interleave when read back. Attributes are written in insertion order.
 * The tree and the selection are only read.
 *
 * <p>Input that would not parse back to the same tree and ranges is rejected up front: reversed or
 * overlapping ranges, text containing marker characters, and markers next to whitespace-only text.
 */
final class ViewStringifier {

    private static final Comparator<List<Integer>> DOCUMENT_ORDER = ViewStringifier::compareDocumentOrder;

    private final ViewNode root;
    private final List<Range> ranges;
    private final StringifyOptions options;

    ViewStringifier(ViewNode root, Selection selection, StringifyOptions options) {
        this.root = Objects.requireNonNull(root, "Root node cannot be null");
        this.ranges = selection == null ? List.of() : selection.ranges();
        this.options = Objects.requireNonNull(options, "Stringify options cannot be null");
        for (Range range : ranges) {
            requireInsideRoot(range.start());
            requireInsideRoot(range.end());
        }
        requireOrderedAndDisjoint(ranges);
    }

    String stringify() {
        return render(root);
    }

    private String render(ViewNode node) {
        return switch (node.nodeType()) {
            case TEXT -> renderText((ViewText) node);
            case ELEMENT -> renderElement((ViewElement) node);
            case FRAGMENT -> renderChildren(node);
        };
    }

    private String renderElement(ViewElement element) {
        StringBuilder output = new StringBuilder();
        TypeTag tag = TypeTag.of(element);
        String tagName = tag.encode(options.showType(), options.showPriority());
        output.append('<').append(tagName);
        for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
            output.append(' ').append(attribute.getKey()).append("=\"");
            appendEscaped(attribute.getValue(), output);
            output.append('"');
        }
        output.append('>');
        output.append(renderChildren(element));
        output.append("</").append(tagName).append('>');
        return output.toString();
    }

    private String renderChildren(ViewNode container) {
        StringBuilder output = new StringBuilder();
        List<ViewNode> children = container.children();
        appendElementMarkers(container, 0, output);
        for (int offset = 0; offset < children.size(); offset++) {
            output.append(render(children.get(offset)));
            appendElementMarkers(container, offset + 1, output);
        }
        return output.toString();
    }

    private void appendElementMarkers(ViewNode container, int offset, StringBuilder output) {
        StringBuilder ends = new StringBuilder();
        StringBuilder collapsed = new StringBuilder();
        StringBuilder starts = new StringBuilder();
        for (Range range : ranges) {
            if (range.isCollapsed()) {
                if (isAt(range.start(), container, offset)) {
                    collapsed.append(BoundaryToken.ELEMENT_START.collapsedPair());
                }
                continue;
            }
            if (isAt(range.end(), container, offset)) {
                ends.append(BoundaryToken.ELEMENT_END.symbol());
            }
            if (isAt(range.start(), container, offset)) {
                starts.append(BoundaryToken.ELEMENT_START.symbol());
            }
        }
        if (ends.length() + collapsed.length() + starts.length() > 0) {
            requireNoBlankTextAround(container, offset);
        }
        output.append(ends).append(collapsed).append(starts);
    }

    private String renderText(ViewText text) {
        StringBuilder output = new StringBuilder();
        String data = text.data();
        int length = data.length();
        for (int i = 0; i < length; i++) {
            if (BoundaryToken.fromSymbol(data.charAt(i)).isPresent()) {
                throw new IllegalArgumentException("Text contains range delimiter '" + data.charAt(i)
                    + "' at offset " + i + " and cannot be written as markup: " + text);
            }
        }
        StringBuilder[] ends = new StringBuilder[length + 1];
        StringBuilder[] collapsed = new StringBuilder[length + 1];
        StringBuilder[] starts = new StringBuilder[length + 1];

        for (Range range : ranges) {
            if (range.isCollapsed()) {
                if (range.start().parent() == text) {
                    markerSlot(collapsed, range.start().offset()).append(BoundaryToken.TEXT_START.collapsedPair());
                }
                continue;
            }
            if (range.end().parent() == text) {
                markerSlot(ends, range.end().offset()).append(BoundaryToken.TEXT_END.symbol());
            }
            if (range.start().parent() == text) {
                markerSlot(starts, range.start().offset()).append(BoundaryToken.TEXT_START.symbol());
            }
        }

        if (data.isBlank() && hasAny(ends, collapsed, starts)) {
            throw new IllegalArgumentException("Range boundary inside whitespace-only text cannot be written as markup: "
                + text);
        }
        for (int offset = 0; offset <= length; offset++) {
            appendIfPresent(ends[offset], output);
            appendIfPresent(collapsed[offset], output);
            appendIfPresent(starts[offset], output);
            if (offset < length) {
                appendEscaped(data.charAt(offset), output);
            }
        }
        return output.toString();
    }

    private void requireInsideRoot(Position position) {
        if (!position.parent().isInside(root)) {
            throw new IllegalArgumentException("Range position " + position.path()
                + " is not contained in the stringified root " + root);
        }
        if (position.offset() > position.parent().maxOffset()) {
            throw new IllegalArgumentException("Range position offset " + position.offset()
                + " is out of bounds [0, " + position.parent().maxOffset() + "] for " + position.parent());
        }
    }

    /**
     * Markers are read back as a flat stream in which at most one range is open, so every range
     * must start before it ends and must end before the next one starts.
     */
    private static void requireOrderedAndDisjoint(List<Range> ranges) {
        List<Range> byStart = new ArrayList<>(ranges.size());
        for (Range range : ranges) {
            if (DOCUMENT_ORDER.compare(range.start().path(), range.end().path()) > 0) {
                throw new IllegalArgumentException("Range starts after it ends: " + range.start().path()
                    + " > " + range.end().path());
            }
            byStart.add(range);
        }
        byStart.sort(Comparator.comparing((Range range) -> range.start().path(), DOCUMENT_ORDER)
            .thenComparing(range -> range.end().path(), DOCUMENT_ORDER));
        for (int i = 1; i < byStart.size(); i++) {
            List<Integer> previousEnd = byStart.get(i - 1).end().path();
            List<Integer> nextStart = byStart.get(i).start().path();
            if (DOCUMENT_ORDER.compare(previousEnd, nextStart) > 0) {
                throw new IllegalArgumentException("Ranges overlap: one ends at " + previousEnd
                    + " after the next starts at " + nextStart);
            }
        }
    }

    /**
     * Orders index paths as their positions appear in markup. A path that is a prefix of another
     * denotes a container position just before the subtree the longer path points into.
     */
    private static int compareDocumentOrder(List<Integer> first, List<Integer> second) {
        int shared = Math.min(first.size(), second.size());
        for (int i = 0; i < shared; i++) {
            int compared = Integer.compare(first.get(i), second.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return Integer.compare(first.size(), second.size());
    }

    private static void requireNoBlankTextAround(ViewNode container, int offset) {
        List<ViewNode> children = container.children();
        boolean blankBefore = offset > 0 && isBlankText(children.get(offset - 1));
        boolean blankAfter = offset < children.size() && isBlankText(children.get(offset));
        if (blankBefore || blankAfter) {
            throw new IllegalArgumentException("Range boundary next to whitespace-only text cannot be written as markup: "
                + container + " offset " + offset);
        }
    }

    private static boolean isBlankText(ViewNode node) {
        return node instanceof ViewText text && text.data().isBlank();
    }

    private static boolean hasAny(StringBuilder[]... slotGroups) {
        for (StringBuilder[] slots : slotGroups) {
            for (StringBuilder slot : slots) {
                if (slot != null) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isAt(Position position, ViewNode container, int offset) {
        return position.parent() == container && position.offset() == offset;
    }

    private static StringBuilder markerSlot(StringBuilder[] slots, int offset) {
        if (slots[offset] == null) {
            slots[offset] = new StringBuilder(2);
        }
        return slots[offset];
    }

    private static void appendIfPresent(StringBuilder markers, StringBuilder output) {
        if (markers != null) {
            output.append(markers);
        }
    }

    private static void appendEscaped(String value, StringBuilder output) {
        for (int i = 0; i < value.length(); i++) {
            appendEscaped(value.charAt(i), output);
        }
    }

    private static void appendEscaped(char c, StringBuilder output) {
        switch (c) {
            case '&' -> output.append("&amp;");
            case '<' -> output.append("&lt;");
            case '>' -> output.append("&gt;");
            case '"' -> output.append("&quot;");
            case '\'' -> output.append("&#39;");
            default -> output.append(c);
        }
    }
}
