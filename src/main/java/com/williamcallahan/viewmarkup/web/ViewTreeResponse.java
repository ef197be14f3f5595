package com.williamcallahan.viewmarkup.web;

import com.williamcallahan.viewmarkup.domain.markup.ParsedView;
import com.williamcallahan.viewmarkup.domain.view.Range;
import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;
import com.williamcallahan.viewmarkup.domain.view.ViewText;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON description of a parsed view tree and its ranges.
 *
 * @param status fixed status indicator ("success")
 * @param root parsed root node
 * @param ranges recovered ranges as index paths from the root
 * @param backward whether the recovered selection is backward
 */
public record ViewTreeResponse(String status, NodeDescriptor root, List<RangeDescriptor> ranges, boolean backward)
    implements ApiResponse {

    public static ViewTreeResponse from(ParsedView parsed) {
        NodeDescriptor root = NodeDescriptor.from(parsed.view());
        if (parsed instanceof ParsedView.WithSelection withSelection) {
            Selection selection = withSelection.selection();
            List<RangeDescriptor> ranges = selection.ranges().stream().map(RangeDescriptor::from).toList();
            return new ViewTreeResponse("success", root, ranges, selection.isBackward());
        }
        return new ViewTreeResponse("success", root, List.of(), false);
    }

    /**
     * One node of the described tree. Fields that do not apply to the node type are null.
     *
     * @param nodeType fragment, element or text
     * @param name element name
     * @param elementType element type
     * @param priority attribute element priority
     * @param attributes element attributes in declaration order
     * @param data text content
     * @param children child nodes
     */
    public record NodeDescriptor(
        String nodeType,
        String name,
        String elementType,
        Integer priority,
        Map<String, String> attributes,
        String data,
        List<NodeDescriptor> children
    ) {

        static NodeDescriptor from(ViewNode node) {
            List<NodeDescriptor> children = node.children().stream().map(NodeDescriptor::from).toList();
            return switch (node.nodeType()) {
                case FRAGMENT -> new NodeDescriptor("fragment", null, null, null, null, null, children);
                case ELEMENT -> {
                    ViewElement element = (ViewElement) node;
                    Integer priority = element.priority().isPresent() ? element.priority().getAsInt() : null;
                    yield new NodeDescriptor("element", element.name(), element.type().name().toLowerCase(Locale.ROOT),
                        priority, element.attributes(), null, children);
                }
                case TEXT -> new NodeDescriptor("text", null, null, null, null, ((ViewText) node).data(), null);
            };
        }
    }

    /**
     * Range boundaries as index paths.
     *
     * @param start start path
     * @param end end path
     * @param collapsed whether both boundaries coincide
     */
    public record RangeDescriptor(List<Integer> start, List<Integer> end, boolean collapsed) {

        static RangeDescriptor from(Range range) {
            return new RangeDescriptor(range.start().path(), range.end().path(), range.isCollapsed());
        }
    }
}
