package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.markup.MarkupElement;
import com.williamcallahan.viewmarkup.domain.markup.MarkupFragment;
import com.williamcallahan.viewmarkup.domain.markup.MarkupNode;
import com.williamcallahan.viewmarkup.domain.markup.MarkupText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes markup with jsoup's XML tree builder.
 *
 * <p>The XML builder keeps tag and attribute case, keeps whitespace text as written and applies no
 * HTML nesting rules, so any element may contain any other. Comments, declarations and doctypes are
 * dropped.
 */
@Component
public class JsoupMarkupTokenizer implements MarkupTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(JsoupMarkupTokenizer.class);

    @Override
    public MarkupFragment tokenize(String markup) {
        Document document = Jsoup.parse(markup, "", Parser.xmlParser());
        return new MarkupFragment(convertChildren(document));
    }

    private List<MarkupNode> convertChildren(Element parent) {
        List<MarkupNode> children = new ArrayList<>(parent.childNodeSize());
        for (Node child : parent.childNodes()) {
            if (child instanceof TextNode textNode) {
                children.add(new MarkupText(textNode.getWholeText()));
            } else if (child instanceof Element element) {
                children.add(convertElement(element));
            } else {
                logger.debug("Skipping non-content markup node: {}", child.nodeName());
            }
        }
        return children;
    }

    private MarkupElement convertElement(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return new MarkupElement(element.tagName(), attributes, convertChildren(element));
    }
}
