package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.config.ViewMarkupProperties;
import com.williamcallahan.viewmarkup.domain.errors.MarkupInputTooLargeException;
import com.williamcallahan.viewmarkup.domain.errors.ViewMarkupException;
import com.williamcallahan.viewmarkup.domain.markup.MarkupFragment;
import com.williamcallahan.viewmarkup.domain.markup.ParsedView;
import com.williamcallahan.viewmarkup.domain.view.Range;
import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Converts view trees to markup and back.
 *
 * <p>Markup is HTML-like: {@code <container:p>f{oo}<attribute:b:20>[bar]</attribute:b:20></container:p>}.
 * {@code [} and {@code ]} mark range boundaries between nodes, <code>&#123;</code> and
 * <code>&#125;</code> mark range boundaries inside text. Stringifying with {@link StringifyOptions#LOSSLESS} and parsing the result
 * yields a structurally equal tree and selection.
 *
 * <p>Both directions are synchronous and keep no state between calls.
 */
@Service
public class ViewMarkupService {

    private static final Logger logger = LoggerFactory.getLogger(ViewMarkupService.class);

    private final MarkupTokenizer tokenizer;
    private final ViewMarkupProperties properties;

    public ViewMarkupService(MarkupTokenizer tokenizer, ViewMarkupProperties properties) {
        this.tokenizer = tokenizer;
        this.properties = properties;
    }

    public String stringify(ViewNode root) {
        return stringify(root, null, StringifyOptions.DEFAULTS);
    }

    public String stringify(ViewNode root, Selection selection) {
        return stringify(root, selection, StringifyOptions.DEFAULTS);
    }

    /**
     * Writes a tree as markup, with the ranges of an optional selection as markers.
     *
     * @param root node to write, together with its subtree
     * @param selection ranges to mark, may be null
     * @param options display options
     * @return markup
     * @throws IllegalArgumentException when a range boundary lies outside {@code root}
     */
    public String stringify(ViewNode root, Selection selection, StringifyOptions options) {
        String markup = new ViewStringifier(root, selection, options).stringify();
        if (logger.isDebugEnabled()) {
            logger.debug("Stringified {} nodes with {} ranges to {} characters", countNodes(root),
                selection == null ? 0 : selection.rangeCount(), markup.length());
        }
        return markup;
    }

    public ParsedView parse(String markup) {
        return parse(markup, ParseOptions.DEFAULTS);
    }

    /**
     * Parses markup into a fresh view tree and recovers the ranges marked in it.
     *
     * @param markup markup to parse
     * @param options range order and direction
     * @return the tree alone when no markers were found, otherwise the tree and its selection
     * @throws ViewMarkupException when the markup cannot be converted
     */
    public ParsedView parse(String markup, ParseOptions options) {
        Objects.requireNonNull(markup, "Markup cannot be null");
        Objects.requireNonNull(options, "Parse options cannot be null");
        if (markup.length() > properties.getMaxInputLength()) {
            throw new MarkupInputTooLargeException(markup.length(), properties.getMaxInputLength());
        }

        try {
            MarkupFragment tokenized = tokenizer.tokenize(markup);
            BracketScanner scanner = new BracketScanner();
            ViewNode view = new ViewTreeBuilder(scanner).build(tokenized);
            List<Range> ranges = RangeBuilder.reorder(RangeBuilder.build(scanner.markers()), options.order());

            if (logger.isDebugEnabled()) {
                logger.debug("Parsed {} characters of markup into {} nodes and {} ranges",
                    markup.length(), countNodes(view), ranges.size());
            }
            if (ranges.isEmpty()) {
                return new ParsedView.TreeOnly(view);
            }
            return new ParsedView.WithSelection(view, new Selection(ranges, options.lastRangeBackward()));
        } catch (ViewMarkupException rejected) {
            logger.debug("Rejected markup: {}", rejected.getMessage());
            throw rejected;
        }
    }

    private static int countNodes(ViewNode node) {
        int count = 1;
        for (ViewNode child : node.children()) {
            count += countNodes(child);
        }
        return count;
    }
}
