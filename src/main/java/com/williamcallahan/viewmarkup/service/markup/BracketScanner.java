package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.MarkerPlacementException;
import com.williamcallahan.viewmarkup.domain.view.Position;
import com.williamcallahan.viewmarkup.domain.view.ViewNode;
import com.williamcallahan.viewmarkup.domain.view.ViewText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Removes range markers from text while the view tree is being built and records the position
 * each marker denotes, in document order.
 *
 * <p>Text markers resolve to offsets inside the stripped text node. Element markers must sit at
 * either edge of the text and resolve to the parent position before or after the text node. Text
 * that is empty once stripped produces no node, and neither does whitespace-only text that held
 * markers, so markup may be indented around them. One scanner serves one parse.
 */
final class BracketScanner {

    private final List<BoundaryMarker> markers = new ArrayList<>();

    /**
     * Strips markers from one text and appends the remaining text, if any, to its parent.
     *
     * @param rawText text content as tokenized
     * @param parent container receiving the text node
     * @param appender appends a node to {@code parent}
     */
    void consumeText(String rawText, ViewNode parent, Consumer<ViewNode> appender) {
        ScannedText scanned = scan(rawText);
        int index = parent.maxOffset();

        if (scanned.stripped().isEmpty() || (!scanned.hits().isEmpty() && scanned.stripped().isBlank())) {
            for (MarkerHit hit : scanned.hits()) {
                if (hit.token().isTextToken()) {
                    throw new MarkerPlacementException("Text range delimiter '" + hit.token().symbol()
                        + "' is placed inside empty text node.", hit.token().symbol(), hit.offset());
                }
                record(hit, new Position(parent, index));
            }
            return;
        }

        ViewText text = new ViewText(scanned.stripped());
        appender.accept(text);
        int length = scanned.stripped().length();
        for (MarkerHit hit : scanned.hits()) {
            if (hit.token().isTextToken()) {
                record(hit, new Position(text, hit.offset()));
            } else if (hit.offset() == 0) {
                record(hit, new Position(parent, index));
            } else if (hit.offset() == length) {
                record(hit, new Position(parent, index + 1));
            } else {
                throw new MarkerPlacementException("Range delimiter '" + hit.token().symbol()
                    + "' is placed inside text node at offset " + hit.offset() + ".",
                    hit.token().symbol(), hit.offset());
            }
        }
    }

    List<BoundaryMarker> markers() {
        return List.copyOf(markers);
    }

    /**
     * Finds all markers in a text. An opening marker directly followed by its closing marker is
     * reported once, as a collapsed pair.
     *
     * @param rawText text to scan
     * @return text without markers plus each marker with its offset in that text
     */
    static ScannedText scan(String rawText) {
        StringBuilder stripped = new StringBuilder(rawText.length());
        List<MarkerHit> hits = new ArrayList<>();
        for (int i = 0; i < rawText.length(); i++) {
            char c = rawText.charAt(i);
            Optional<BoundaryToken> token = BoundaryToken.fromSymbol(c);
            if (token.isEmpty()) {
                stripped.append(c);
                continue;
            }
            BoundaryToken found = token.get();
            boolean collapsed = found.isStart()
                && i + 1 < rawText.length()
                && rawText.charAt(i + 1) == found.closing().symbol();
            hits.add(new MarkerHit(found, stripped.length(), collapsed));
            if (collapsed) {
                i++;
            }
        }
        return new ScannedText(stripped.toString(), hits);
    }

    private void record(MarkerHit hit, Position position) {
        markers.add(new BoundaryMarker(hit.token(), hit.collapsed(), position));
    }

    /**
     * Marker occurrence inside one text.
     *
     * @param token marker found
     * @param offset offset in the stripped text
     * @param collapsed whether this is an adjacent opening and closing pair
     */
    record MarkerHit(BoundaryToken token, int offset, boolean collapsed) {
    }

    /**
     * Outcome of scanning one text.
     *
     * @param stripped text without markers
     * @param hits markers in order of appearance
     */
    record ScannedText(String stripped, List<MarkerHit> hits) {

        ScannedText {
            hits = List.copyOf(hits);
        }
    }
}
