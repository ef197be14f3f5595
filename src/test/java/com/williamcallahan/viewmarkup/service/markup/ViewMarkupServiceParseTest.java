package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.config.ViewMarkupProperties;
import com.williamcallahan.viewmarkup.domain.errors.InvalidRangeOrderException;
import com.williamcallahan.viewmarkup.domain.errors.MarkerPlacementException;
import com.williamcallahan.viewmarkup.domain.errors.MarkupInputTooLargeException;
import com.williamcallahan.viewmarkup.domain.errors.RangeCountMismatchException;
import com.williamcallahan.viewmarkup.domain.errors.TagGrammarException;
import com.williamcallahan.viewmarkup.domain.errors.UnbalancedRangeException;
import com.williamcallahan.viewmarkup.domain.markup.ParsedView;
import com.williamcallahan.viewmarkup.domain.view.ElementType;
import com.williamcallahan.viewmarkup.domain.view.Position;
import com.williamcallahan.viewmarkup.domain.view.Range;
import com.williamcallahan.viewmarkup.domain.view.Selection;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;
import com.williamcallahan.viewmarkup.domain.view.ViewFragment;
import com.williamcallahan.viewmarkup.domain.view.ViewText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewMarkupServiceParseTest {

    private ViewMarkupProperties properties;
    private ViewMarkupService service;

    @BeforeEach
    void setUp() {
        properties = new ViewMarkupProperties();
        service = new ViewMarkupService(new JsoupMarkupTokenizer(), properties);
    }

    @Test
    void markupWithoutMarkers_yieldsTreeOnly() {
        ParsedView parsed = service.parse("<p>foo</p>");

        assertInstanceOf(ParsedView.TreeOnly.class, parsed);
        ViewElement paragraph = assertInstanceOf(ViewElement.class, parsed.view());
        assertEquals("p", paragraph.name());
        assertEquals(ElementType.PLAIN, paragraph.type());
        assertEquals("foo", assertInstanceOf(ViewText.class, paragraph.child(0)).data());
    }

    @Test
    void typedTags_decodeTypeAndPriority() {
        ViewElement paragraph = (ViewElement) service.parse(
            "<container:p><attribute:b:20>x</attribute:b:20><i:5>y</i:5><b:10></b:10><u>z</u></container:p>").view();

        assertEquals(ElementType.CONTAINER, paragraph.type());
        ViewElement bold = (ViewElement) paragraph.child(0);
        assertEquals(ElementType.ATTRIBUTE, bold.type());
        assertEquals(OptionalInt.of(20), bold.priority());
        assertEquals(OptionalInt.of(5), ((ViewElement) paragraph.child(1)).priority());
        assertEquals(OptionalInt.of(10), ((ViewElement) paragraph.child(2)).priority());
        assertEquals(ElementType.PLAIN, ((ViewElement) paragraph.child(3)).type());
    }

    @Test
    void attributes_keepDeclarationOrder() {
        ViewElement paragraph = (ViewElement) service.parse("<p id=\"x\" class=\"a b\" data-z=\"1\"></p>").view();

        assertEquals(List.of("id", "class", "data-z"), List.copyOf(paragraph.attributes().keySet()));
        assertEquals("a b", paragraph.getAttribute("class").orElseThrow());
    }

    @Test
    void severalTopLevelNodes_yieldFragment() {
        ViewFragment fragment = assertInstanceOf(ViewFragment.class, service.parse("foo<b>bar</b>").view());

        assertEquals(2, fragment.childCount());
        assertInstanceOf(ViewText.class, fragment.child(0));
        assertInstanceOf(ViewElement.class, fragment.child(1));
        assertInstanceOf(ViewFragment.class, service.parse("<b>x</b><i>y</i>").view());
    }

    @Test
    void lonelyTextOrEmptyInput_yieldFragment() {
        ViewFragment text = assertInstanceOf(ViewFragment.class, service.parse("foo").view());
        assertEquals("foo", ((ViewText) text.child(0)).data());

        ViewFragment empty = assertInstanceOf(ViewFragment.class, service.parse("").view());
        assertEquals(0, empty.childCount());
    }

    @Test
    void whitespaceAndEntities_arePreserved() {
        ViewElement paragraph = (ViewElement) service.parse("<p> a &amp; b </p>").view();

        assertEquals(" a & b ", ((ViewText) paragraph.child(0)).data());
    }

    @Test
    void elementAndTextRanges_resolveToPositions() {
        ParsedView.WithSelection parsed = assertInstanceOf(ParsedView.WithSelection.class,
            service.parse("<container:p>f{oo}<attribute:b:20>[bar]</attribute:b:20></container:p>"));

        ViewElement paragraph = (ViewElement) parsed.view();
        ViewText foo = (ViewText) paragraph.child(0);
        ViewElement bold = (ViewElement) paragraph.child(1);
        assertEquals("foo", foo.data());
        assertEquals(List.of(
            Range.fromParentsAndOffsets(foo, 1, foo, 3),
            Range.fromParentsAndOffsets(bold, 0, bold, 1)
        ), parsed.selection().ranges());
        assertFalse(parsed.selection().isBackward());
    }

    @Test
    void rangeAroundElement_resolvesInParent() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse("<p>[<b>foobar</b>]</p>");

        ViewElement paragraph = (ViewElement) parsed.view();
        assertEquals(1, paragraph.childCount());
        assertEquals(Range.fromParentsAndOffsets(paragraph, 0, paragraph, 1), parsed.selection().ranges().get(0));
    }

    @Test
    void whitespaceAroundElementMarkers_isDropped() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse("<p> [<b>x</b>] </p>");

        ViewElement paragraph = (ViewElement) parsed.view();
        assertEquals(1, paragraph.childCount());
        assertEquals("b", ((ViewElement) paragraph.child(0)).name());
        assertEquals(Range.fromParentsAndOffsets(paragraph, 0, paragraph, 1), parsed.selection().ranges().get(0));
    }

    @Test
    void whitespaceWithoutMarkers_isKept() {
        ViewElement paragraph = (ViewElement) service.parse("<p> <b>x</b> </p>").view();

        assertEquals(3, paragraph.childCount());
    }

    @Test
    void textMarkersInWhitespaceOnlyText_areRejected() {
        assertThrows(MarkerPlacementException.class, () -> service.parse("<p>{ }</p>"));
    }

    @Test
    void markerOnlyText_isDropped() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse("<p>[]</p>");

        ViewElement paragraph = (ViewElement) parsed.view();
        assertEquals(0, paragraph.childCount());
        Range range = parsed.selection().ranges().get(0);
        assertTrue(range.isCollapsed());
        assertEquals(new Position(paragraph, 0), range.start());
    }

    @Test
    void collapsedMarkerAfterText_resolvesAfterTextNode() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse("<p>foo[]</p>");

        ViewElement paragraph = (ViewElement) parsed.view();
        assertEquals("foo", ((ViewText) paragraph.child(0)).data());
        assertEquals(new Position(paragraph, 1), parsed.selection().ranges().get(0).start());
    }

    @Test
    void order_reassignsRangeIndices() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse(
            "<p>{fo}o{b}ar</p>", ParseOptions.withOrder(2, 1));

        ViewText text = (ViewText) ((ViewElement) parsed.view()).child(0);
        assertEquals(List.of(
            Range.fromParentsAndOffsets(text, 3, text, 4),
            Range.fromParentsAndOffsets(text, 0, text, 2)
        ), parsed.selection().ranges());
    }

    @Test
    void lastRangeBackward_isApplied() {
        ParsedView.WithSelection parsed = (ParsedView.WithSelection) service.parse(
            "<p>f{oo}</p>", new ParseOptions(List.of(), true));

        Selection selection = parsed.selection();
        assertTrue(selection.isBackward());
        assertEquals(selection.ranges().get(0).end(), selection.anchor().orElseThrow());
    }

    @Test
    void backwardWithoutMarkers_stillYieldsTreeOnly() {
        assertInstanceOf(ParsedView.TreeOnly.class, service.parse("<p>foo</p>", new ParseOptions(List.of(), true)));
    }

    @Test
    void eachParse_buildsFreshTree() {
        ParsedView first = service.parse("<p>foo</p>");
        ParsedView second = service.parse("<p>foo</p>");

        assertTrue(first.view().sameStructureAs(second.view()));
        assertNotSame(first.view(), second.view());
        assertSame(first.view(), first.view().root());
    }

    @ParameterizedTest
    @ValueSource(strings = {"<p>]text[</p>", "<p>[text</p>", "<p>te{xt</p>", "<p>[<b>[x]</b>]</p>", "<p>{a{}b}</p>"})
    void unbalancedMarkers_areRejected(String markup) {
        assertThrows(UnbalancedRangeException.class, () -> service.parse(markup));
    }

    @Test
    void elementMarkerInsideText_isRejected() {
        MarkerPlacementException error = assertThrows(MarkerPlacementException.class,
            () -> service.parse("<p>te[xt]</p>"));

        assertEquals('[', error.getToken());
        assertEquals(2, error.getTextOffset());
    }

    @Test
    void textMarkerWithoutText_isRejected() {
        assertThrows(MarkerPlacementException.class, () -> service.parse("<p>{}</p>"));
    }

    @Test
    void orderOfWrongLength_isRejected() {
        assertThrows(RangeCountMismatchException.class,
            () -> service.parse("<p>{fo}o</p>", ParseOptions.withOrder(1, 2)));
    }

    @Test
    void orderWithMissingEntry_isRejected() {
        InvalidRangeOrderException error = assertThrows(InvalidRangeOrderException.class,
            () -> service.parse("<p>{f}o{o}</p>", new ParseOptions(Arrays.asList(1, null), false)));

        assertEquals(1, error.getEntryIndex());
    }

    @Test
    void orderWithRepeatedEntry_isRejected() {
        assertThrows(InvalidRangeOrderException.class,
            () -> service.parse("<p>{f}o{o}</p>", ParseOptions.withOrder(1, 1)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"<p:foo></p:foo>", "<b:p:10></b:p:10>", "<x:y:1:2></x:y:1:2>"})
    void malformedTags_areRejected(String markup) {
        assertThrows(TagGrammarException.class, () -> service.parse(markup));
    }

    @Test
    void oversizedInput_isRejected() {
        properties.setMaxInputLength(10);

        MarkupInputTooLargeException error = assertThrows(MarkupInputTooLargeException.class,
            () -> service.parse("<p>foobar</p>"));

        assertEquals(13, error.getLength());
        assertEquals(10, error.getLimit());
    }
}
