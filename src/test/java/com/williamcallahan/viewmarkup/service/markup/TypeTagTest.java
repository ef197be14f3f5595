package com.williamcallahan.viewmarkup.service.markup;

import com.williamcallahan.viewmarkup.domain.errors.TagGrammarException;
import com.williamcallahan.viewmarkup.domain.view.ElementType;
import com.williamcallahan.viewmarkup.domain.view.ViewElement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests decoding and encoding of colon separated type tags.
 */
class TypeTagTest {

    @Test
    void parse_singleSegment_isPlain() {
        assertEquals(new TypeTag(ElementType.PLAIN, "p", OptionalInt.empty()), TypeTag.parse("p"));
    }

    @Test
    void parse_typePrefix_setsType() {
        assertEquals(new TypeTag(ElementType.CONTAINER, "div", OptionalInt.empty()), TypeTag.parse("container:div"));
        assertEquals(new TypeTag(ElementType.ATTRIBUTE, "b", OptionalInt.empty()), TypeTag.parse("attribute:b"));
    }

    @Test
    void parse_namePriority_isAttribute() {
        assertEquals(new TypeTag(ElementType.ATTRIBUTE, "span", OptionalInt.of(10)), TypeTag.parse("span:10"));
    }

    @Test
    void parse_typeNamePriority_setsAll() {
        assertEquals(new TypeTag(ElementType.ATTRIBUTE, "b", OptionalInt.of(20)), TypeTag.parse("attribute:b:20"));
        assertEquals(new TypeTag(ElementType.CONTAINER, "p", OptionalInt.of(5)), TypeTag.parse("container:p:5"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"p:foo", "b:p:10", "container:p:x", "a:b:c:d", "container:", ":p", "attribute:b:"})
    void parse_malformedTag_carriesRawTag(String rawTag) {
        TagGrammarException error = assertThrows(TagGrammarException.class, () -> TypeTag.parse(rawTag));

        assertEquals(rawTag, error.getRawTag());
    }

    @Test
    void parse_typePrefix_isCaseSensitive() {
        assertThrows(TagGrammarException.class, () -> TypeTag.parse("Container:div"));
    }

    @Test
    void toElement_dropsPriorityOfContainer() {
        ViewElement element = TypeTag.parse("container:p:5").toElement();

        assertEquals(ElementType.CONTAINER, element.type());
        assertEquals(OptionalInt.empty(), element.priority());
    }

    @Test
    void toElement_attributeWithoutPriority_usesDefault() {
        ViewElement element = TypeTag.parse("attribute:b").toElement();

        assertEquals(OptionalInt.of(ViewElement.DEFAULT_PRIORITY), element.priority());
    }

    @Test
    void encode_honorsDisplayFlags() {
        TypeTag attribute = TypeTag.of(ViewElement.attribute("b", 20));
        TypeTag container = TypeTag.of(ViewElement.container("p"));
        TypeTag plain = TypeTag.of(ViewElement.plain("img"));

        assertEquals("attribute:b:20", attribute.encode(true, true));
        assertEquals("attribute:b", attribute.encode(true, false));
        assertEquals("b:20", attribute.encode(false, true));
        assertEquals("b", attribute.encode(false, false));
        assertEquals("container:p", container.encode(true, true));
        assertEquals("p", container.encode(false, true));
        assertEquals("img", plain.encode(true, true));
    }
}
