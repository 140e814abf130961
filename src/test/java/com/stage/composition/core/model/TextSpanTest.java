package com.stage.composition.core.model;

import com.stage.composition.core.StaleSpanException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSpanTest {

    @Test
    @DisplayName("Should slice, cut and replace within its own generation")
    void testSliceCutReplace() throws StaleSpanException {
        SourceText source = SourceText.of("x def \"A\" {} y");
        TextSpan span = new TextSpan(source.generation(), 2, 10, 11);

        assertEquals("def \"A\" {}", span.slice(source));
        assertEquals("", span.body(source));
        assertEquals("x  y", span.cut(source));
        assertEquals("x Z y", span.replace(source, "Z"));
        assertEquals(10, span.length());
        assertTrue(span.contains(10));
        assertFalse(span.contains(12));
    }

    @Test
    @DisplayName("Should refuse a text of another generation even when identical")
    void testStaleSpan() {
        SourceText first = SourceText.of("def \"A\" {}");
        SourceText second = SourceText.of("def \"A\" {}");
        TextSpan span = new TextSpan(first.generation(), 0, 8, 9);

        StaleSpanException ex = assertThrows(StaleSpanException.class, () -> span.slice(second));
        assertEquals(first.generation(), ex.getSpanGeneration());
        assertEquals(second.generation(), ex.getTextGeneration());
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("Should reject inverted offsets")
    void testInvalidOffsets() {
        assertThrows(IllegalArgumentException.class, () -> new TextSpan(1, 5, 3, 10));
        assertThrows(IllegalArgumentException.class, () -> new TextSpan(1, -1, 3, 10));
    }
}
