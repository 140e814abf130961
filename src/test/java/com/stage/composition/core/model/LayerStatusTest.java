package com.stage.composition.core.model;

import com.stage.composition.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LayerStatusTest {

    @ParameterizedTest
    @CsvSource({
            "WIP, DRAFT",
            "wip, DRAFT",
            "Draft, DRAFT",
            "Shared, SHARED",
            "PUBLISHED, PUBLISHED",
            "archived, ARCHIVED"
    })
    @DisplayName("Should parse status tokens case-insensitively")
    void testFromToken(String token, LayerStatus expected) {
        assertEquals(expected, LayerStatus.fromToken(token));
    }

    @Test
    @DisplayName("Should reject unknown tokens")
    void testFromTokenRejects() {
        ValidationException ex = assertThrows(ValidationException.class, () -> LayerStatus.fromToken("Final"));
        assertEquals("status", ex.getField());
        assertThrows(ValidationException.class, () -> LayerStatus.fromToken(null));
        assertThrows(ValidationException.class, () -> LayerStatus.fromToken(""));
    }

    @Test
    @DisplayName("Should move one step and saturate at the ends")
    void testNextAndPrevious() {
        assertEquals(LayerStatus.SHARED, LayerStatus.DRAFT.next());
        assertEquals(LayerStatus.PUBLISHED, LayerStatus.SHARED.next());
        assertEquals(LayerStatus.ARCHIVED, LayerStatus.PUBLISHED.next());
        assertEquals(LayerStatus.ARCHIVED, LayerStatus.ARCHIVED.next());

        assertEquals(LayerStatus.PUBLISHED, LayerStatus.ARCHIVED.previous());
        assertEquals(LayerStatus.DRAFT, LayerStatus.DRAFT.previous());
    }

    @Test
    @DisplayName("Should write the draft status as WIP")
    void testTokens() {
        assertEquals("WIP", LayerStatus.DRAFT.token());
        assertEquals("Published", LayerStatus.PUBLISHED.token());
    }
}
