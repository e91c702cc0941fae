package com.entity.pipeline.store;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== validateEntityName ==========

    @Test
    void validateEntityName_rejectsNull() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName(null));
    }

    @Test
    void validateEntityName_rejectsBlank() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName(""));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName("   "));
    }

    @Test
    void validateEntityName_rejectsOverMaxLength() {
        String longName = "A".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH + 1);
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName(longName));
    }

    @Test
    void validateEntityName_acceptsMaxLength() {
        String maxName = "A".repeat(InputSanitizer.MAX_ENTITY_NAME_LENGTH);
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName(maxName));
    }

    @Test
    void validateEntityName_rejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName("Ghislaine\u0000Maxwell"));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateEntityName("Ghislaine\u007FMaxwell"));
    }

    @Test
    void validateEntityName_acceptsApostrophesAndAccents() {
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("Patrick O'Brien"));
        assertDoesNotThrow(() -> InputSanitizer.validateEntityName("José Ramírez"));
    }

    // ========== collapseWhitespace ==========

    @Test
    void collapseWhitespace_trimsAndCollapses() {
        assertEquals("Jeffrey Epstein", InputSanitizer.collapseWhitespace("  Jeffrey \n\t Epstein "));
        assertEquals("", InputSanitizer.collapseWhitespace(null));
    }

    // ========== toFtsPhrase ==========

    @Test
    void toFtsPhrase_quotesName() {
        assertEquals(Optional.of("\"Jeffrey Epstein\""), InputSanitizer.toFtsPhrase("Jeffrey  Epstein"));
    }

    @Test
    void toFtsPhrase_doublesEmbeddedQuotes() {
        assertEquals(Optional.of("\"The \"\"Island\"\"\""), InputSanitizer.toFtsPhrase("The \"Island\""));
    }

    @Test
    void toFtsPhrase_emptyWithoutIndexableCharacters() {
        assertTrue(InputSanitizer.toFtsPhrase("---").isEmpty());
        assertTrue(InputSanitizer.toFtsPhrase(null).isEmpty());
    }
}
