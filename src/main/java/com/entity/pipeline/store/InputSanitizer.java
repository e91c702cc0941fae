package com.entity.pipeline.store;

import java.util.Optional;

/**
 * Input validation for names flowing into the store and into full-text queries.
 */
public final class InputSanitizer {

    /** Maximum allowed length for entity names. */
    public static final int MAX_ENTITY_NAME_LENGTH = 1000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates an entity name.
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @param name the entity name to validate
     * @throws IllegalArgumentException if the name is invalid
     */
    public static void validateEntityName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be null or blank");
        }
        if (name.length() > MAX_ENTITY_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Entity name exceeds maximum length of " + MAX_ENTITY_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException("Entity name must not contain control characters");
        }
    }

    /**
     * Collapses runs of whitespace and trims.
     */
    public static String collapseWhitespace(String name) {
        return name == null ? "" : name.trim().replaceAll("\\s+", " ");
    }

    /**
     * Builds an FTS5 phrase query for a name, doubling embedded quotes.
     * Returns empty when the name has no characters the tokenizer would index.
     */
    public static Optional<String> toFtsPhrase(String name) {
        if (name == null || name.codePoints().noneMatch(Character::isLetterOrDigit)) {
            return Optional.empty();
        }
        return Optional.of('"' + collapseWhitespace(name).replace("\"", "\"\"") + '"');
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding common whitespace characters (tab, newline, carriage return).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
