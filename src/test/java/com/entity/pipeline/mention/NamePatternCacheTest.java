package com.entity.pipeline.mention;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class NamePatternCacheTest {

    private final NamePatternCache cache = new NamePatternCache(100);

    @Test
    void matchesWholeWordsIgnoringCase() {
        Pattern pattern = cache.patternFor(List.of("Jeffrey Epstein"));

        assertTrue(pattern.matcher("met JEFFREY EPSTEIN today").find());
        assertTrue(pattern.matcher("Jeffrey Epstein's house").find());
        assertFalse(pattern.matcher("Jeffrey Epsteins").find());
        assertFalse(pattern.matcher("XJeffrey Epstein").find());
    }

    @Test
    void toleratesLineBreaksBetweenTokens() {
        Pattern pattern = cache.patternFor(List.of("Ghislaine Maxwell"));

        assertTrue(pattern.matcher("Ghislaine\n   Maxwell").find());
    }

    @Test
    void longestVariantWinsAtSamePosition() {
        Pattern pattern = cache.patternFor(List.of("Jeffrey", "Jeffrey Epstein"));

        Matcher matcher = pattern.matcher("Jeffrey Epstein arrived");
        assertTrue(matcher.find());
        assertEquals("Jeffrey Epstein", matcher.group());
    }

    @Test
    void quotesRegexCharacters() {
        Pattern pattern = cache.patternFor(List.of("J.P. Morgan"));

        assertTrue(pattern.matcher("accounts at J.P. Morgan were").find());
        assertFalse(pattern.matcher("JXPX Morgan").find());
    }

    @Test
    void variants_dedupedAndLongestFirst() {
        assertEquals(List.of("Jeffrey Epstein", "Jeff"),
                NamePatternCache.variants(Arrays.asList("Jeff", null, " Jeffrey   Epstein ", "Jeffrey Epstein", " ")));
    }

    @Test
    void reusesCompiledPattern() {
        Pattern first = cache.patternFor(List.of("Leslie Wexner", "Les Wexner"));
        Pattern second = cache.patternFor(List.of("Les Wexner", "Leslie Wexner"));

        assertSame(first, second);
        assertEquals(1, cache.size());
    }

    @Test
    void noUsableName_rejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.patternFor(Arrays.asList(" ", null)));
    }
}
