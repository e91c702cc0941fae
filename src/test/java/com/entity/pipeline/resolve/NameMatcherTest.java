package com.entity.pipeline.resolve;

import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.MatchResult;
import com.entity.pipeline.rules.ResolverRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NameMatcherTest {

    private final NameMatcher matcher = new NameMatcher(ResolverRules.defaults());

    private static Entity person(long id, String name, String... aliases) {
        Entity.Builder builder = Entity.builder().id(id).canonicalName(name).type(EntityType.PERSON);
        for (String alias : aliases) {
            builder.alias(alias);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("Exact stage")
    class Exact {

        @Test
        @DisplayName("Should match ignoring case and whitespace")
        void caseAndWhitespace() {
            MatchResult result = matcher.match("jeffrey   EPSTEIN", "Jeffrey Epstein", EntityType.PERSON);

            assertTrue(result.matched());
            assertEquals(MatchMethod.EXACT, result.method());
            assertEquals(1.0, result.score());
        }

        @Test
        @DisplayName("Should never match blank names")
        void blank() {
            assertFalse(matcher.match("  ", "Jeffrey Epstein", EntityType.PERSON).matched());
        }

        @Test
        @DisplayName("Should never match entities of different types")
        void differentTypes() {
            Entity org = Entity.builder().id(2L).canonicalName("Jeffrey Epstein").type(EntityType.ORGANIZATION).build();

            assertFalse(matcher.match(person(1, "Jeffrey Epstein"), org).matched());
            assertFalse(matcher.match("Jeffrey Epstein", EntityType.ORGANIZATION, person(1, "Jeffrey Epstein")).matched());
        }
    }

    @Nested
    @DisplayName("Alias stage")
    class Alias {

        @Test
        @DisplayName("Should match a stored alias")
        void storedAlias() {
            MatchResult result = matcher.match("jeff epstein", EntityType.PERSON,
                    person(1, "Jeffrey Epstein", "Jeff Epstein"));

            assertEquals(MatchMethod.ALIAS, result.method());
            assertTrue(result.reasoning().contains("stored alias"));
        }

        @Test
        @DisplayName("Should match a nickname variant of a person")
        void nickname() {
            MatchResult result = matcher.match("Bill Gates", "William Gates", EntityType.PERSON);

            assertTrue(result.matched());
            assertEquals(MatchMethod.ALIAS, result.method());
            assertEquals("nickname variant", result.reasoning());
        }

        @Test
        @DisplayName("Should not apply nicknames to organizations")
        void nicknameNotForOrganizations() {
            assertFalse(matcher.match("Bill Foundation", "William Foundation", EntityType.ORGANIZATION).matched());
        }

        @Test
        @DisplayName("Should treat names with the same normalized form as aliases")
        void sameNormalizedForm() {
            MatchResult result = matcher.match("Dr. Larry Summers", "Larry Summers", EntityType.PERSON);

            assertEquals(MatchMethod.ALIAS, result.method());
        }

        @Test
        @DisplayName("Should not match nickname variants with different token counts")
        void nicknameTokenCount() {
            assertFalse(matcher.getNicknames().namesEquivalent("bill gates", "william henry gates"));
        }
    }

    @Nested
    @DisplayName("Fuzzy stage")
    class Fuzzy {

        @Test
        @DisplayName("Should match a transposed letter pair as one edit")
        void transposition() {
            MatchResult result = matcher.match("Jeffery Epstein", "Jeffrey Epstein", EntityType.PERSON);

            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals(1, result.editDistance());
            assertEquals(1.0 - 1.0 / 15, result.score(), 1e-9);
        }

        @ParameterizedTest(name = "{0} / {1} -> {2}")
        @CsvSource({
                "Jon Smith, John Smith, true",
                "Mark Lee, Mike Lee, false",
                "Ghislaine Maxwell, Ghislane Maxwel, true",
                "Ann Lee, Annabelle Lee, false",
                "Alan Smith, Alan Smithson, true",
                "Alan Smith, Alan Smithsonian, false",
                "Jeffrey Epstein, Geoffrey Epsom, false"
        })
        void boundedByLength(String a, String b, boolean expected) {
            assertEquals(expected, matcher.match(a, b, EntityType.PERSON).matched());
        }
    }

    @Test
    void nicknameCanonicalForm_sharedByVariants() {
        assertEquals(matcher.nicknameCanonicalForm("William Gates", EntityType.PERSON),
                matcher.nicknameCanonicalForm("Bill Gates", EntityType.PERSON));
        assertEquals("bill foundation", matcher.nicknameCanonicalForm("Bill Foundation", EntityType.ORGANIZATION));
    }
}
