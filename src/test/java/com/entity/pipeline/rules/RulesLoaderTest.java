package com.entity.pipeline.rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RulesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledResolverRules() {
        ResolverRules rules = RulesLoader.loadResolverRules(null);

        assertTrue(rules.nicknames().get("william").contains("bill"));
        assertTrue(rules.whitelist().contains("The Washington Post"));
        assertFalse(rules.junkPatterns().isEmpty());
        assertEquals(3, rules.maxLengthDelta());
    }

    @Test
    void bundledScoringRules() {
        ScoringRules rules = RulesLoader.loadScoringRules(null);

        assertTrue(rules.anchorEntities().contains("Jeffrey Epstein"));
        assertFalse(rules.highRiskKeywords().isEmpty());
        assertFalse(rules.mediumRiskKeywords().isEmpty());
    }

    @Test
    void maxDistanceFor_dependsOnLength() {
        ResolverRules rules = ResolverRules.defaults();

        assertEquals(2, rules.maxDistanceFor(10));
        assertEquals(3, rules.maxDistanceFor(11));
    }

    @Test
    void loadsFileOverride() throws IOException {
        Path file = tempDir.resolve("scoring.json");
        Files.writeString(file, """
                {"highRiskKeywords": ["wire transfer"], "anchorEntities": ["Acme Holdings"]}
                """);

        ScoringRules rules = RulesLoader.loadScoringRules(file);

        assertEquals(java.util.List.of("wire transfer"), rules.highRiskKeywords());
        assertTrue(rules.mediumRiskKeywords().isEmpty());
        assertEquals(java.util.List.of("Acme Holdings"), rules.anchorEntities());
    }

    @Test
    void missingFile_rejected() {
        Path missing = tempDir.resolve("missing.json");

        assertThrows(IllegalArgumentException.class, () -> RulesLoader.loadResolverRules(missing));
    }

    @Test
    void malformedFile_rejected() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(IllegalArgumentException.class, () -> RulesLoader.loadScoringRules(file));
    }

    @Test
    void invalidValues_rejected() throws IOException {
        Path file = tempDir.resolve("resolver.json");
        Files.writeString(file, """
                {"connectorRatio": 0, "shortNameLength": 10}
                """);

        assertThrows(IllegalArgumentException.class, () -> RulesLoader.loadResolverRules(file));
    }
}
