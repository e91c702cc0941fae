package com.entity.pipeline.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads rule files. A null path selects the copy bundled on the classpath.
 */
public final class RulesLoader {
    private static final Logger log = LoggerFactory.getLogger(RulesLoader.class);

    static final String DEFAULT_RESOLVER_RULES = "/default-resolver-rules.json";
    static final String DEFAULT_SCORING_RULES = "/default-scoring-rules.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RulesLoader() {
    }

    public static ResolverRules loadResolverRules(Path path) {
        return load(path, DEFAULT_RESOLVER_RULES, ResolverRules.class);
    }

    public static ScoringRules loadScoringRules(Path path) {
        return load(path, DEFAULT_SCORING_RULES, ScoringRules.class);
    }

    private static <T> T load(Path path, String resource, Class<T> type) {
        if (path != null) {
            if (!Files.isReadable(path)) {
                throw new IllegalArgumentException("Rules file is not readable: " + path);
            }
            try (InputStream in = Files.newInputStream(path)) {
                T rules = MAPPER.readValue(in, type);
                log.info("rules.loaded type={} source={}", type.getSimpleName(), path);
                return rules;
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid rules file " + path + ": " + e.getMessage(), e);
            }
        }
        try (InputStream in = RulesLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled rules missing from classpath: " + resource);
            }
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled rules " + resource, e);
        }
    }
}
