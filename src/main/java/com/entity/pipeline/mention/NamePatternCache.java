package com.entity.pipeline.mention;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles and caches the whole-word pattern matching any name variant of an entity.
 * Variants are tried longest first so "Jeffrey Epstein" wins over "Jeffrey" at the same position.
 * Tokens may be separated by any run of whitespace, including line breaks.
 */
public class NamePatternCache {

    private static final String LEFT_BOUNDARY = "(?<![\\p{L}\\p{N}])";
    private static final String RIGHT_BOUNDARY = "(?![\\p{L}\\p{N}])";

    private final Cache<List<String>, Pattern> cache;

    public NamePatternCache(int maxSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    /**
     * Pattern for the given names.
     *
     * @throws IllegalArgumentException if no name has any non-blank text
     * @throws java.util.regex.PatternSyntaxException if the combined pattern cannot be compiled
     */
    public Pattern patternFor(Collection<String> names) {
        List<String> variants = variants(names);
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("No usable name variant in " + names);
        }
        return cache.get(variants, NamePatternCache::compile);
    }

    static List<String> variants(Collection<String> names) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                distinct.add(name.trim().replaceAll("\\s+", " "));
            }
        }
        List<String> sorted = new ArrayList<>(distinct);
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return List.copyOf(sorted);
    }

    private static Pattern compile(List<String> variants) {
        StringBuilder regex = new StringBuilder(LEFT_BOUNDARY).append("(?:");
        for (int i = 0; i < variants.size(); i++) {
            if (i > 0) {
                regex.append('|');
            }
            String[] tokens = variants.get(i).split(" ");
            for (int t = 0; t < tokens.length; t++) {
                if (t > 0) {
                    regex.append("\\s+");
                }
                regex.append(Pattern.quote(tokens[t]));
            }
        }
        regex.append(')').append(RIGHT_BOUNDARY);
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public double hitRate() {
        return cache.stats().hitRate();
    }
}
