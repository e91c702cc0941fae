package com.entity.pipeline.similarity;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Blocking keys for person and organization names:
 * <ul>
 *   <li><b>Prefix</b>: first {@code prefixLength} characters ({@code pfx:jef})</li>
 *   <li><b>Sorted tokens</b>: the first two tokens in alphabetical order ({@code tok:epstein|jeffrey}),
 *       so "Epstein Jeffrey" and "Jeffrey Epstein" meet</li>
 *   <li><b>Surname prefix</b>: start of the last token of a multi-token name ({@code sur:epst}),
 *       which catches typos in the given name and in the surname's tail</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private final int prefixLength;
    private final int surnamePrefixLength;

    public DefaultBlockingKeyStrategy() {
        this(3, 4);
    }

    public DefaultBlockingKeyStrategy(int prefixLength, int surnamePrefixLength) {
        if (prefixLength <= 0 || surnamePrefixLength <= 0) {
            throw new IllegalArgumentException("prefix lengths must be > 0");
        }
        this.prefixLength = prefixLength;
        this.surnamePrefixLength = surnamePrefixLength;
    }

    @Override
    public Set<String> generateKeys(String normalizedName) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedName == null || normalizedName.isBlank()) {
            return keys;
        }
        String cleaned = normalizedName.toLowerCase(Locale.ROOT).trim();
        keys.add("pfx:" + prefix(cleaned, prefixLength));

        String[] tokens = cleaned.split("\\s+");
        if (tokens.length >= 2) {
            String[] sorted = Arrays.copyOf(tokens, 2);
            Arrays.sort(sorted);
            keys.add("tok:" + sorted[0] + "|" + sorted[1]);
            keys.add("sur:" + prefix(tokens[tokens.length - 1], surnamePrefixLength));
        }
        return keys;
    }

    private static String prefix(String value, int length) {
        return value.length() > length ? value.substring(0, length) : value;
    }
}
