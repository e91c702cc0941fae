package com.entity.pipeline.resolve;

import com.entity.pipeline.rules.ResolverRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recognizes entity names that are really sentence fragments or document metadata
 * produced by upstream recognition ("To Scale", "Page 12", "Monday").
 * Whitelisted names are never junk.
 */
public class JunkClassifier {
    private static final Logger log = LoggerFactory.getLogger(JunkClassifier.class);

    private final List<Pattern> patterns = new ArrayList<>();
    private final Set<String> connectorWords = new HashSet<>();
    private final Set<String> whitelist = new HashSet<>();
    private final double connectorRatio;

    public JunkClassifier(ResolverRules rules) {
        for (String regex : rules.junkPatterns()) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                log.warn("junk.pattern.invalid pattern={} error={}", regex, e.getDescription());
            }
        }
        for (String word : rules.connectorWords()) {
            connectorWords.add(word.toLowerCase(Locale.ROOT));
        }
        for (String name : rules.whitelist()) {
            whitelist.add(normalize(name));
        }
        this.connectorRatio = rules.connectorRatio();
    }

    /**
     * Classifies a name.
     *
     * @return the reason the name is junk, or empty if it is a plausible entity name
     */
    public Optional<String> classify(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of("blank name");
        }
        String trimmed = name.trim().replaceAll("\\s+", " ");
        if (isWhitelisted(trimmed)) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(trimmed).find()) {
                return Optional.of("matches junk pattern " + pattern.pattern());
            }
        }
        String[] words = trimmed.toLowerCase(Locale.ROOT).split(" ");
        if (words.length >= 2) {
            int connectors = 0;
            for (String word : words) {
                if (connectorWords.contains(word)) {
                    connectors++;
                }
            }
            double ratio = (double) connectors / words.length;
            if (ratio > connectorRatio) {
                return Optional.of(String.format(Locale.ROOT, "connector-word ratio %.2f", ratio));
            }
        }
        return Optional.empty();
    }

    public boolean isJunk(String name) {
        return classify(name).isPresent();
    }

    public boolean isWhitelisted(String name) {
        return whitelist.contains(normalize(name));
    }

    private static String normalize(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
