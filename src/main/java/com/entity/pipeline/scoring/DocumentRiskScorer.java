package com.entity.pipeline.scoring;

import com.entity.pipeline.rules.ScoringRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the risk of a document from its text and the anchors it mentions.
 *
 * <p>Formula:</p>
 * <pre>
 * risk = highWeight * highTierHits + mediumWeight * mediumTierHits + anchorWeight * anchorsMentioned
 * </pre>
 *
 * <p>Keywords match whole words, case-insensitively. The score is clamped to [0, 100].</p>
 */
public class DocumentRiskScorer {
    private static final Logger log = LoggerFactory.getLogger(DocumentRiskScorer.class);

    private final ScoringConfig config;
    private final List<Pattern> highRiskPatterns;
    private final List<Pattern> mediumRiskPatterns;

    public DocumentRiskScorer(ScoringRules rules, ScoringConfig config) {
        this.config = config;
        this.highRiskPatterns = compile(rules.highRiskKeywords());
        this.mediumRiskPatterns = compile(rules.mediumRiskKeywords());
    }

    public double score(String content, int anchorsMentioned) {
        KeywordHits hits = keywordHits(content);
        double risk = RiskRating.clamp(config.highKeywordWeight() * hits.high()
                + config.mediumKeywordWeight() * hits.medium()
                + config.documentAnchorWeight() * anchorsMentioned);
        log.trace("Document risk: high={} medium={} anchors={} risk={}",
                hits.high(), hits.medium(), anchorsMentioned, risk);
        return risk;
    }

    public KeywordHits keywordHits(String content) {
        if (content == null || content.isEmpty()) {
            return new KeywordHits(0, 0);
        }
        return new KeywordHits(countAll(highRiskPatterns, content), countAll(mediumRiskPatterns, content));
    }

    private static int countAll(List<Pattern> patterns, String content) {
        int hits = 0;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                hits++;
            }
        }
        return hits;
    }

    private static List<Pattern> compile(List<String> keywords) {
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> Pattern.compile("(?<![\\p{L}\\p{N}])"
                                + String.join("\\s+", quoteTokens(k.trim()))
                                + "(?![\\p{L}\\p{N}])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    private static List<String> quoteTokens(String keyword) {
        return List.of(keyword.split("\\s+")).stream().map(Pattern::quote).toList();
    }

    /**
     * Keyword occurrences per tier.
     */
    public record KeywordHits(int high, int medium) {
    }
}
