package com.entity.pipeline.mention;

import com.entity.pipeline.core.model.MentionContext;

/**
 * Cuts the sentence around a match: from the nearest sentence boundary ({@code . ! ?} or a
 * line break) before the match to the nearest one after it, at most {@code window}
 * characters on each side.
 */
public class SnippetExtractor {

    private final int window;

    public SnippetExtractor(int window) {
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0");
        }
        this.window = window;
    }

    public MentionContext extract(String content, int start, int end) {
        if (start < 0 || end > content.length() || start > end) {
            throw new IllegalArgumentException("Span [" + start + "," + end + ") outside content of length "
                    + content.length());
        }
        int left = Math.max(0, start - window);
        for (int i = start - 1; i >= left; i--) {
            if (isBoundary(content.charAt(i))) {
                left = i + 1;
                break;
            }
        }
        int limit = Math.min(content.length(), end + window);
        int right = limit;
        for (int i = end; i < limit; i++) {
            char c = content.charAt(i);
            if (isBoundary(c)) {
                right = c == '\n' ? i : i + 1;
                break;
            }
        }
        String snippet = content.substring(left, right).trim().replaceAll("\\s+", " ");
        return new MentionContext(snippet, start, end);
    }

    private static boolean isBoundary(char c) {
        return c == '.' || c == '!' || c == '?' || c == '\n';
    }
}
