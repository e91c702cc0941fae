package com.entity.pipeline.core.model;

import java.util.List;

/**
 * Occurrences of one entity in one document.
 *
 * @param entityId    entity the mention resolves to
 * @param documentId  document containing the occurrences
 * @param count       exact number of occurrences in the document
 * @param firstStart  start offset of the first occurrence, or -1 when unknown
 * @param firstEnd    end offset of the first occurrence, or -1 when unknown
 * @param contexts    bounded list of context snippets
 */
public record Mention(
        long entityId,
        long documentId,
        int count,
        int firstStart,
        int firstEnd,
        List<MentionContext> contexts
) {
    public Mention {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        contexts = contexts != null ? List.copyOf(contexts) : List.of();
    }

    public boolean hasSpan() {
        return firstStart >= 0 && firstEnd >= firstStart;
    }
}
