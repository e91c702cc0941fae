package com.entity.pipeline.core.model;

/**
 * A bounded snippet of text around one occurrence of an entity name.
 *
 * @param snippet text around the match, trimmed to the nearest sentence boundary
 * @param start   start offset of the match in the document
 * @param end     end offset (exclusive) of the match in the document
 */
public record MentionContext(String snippet, int start, int end) {
}
