package com.entity.pipeline.store;

/**
 * Inclusive id range restricting a batch pass.
 */
public record IdRange(long fromId, long toId) {

    public IdRange {
        if (fromId > toId) {
            throw new IllegalArgumentException("fromId must be <= toId (was " + fromId + " > " + toId + ")");
        }
    }

    public static IdRange all() {
        return new IdRange(Long.MIN_VALUE, Long.MAX_VALUE);
    }

    public static IdRange of(Long fromId, Long toId) {
        return new IdRange(fromId != null ? fromId : Long.MIN_VALUE, toId != null ? toId : Long.MAX_VALUE);
    }

    public boolean contains(long id) {
        return id >= fromId && id <= toId;
    }

    public boolean isUnbounded() {
        return fromId == Long.MIN_VALUE && toId == Long.MAX_VALUE;
    }
}
