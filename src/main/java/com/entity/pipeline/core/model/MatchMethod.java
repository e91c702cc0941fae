package com.entity.pipeline.core.model;

/**
 * How two names were found to denote the same identity, in priority order.
 */
public enum MatchMethod {
    EXACT,
    ALIAS,
    FUZZY
}
