package com.entity.pipeline.integrity;

import java.util.Objects;

/**
 * Configuration of the integrity pass.
 *
 * @param hubName   canonical name of the entity every isolate is linked to
 * @param purgeJunk whether junk-named entities with no evidence are deleted
 */
public record IntegrityConfig(String hubName, boolean purgeJunk) {

    public static final String DEFAULT_HUB_NAME = "Jeffrey Epstein";

    public IntegrityConfig {
        Objects.requireNonNull(hubName, "hubName is required");
        if (hubName.isBlank()) {
            throw new IllegalArgumentException("hubName must not be blank");
        }
    }

    public static IntegrityConfig defaults() {
        return new IntegrityConfig(DEFAULT_HUB_NAME, true);
    }

    public IntegrityConfig withHubName(String hubName) {
        return new IntegrityConfig(hubName, purgeJunk);
    }
}
