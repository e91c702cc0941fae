package com.entity.pipeline.rules;

import com.entity.pipeline.core.model.EntityType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Regex rewrite applied to a name before comparison. Lower priority values run first;
 * an empty type set means the rule applies to every entity type.
 *
 * @param name        rule identifier, used in logs
 * @param pattern     compiled case-insensitive pattern
 * @param replacement replacement text, may reference groups
 * @param types       entity types the rule is restricted to
 * @param priority    ordering key
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, Set<EntityType> types,
                                int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        replacement = replacement != null ? replacement : "";
        types = types != null ? Set.copyOf(types) : Set.of();
    }

    /**
     * Rule that deletes every match of {@code regex}.
     */
    public static NormalizationRule strip(String name, String regex, int priority, EntityType... types) {
        return rewrite(name, regex, "", priority, types);
    }

    public static NormalizationRule rewrite(String name, String regex, String replacement, int priority,
                                            EntityType... types) {
        Set<EntityType> scope = types.length == 0 ? Set.of() : EnumSet.of(types[0], types);
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                replacement, scope, priority);
    }

    public boolean appliesTo(EntityType type) {
        return types.isEmpty() || types.contains(type);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
