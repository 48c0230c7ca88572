package com.ivamare.exchange.hash;

import java.util.List;
import java.util.Set;

/**
 * Selects which fields take part in hashing and comparison.
 *
 * @param keyFields Fields to include, dot paths allowed; empty means all fields not ignored
 * @param ignoreFields Top-level fields excluded when no key fields are given
 * @param sortKeys Whether map keys are sorted before serialization
 */
public record HashConfig(
    List<String> keyFields,
    Set<String> ignoreFields,
    boolean sortKeys
) {
    public static final Set<String> DEFAULT_IGNORE_FIELDS = Set.of(
        "created_at",
        "updated_at",
        "metadata",
        "version",
        "data_hash",
        "last_processed_at",
        "processing_history"
    );

    public HashConfig {
        keyFields = keyFields != null ? List.copyOf(keyFields) : List.of();
        ignoreFields = ignoreFields != null ? Set.copyOf(ignoreFields) : DEFAULT_IGNORE_FIELDS;
    }

    public static HashConfig defaultConfig() {
        return new HashConfig(List.of(), DEFAULT_IGNORE_FIELDS, true);
    }

    public static HashConfig ofKeyFields(List<String> keyFields) {
        return new HashConfig(keyFields, DEFAULT_IGNORE_FIELDS, true);
    }

    public boolean hasKeyFields() {
        return !keyFields.isEmpty();
    }
}
