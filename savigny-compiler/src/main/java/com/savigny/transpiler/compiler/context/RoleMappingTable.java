/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from a generic role to one or more specific roles, in
 * insertion order. A lookup resolves to the first target.
 */
public final class RoleMappingTable {

    private static final RoleMappingTable EMPTY = new RoleMappingTable(Map.of());

    private final Map<String, List<String>> mappings;

    private RoleMappingTable(Map<String, List<String>> mappings) {
        this.mappings = mappings;
    }

    public static RoleMappingTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a table whose values are either a role string or an array of role strings.
     * Other value shapes are ignored.
     */
    static RoleMappingTable fromJson(Map<String, JsonNode> json) {
        if (json == null || json.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        json.forEach((key, node) -> {
            if (node == null) {
                return;
            }
            if (node.isTextual()) {
                builder.add(key, node.asText());
            } else if (node.isArray()) {
                for (JsonNode item : node) {
                    if (item.isTextual()) {
                        builder.add(key, item.asText());
                    }
                }
            }
        });
        return builder.build();
    }

    public Optional<String> resolve(String genericRole) {
        List<String> targets = mappings.get(genericRole);
        return targets == null || targets.isEmpty() ? Optional.empty() : Optional.of(targets.get(0));
    }

    public List<String> targets(String key) {
        return mappings.getOrDefault(key, List.of());
    }

    public boolean containsKey(String key) {
        return mappings.containsKey(key);
    }

    public Set<String> keys() {
        return mappings.keySet();
    }

    public Map<String, List<String>> asMap() {
        return mappings;
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public int size() {
        return mappings.size();
    }

    @Override
    public String toString() {
        return mappings.toString();
    }

    /**
     * Collects mappings. A key mapped to a second, different role is promoted
     * to a list of both; repeated roles are kept once.
     */
    public static final class Builder {
        private final Map<String, List<String>> mappings = new LinkedHashMap<>();

        public Builder add(String key, String role) {
            List<String> targets = mappings.computeIfAbsent(key, k -> new ArrayList<>());
            if (!targets.contains(role)) {
                targets.add(role);
            }
            return this;
        }

        public Builder addIfAbsent(String key, String role) {
            if (!mappings.containsKey(key)) {
                add(key, role);
            }
            return this;
        }

        public boolean containsKey(String key) {
            return mappings.containsKey(key);
        }

        public boolean isEmpty() {
            return mappings.isEmpty();
        }

        /**
         * Adds the inverse of every collected entry whose target is not yet a key.
         */
        public Builder withInverses() {
            Map<String, List<String>> snapshot = new LinkedHashMap<>();
            mappings.forEach((key, targets) -> snapshot.put(key, List.copyOf(targets)));
            snapshot.forEach((key, targets) -> {
                for (String target : targets) {
                    addIfAbsent(target, key);
                }
            });
            return this;
        }

        public RoleMappingTable build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            mappings.forEach((key, targets) -> copy.put(key, List.copyOf(targets)));
            return new RoleMappingTable(Collections.unmodifiableMap(copy));
        }
    }
}
