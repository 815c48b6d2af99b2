/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable handle on a loaded configuration document.
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "instituciones": ["CompraVenta", "Arrendamiento"],
 *   "tipos": ["contrato", "procedimiento"],
 *   "dominios": ["derecho-patrimonial-privado"],
 *   "roles": { "CompraVenta": ["comprador", "vendedor"] },
 *   "automated_norms": {
 *     "domain_defaults": { "derecho-patrimonial-privado": [ { "role": ..., "deontic": ..., "action": ... } ] },
 *     "universal_templates": { ... },
 *     "conditional_on_id": { "1": [ ... ] }
 *   }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConfigurationDocument(
    @JsonProperty("instituciones") List<String> institutions,
    @JsonProperty("tipos") List<String> types,
    @JsonProperty("dominios") List<String> domains,
    @JsonProperty("roles") Map<String, List<String>> roles,
    @JsonProperty("automated_norms") AutomatedNorms automatedNorms
) {
    public ConfigurationDocument {
        institutions = institutions == null ? List.of() : List.copyOf(institutions);
        types = types == null ? List.of() : List.copyOf(types);
        domains = domains == null ? List.of() : List.copyOf(domains);
        roles = orderedCopy(roles);
        if (automatedNorms == null) automatedNorms = AutomatedNorms.none();
    }

    public static ConfigurationDocument empty() {
        return new ConfigurationDocument(null, null, null, null, null);
    }

    static <V> Map<String, List<V>> orderedCopy(Map<String, List<V>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<V>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
