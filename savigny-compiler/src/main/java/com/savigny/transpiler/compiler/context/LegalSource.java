/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A legal source (code, statute, regulation) with its norms in document order.
 *
 * @param id key of the source in the corpus
 * @param name display name, may be {@code null}
 * @param type source type, may be {@code null}
 * @param norms norms keyed by their key within the source
 */
public record LegalSource(String id, String name, String type, Map<String, ContextNorm> norms) {

    public LegalSource {
        norms = norms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(norms));
    }

    @JsonCreator
    static LegalSource fromJson(
        @JsonProperty("nombre") String name,
        @JsonProperty("tipo") String type,
        @JsonProperty("normas") Map<String, ContextNorm> norms
    ) {
        return new LegalSource(null, name, type, norms);
    }

    LegalSource withId(String sourceId) {
        Map<String, ContextNorm> located = new LinkedHashMap<>();
        norms.forEach((key, norm) -> {
            if (norm != null) {
                located.put(key, norm.locatedAt(sourceId, key));
            }
        });
        return new LegalSource(sourceId, name, type, located);
    }

    public String displayName() {
        return name != null ? name : id;
    }
}
