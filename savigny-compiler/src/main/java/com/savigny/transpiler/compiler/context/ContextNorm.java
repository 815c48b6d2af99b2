/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A norm of a legal source in the context corpus.
 *
 * @param sourceId identifier of the owning source
 * @param key key of the norm inside its source, also used to name generated assets
 * @param id declared norm identifier, may be {@code null}
 * @param structure structural fields, may be {@code null}
 * @param contexts applicability contexts such as contract types or domains
 * @param derivedFrom {@code "source.norm"} reference this norm derives from, may be {@code null}
 */
public record ContextNorm(
    String sourceId,
    String key,
    String id,
    NormStructure structure,
    List<String> contexts,
    String derivedFrom
) {
    public ContextNorm {
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    @JsonCreator
    static ContextNorm fromJson(
        @JsonProperty("id") String id,
        @JsonProperty("estructura") NormStructure structure,
        @JsonProperty("contexto") List<String> contexts,
        @JsonProperty("derivadaDe") String derivedFrom
    ) {
        return new ContextNorm(null, null, id, structure, contexts, derivedFrom);
    }

    ContextNorm locatedAt(String sourceId, String key) {
        return new ContextNorm(sourceId, key, id, structure, contexts, derivedFrom);
    }

    public String action() {
        return structure != null ? structure.action() : null;
    }

    public String passive() {
        return structure != null ? structure.passive() : null;
    }

    public boolean hasContextIgnoreCase(String value) {
        for (String context : contexts) {
            if (context.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
