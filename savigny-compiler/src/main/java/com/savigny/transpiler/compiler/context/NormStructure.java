/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structural fields of a corpus norm. Every field except the condition list may be {@code null}.
 *
 * @param conditions institutions the norm applies to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormStructure(
    @JsonProperty("accion") String action,
    @JsonProperty("activo") String active,
    @JsonProperty("pasivo") String passive,
    @JsonProperty("objeto") String object,
    @JsonProperty("deontico") String deontic,
    @JsonProperty("condiciones") List<String> conditions
) {
    public NormStructure {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean appliesTo(String institution) {
        for (String condition : conditions) {
            if (condition.equalsIgnoreCase(institution)) {
                return true;
            }
        }
        return false;
    }
}
