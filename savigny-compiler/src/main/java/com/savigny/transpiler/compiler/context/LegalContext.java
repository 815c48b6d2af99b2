/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable handle on a loaded legal-context document.
 *
 * <h2>Format</h2>
 * <pre>
 * {
 *   "sources": {
 *     "codigo_civil": {
 *       "nombre": "Código Civil", "tipo": "codigo",
 *       "normas": {
 *         "art1": {
 *           "id": "1", "estructura": { "accion": ..., "activo": ..., "pasivo": ..., "objeto": ...,
 *                                      "deontico": ..., "condiciones": ["CompraVenta"] },
 *           "contexto": ["compraventa"], "derivadaDe": "otra_fuente.art2"
 *         }
 *       }
 *     }
 *   },
 *   "roleMappings": { "CompraVenta": { "deudor": "comprador", "parte": ["comprador", "vendedor"] } }
 * }
 * </pre>
 *
 * @param sources sources keyed by identifier, in document order
 * @param roleMappings explicit role mappings keyed by contract type
 */
public record LegalContext(Map<String, LegalSource> sources, Map<String, RoleMappingTable> roleMappings) {

    public LegalContext {
        sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        roleMappings = roleMappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(roleMappings));
    }

    @JsonCreator
    static LegalContext fromJson(
        @JsonProperty("sources") Map<String, LegalSource> sources,
        @JsonProperty("roleMappings") Map<String, Map<String, JsonNode>> roleMappings
    ) {
        Map<String, LegalSource> located = new LinkedHashMap<>();
        if (sources != null) {
            sources.forEach((id, source) -> {
                if (source != null) {
                    located.put(id, source.withId(id));
                }
            });
        }
        Map<String, RoleMappingTable> tables = new LinkedHashMap<>();
        if (roleMappings != null) {
            roleMappings.forEach((contractType, table) -> tables.put(contractType, RoleMappingTable.fromJson(table)));
        }
        return new LegalContext(located, tables);
    }

    public static LegalContext empty() {
        return new LegalContext(null, null);
    }

    public Optional<RoleMappingTable> explicitMappings(String contractType) {
        return Optional.ofNullable(roleMappings.get(contractType));
    }

    /**
     * All corpus norms, source by source, in document order.
     */
    public List<ContextNorm> allNorms() {
        List<ContextNorm> norms = new ArrayList<>();
        for (LegalSource source : sources.values()) {
            norms.addAll(source.norms().values());
        }
        return norms;
    }
}
