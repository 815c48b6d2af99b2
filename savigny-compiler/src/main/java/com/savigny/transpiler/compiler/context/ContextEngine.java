/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.context;

import com.savigny.transpiler.api.model.Norm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Queries over a legal-context corpus: role mapping with heuristic
 * inference, derivation relationships, domain-scoped retrieval, norm
 * validation and annotation.
 *
 * <p>Inference and annotation rely on fixed keyword heuristics and are
 * advisory. Nothing here throws on missing data; misses fall back to
 * identity or to empty results.
 */
public final class ContextEngine {

    private static final Logger logger = Logger.getLogger(ContextEngine.class.getName());

    static final String DEBTOR = "deudor";
    static final String DELIVERY_OBLIGOR = "obligado_entrega";
    static final String MAINTENANCE_OBLIGOR = "obligado_mantenimiento";
    static final String CONTRACTING_PARTY = "contratante";

    // Role noun mentioned in an action -> label of the secondary mapping.
    private static final Map<String, String> COUNTERPART_LABELS = orderedCounterparts();

    private static final List<String> KEY_VERBS = List.of("entregar", "pagar", "reparar", "garantizar", "transferir");
    private static final List<String> KEY_NOUNS = List.of("bien", "producto", "precio", "pago", "servicio", "inmueble");

    private final LegalContext context;

    public ContextEngine(LegalContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public LegalContext getContext() {
        return context;
    }

    /**
     * Looks up a norm by source identifier and norm key.
     */
    public Optional<ContextNorm> getNorm(String sourceId, String normKey) {
        LegalSource source = context.sources().get(sourceId);
        if (source == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(source.norms().get(normKey));
    }

    /**
     * Tests whether the first norm declares that it derives from the second.
     */
    public boolean hasRelationship(String sourceId, String normKey, String otherSourceId, String otherNormKey) {
        return getNorm(sourceId, normKey)
            .map(ContextNorm::derivedFrom)
            .map(derivedFrom -> derivedFrom.equals(otherSourceId + "." + otherNormKey))
            .orElse(false);
    }

    /**
     * Maps a generic role to the role used by a contract type: explicit
     * mapping first, then inferred mapping, then the generic role itself.
     */
    public String mapRole(String contractType, String genericRole) {
        if (contractType == null || genericRole == null) {
            return genericRole;
        }
        Optional<String> explicit = context.explicitMappings(contractType)
            .flatMap(table -> table.resolve(genericRole));
        if (explicit.isPresent()) {
            return explicit.get();
        }
        Optional<String> inferred = inferRoleMappings(contractType)
            .flatMap(table -> table.resolve(genericRole));
        if (inferred.isPresent()) {
            return inferred.get();
        }
        logger.fine(String.format("No mapping for role '%s' in '%s', keeping it unchanged", genericRole, contractType));
        return genericRole;
    }

    /**
     * Infers role mappings for a contract type from the corpus norms whose
     * contexts name it.
     *
     * <p>Each relevant norm maps a generic label derived from its action to
     * its passive role; a label seen with several roles maps to all of them.
     * Counterpart nouns mentioned in the action add secondary labels. Every
     * collected role finally maps back to its label unless it is already a key.
     *
     * @return the inferred table, or empty when nothing could be inferred
     */
    public Optional<RoleMappingTable> inferRoleMappings(String contractType) {
        if (contractType == null) {
            return Optional.empty();
        }
        RoleMappingTable.Builder builder = RoleMappingTable.builder();
        for (ContextNorm norm : context.allNorms()) {
            if (!norm.hasContextIgnoreCase(contractType)) {
                continue;
            }
            String passive = norm.passive();
            String action = norm.action();
            if (passive == null || action == null) {
                continue;
            }
            builder.add(genericLabel(action), passive);

            for (Map.Entry<String, String> counterpart : COUNTERPART_LABELS.entrySet()) {
                String noun = counterpart.getKey();
                if (action.contains(noun) && !passive.equals(noun)) {
                    builder.add(counterpart.getValue(), noun);
                }
            }
        }
        if (builder.isEmpty()) {
            logger.fine("No role mappings could be inferred for " + contractType);
            return Optional.empty();
        }
        return Optional.of(builder.withInverses().build());
    }

    static String genericLabel(String action) {
        if (action.contains("pagar")) {
            return DEBTOR;
        } else if (action.contains("entregar")) {
            return DELIVERY_OBLIGOR;
        } else if (action.contains("mantener") || action.contains("reparar")) {
            return MAINTENANCE_OBLIGOR;
        }
        return CONTRACTING_PARTY;
    }

    /**
     * Returns the corpus norms whose contexts equal the domain or are contained in it.
     */
    public List<ContextNorm> normsForDomain(String domain) {
        if (domain == null) {
            return List.of();
        }
        List<ContextNorm> result = new ArrayList<>();
        for (ContextNorm norm : context.allNorms()) {
            for (String item : norm.contexts()) {
                if (item.equals(domain) || domain.contains(item)) {
                    result.add(norm);
                    break;
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Checks that the norm's role is among the roles the institution's
     * explicit mapping table resolves to.
     */
    public boolean validateNorm(Norm norm, String institution) {
        if (norm == null || institution == null) {
            return false;
        }
        Optional<RoleMappingTable> table = context.explicitMappings(institution);
        if (table.isEmpty()) {
            return false;
        }
        for (List<String> targets : table.get().asMap().values()) {
            if (targets.contains(norm.getRole())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds corpus norms related to a schema norm and renders one comment line per match.
     *
     * <p>A corpus norm is related when both actions share a key verb, when its
     * object and the norm's scope share a key noun, or when its passive role
     * matches the norm's role directly or after mapping under the contract type.
     *
     * @param contractType contract type used to map passive roles
     * @return annotation lines of the form {@code // Related to <source>: <id> - <action>}
     */
    public List<String> annotate(Norm norm, String contractType) {
        List<String> annotations = new ArrayList<>();
        for (LegalSource source : context.sources().values()) {
            if (source.name() == null || source.type() == null) {
                continue;
            }
            for (ContextNorm candidate : source.norms().values()) {
                if (candidate.id() == null || candidate.action() == null) {
                    continue;
                }
                if (isRelated(norm, candidate, contractType)) {
                    annotations.add(String.format("// Related to %s: %s - %s",
                        source.name(), candidate.id(), candidate.action()));
                }
            }
        }
        return annotations;
    }

    private boolean isRelated(Norm norm, ContextNorm candidate, String contractType) {
        String action = norm.getAction();
        for (String verb : KEY_VERBS) {
            if (action.contains(verb) && candidate.action().contains(verb)) {
                return true;
            }
        }
        String object = candidate.structure().object();
        String scope = norm.getScope().orElse(null);
        if (object != null && scope != null) {
            for (String noun : KEY_NOUNS) {
                if (scope.contains(noun) && object.contains(noun)) {
                    return true;
                }
            }
        }
        String passive = candidate.passive();
        if (passive != null) {
            if (passive.equalsIgnoreCase(norm.getRole())) {
                return true;
            }
            return mapRole(contractType, passive).equalsIgnoreCase(norm.getRole());
        }
        return false;
    }

    private static Map<String, String> orderedCounterparts() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("comprador", "receptor");
        labels.put("vendedor", "proveedor");
        labels.put("arrendador", "propietario");
        labels.put("arrendatario", "usuario");
        return Collections.unmodifiableMap(labels);
    }
}
