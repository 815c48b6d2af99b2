/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

import com.savigny.transpiler.api.model.Institution;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import com.savigny.transpiler.compiler.context.ContextEngine;
import com.savigny.transpiler.compiler.context.ContextNorm;
import com.savigny.transpiler.compiler.context.LegalSource;
import com.savigny.transpiler.compiler.context.NormStructure;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Appends declarations derived from a legal-context corpus to generated code.
 *
 * <p>Every corpus norm whose conditions name the schema's institution becomes
 * a string, an asset and an obligation clause. When the norm's active and
 * passive roles are not the institution's canonical pair, a reciprocal asset
 * with the roles swapped is emitted as well. Related corpus norms found by
 * {@link ContextEngine#annotate} close the extension as comments.
 */
public final class ContextExtensionRenderer {

    private static final Logger logger = Logger.getLogger(ContextExtensionRenderer.class.getName());

    private static final String RULE =
        "// -------------------------------------------------------------------------\n";
    private static final String BANNER =
        "// =========================================================================\n";

    private final ContextEngine engine;
    private final ConfigurationValidator validator;
    private final AssetClassifier classifier;

    public ContextExtensionRenderer(ContextEngine engine, ConfigurationValidator validator) {
        this(engine, validator, KeywordAssetClassifier.forContextObjects());
    }

    public ContextExtensionRenderer(ContextEngine engine, ConfigurationValidator validator,
                                    AssetClassifier classifier) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Renders the extension block for a schema.
     *
     * @param baseCode code already generated for the schema, used to avoid string name clashes
     * @return the extension, or an empty string when the schema has no institution
     */
    public String render(Schema schema, String baseCode) {
        Institution institution = schema.getInstitution().orElse(null);
        if (institution == null) {
            return "";
        }
        String inst = institution.name();
        String[] canonical = canonicalRoles(inst);
        String base = baseCode == null ? "" : baseCode;

        StringBuilder strings = new StringBuilder();
        StringBuilder assets = new StringBuilder();
        StringBuilder clauses = new StringBuilder();
        Set<String> usedVariables = new HashSet<>();
        int rendered = 0;

        for (LegalSource source : engine.getContext().sources().values()) {
            assets.append(RULE).append("// Assets from ").append(source.id()).append('\n').append(RULE).append('\n');
            for (ContextNorm norm : source.norms().values()) {
                NormStructure structure = norm.structure();
                if (norm.id() == null || structure == null || structure.action() == null
                    || !structure.appliesTo(inst)) {
                    continue;
                }
                String variable = uniqueVariable(KelsenNames.contextVariable(structure.action()), base, usedVariables);
                strings.append(String.format("string %s = \"%s\";\n", variable, KelsenNames.sanitize(structure.action())));

                assets.append("// Source: ").append(source.displayName()).append(" - ").append(norm.id()).append('\n');
                if (norm.derivedFrom() != null) {
                    assets.append("// Derived from: ").append(norm.derivedFrom()).append('\n');
                }
                if (!norm.contexts().isEmpty()) {
                    assets.append("// Context: ").append(String.join(", ", norm.contexts())).append('\n');
                }
                assets.append("// Note: Applies to ").append(inst).append(" (in conditions list)\n");

                if (structure.active() != null && structure.passive() != null) {
                    renderAsset(norm, structure, variable, inst, canonical, assets, clauses);
                    assets.append('\n');
                }
                rendered++;
            }
        }
        logger.fine(String.format("Rendered %d legal context norms for %s", rendered, inst));

        StringBuilder out = new StringBuilder();
        out.append('\n').append(BANNER).append("// LEGAL CONTEXT EXTENSIONS\n").append(BANNER).append('\n');
        if (strings.length() > 0) {
            out.append("// String definitions for legal context actions\n").append(strings).append('\n');
        }
        out.append(assets);
        if (clauses.length() > 0) {
            out.append(RULE).append("// Obligation clauses from legal sources\n").append(RULE).append('\n');
            out.append(clauses);
        }
        appendAnnotations(schema, inst, out);
        return out.toString();
    }

    private void renderAsset(ContextNorm norm, NormStructure structure, String variable, String inst,
                             String[] canonical, StringBuilder assets, StringBuilder clauses) {
        String active = localRole(inst, structure.active());
        String passive = localRole(inst, structure.passive());
        String first = KelsenNames.subject(active);
        String second = KelsenNames.subject(passive);
        String key = norm.key();
        String operator = deonticSymbol(structure.deontic());
        AssetType type = classifier.classify(structure.object());
        String shape = type.isProperty() ? type.declaration() : type.declaration() + ", +";

        assets.append(String.format("asset %sAsset = %s, %s, %s, %s;\n", key, shape, first, variable, second));
        clauses.append(String.format("clause %s_obligation = { %s, %s(%sAsset) };\n", key, inst, operator, key));

        boolean canonicalPair =
            (active.equalsIgnoreCase(canonical[0]) && passive.equalsIgnoreCase(canonical[1]))
                || (active.equalsIgnoreCase(canonical[1]) && passive.equalsIgnoreCase(canonical[0]));
        if (!canonicalPair) {
            assets.append(String.format("asset %sAsset_Reciprocal = %s, %s, %s, %s;\n", key, shape, second, variable, first));
            clauses.append(String.format("clause %s_obligation_reciprocal = { %s, %s(%sAsset_Reciprocal) };\n",
                key, inst, operator, key));
        }
    }

    private void appendAnnotations(Schema schema, String inst, StringBuilder out) {
        StringBuilder annotations = new StringBuilder();
        for (Norm norm : schema.getUserAuthoredNorms()) {
            List<String> lines = engine.annotate(norm, inst);
            if (lines.isEmpty()) {
                continue;
            }
            annotations.append("// Norm ").append(norm.getId()).append(": ").append(norm.getAction()).append('\n');
            for (String line : lines) {
                annotations.append(line).append('\n');
            }
        }
        if (annotations.length() > 0) {
            out.append('\n').append(RULE).append("// Related legal context\n").append(RULE).append(annotations);
        }
    }

    // Roles the institution already declares are kept; others go through the context mappings.
    private String localRole(String institution, String role) {
        if (validator.isValidRoleForInstitution(institution, role)) {
            return role;
        }
        return engine.mapRole(institution, role);
    }

    // First two configured roles of the institution, else the generic pair.
    private String[] canonicalRoles(String institution) {
        List<String> roles = validator.rolesFor(institution);
        if (roles.size() >= 2) {
            return new String[] {roles.get(0), roles.get(1)};
        }
        return new String[] {"parte1", "parte2"};
    }

    static String uniqueVariable(String candidate, String baseCode, Set<String> used) {
        String name = candidate;
        if (clashes(name, baseCode, used)) {
            name = "legal_" + candidate;
            int suffix = 2;
            while (clashes(name, baseCode, used)) {
                name = "legal_" + candidate + "_" + suffix++;
            }
        }
        used.add(name);
        return name;
    }

    private static boolean clashes(String name, String baseCode, Set<String> used) {
        return used.contains(name) || baseCode.contains("string " + name + " =");
    }

    static String deonticSymbol(String deontic) {
        if (deontic == null) {
            return "OB";
        }
        return switch (deontic.toLowerCase(Locale.ROOT)) {
            case "prohibicion", "prohibición" -> "PR";
            case "privilegio" -> "PVG";
            case "derecho" -> "CR";
            default -> "OB";
        };
    }
}
