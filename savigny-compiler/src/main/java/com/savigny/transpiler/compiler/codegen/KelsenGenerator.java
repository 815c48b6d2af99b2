/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

import com.savigny.transpiler.api.exceptions.GenerationException;
import com.savigny.transpiler.api.model.Agenda;
import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.Institution;
import com.savigny.transpiler.api.model.LegalFact;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.NormCondition;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.api.model.Violation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Renders an enriched schema as a Kelsen program.
 *
 * <p>Sections are emitted in a fixed order: action strings, subjects, the
 * base institution asset, norm assets with their clauses, violation clauses,
 * facts and agendas. Norm assets are named after the first word of the
 * action and the norm's 1-based position, e.g. {@code PagarAsset1}.
 *
 * <p>Asset targets are the other of the first two roles discovered across
 * norms, violations and agendas, or {@value #PLACEHOLDER} when fewer than two
 * roles exist.
 */
public final class KelsenGenerator {

    private static final Logger logger = Logger.getLogger(KelsenGenerator.class.getName());

    public static final String PLACEHOLDER = "PLACEHOLDER";

    private final AssetClassifier classifier;

    public KelsenGenerator() {
        this(KeywordAssetClassifier.forNormScopes());
    }

    public KelsenGenerator(AssetClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Generates the Kelsen program for a schema.
     *
     * @throws GenerationException if the schema is absent or has no institution
     */
    public String generate(Schema schema) {
        if (schema == null) {
            throw new GenerationException("No schema to generate code from");
        }
        Institution institution = schema.getInstitution()
            .orElseThrow(() -> new GenerationException("Schema has no institution"));

        RenderContext ctx = new RenderContext(schema, institution, discoverRoles(schema));
        StringBuilder out = new StringBuilder(4096);
        renderStrings(ctx, out);
        renderSubjects(ctx, out);
        renderBaseAsset(ctx, out);
        renderNorms(ctx, out);
        renderViolations(ctx, out);
        renderFacts(ctx, out);
        renderAgendas(ctx, out);
        return out.toString();
    }

    /**
     * Name of the asset generated for the norm at the given 1-based position.
     */
    public static String normAssetName(Norm norm, int ordinal) {
        return KelsenNames.assetStem(norm.getAction()) + "Asset" + ordinal;
    }

    static List<String> discoverRoles(Schema schema) {
        Set<String> roles = new LinkedHashSet<>();
        for (Norm norm : schema.getNorms()) {
            roles.add(norm.getRole());
        }
        for (Violation violation : schema.getViolations()) {
            roles.add(violation.getRole());
        }
        for (Agenda agenda : schema.getAgendas()) {
            roles.add(agenda.getRequestingRole());
            roles.add(agenda.getBeneficiaryRole());
        }
        return new ArrayList<>(roles);
    }

    private void renderStrings(RenderContext ctx, StringBuilder out) {
        out.append("// String definitions for actions\n");
        out.append("string ").append(ctx.institutionLower)
            .append(" = \"acuerda ").append(ctx.institutionLower).append("\";\n");
        List<Norm> norms = ctx.schema.getNorms();
        for (int i = 0; i < norms.size(); i++) {
            Norm norm = norms.get(i);
            out.append("string ").append(KelsenNames.stringName(norm.getAction(), i + 1))
                .append(" = \"").append(KelsenNames.sanitize(norm.getAction())).append("\";\n");
        }
        out.append('\n');
    }

    private void renderSubjects(RenderContext ctx, StringBuilder out) {
        out.append("// Subject declarations\n");
        for (String role : ctx.roles) {
            out.append(String.format(
                "subject %s = \"Placeholder %s\", \"Placeholder address\", 12345678, \"placeholder%s@example.com\";\n",
                KelsenNames.subject(role), role, role));
        }
        out.append('\n');
    }

    private void renderBaseAsset(RenderContext ctx, StringBuilder out) {
        String first = ctx.roles.size() >= 2 ? KelsenNames.subject(ctx.roles.get(0)) : PLACEHOLDER;
        String second = ctx.roles.size() >= 2 ? KelsenNames.subject(ctx.roles.get(1)) : PLACEHOLDER;
        out.append("// Base contract asset\n");
        out.append("asset ").append(ctx.institutionName).append(" = Service, +, ")
            .append(first).append(", ").append(ctx.institutionLower).append(", ").append(second).append(";\n\n");
    }

    private void renderNorms(RenderContext ctx, StringBuilder out) {
        out.append("// Norm assets\n");
        List<Norm> norms = ctx.schema.getNorms();
        for (int i = 0; i < norms.size(); i++) {
            Norm norm = norms.get(i);
            int ordinal = i + 1;
            String assetName = normAssetName(norm, ordinal);
            String role = KelsenNames.subject(norm.getRole());
            String target = ctx.targetFor(norm.getRole());
            String stringName = KelsenNames.stringName(norm.getAction(), ordinal);

            AssetType type = classifier.classify(norm.getScope().orElse(null));
            if (type.isProperty()) {
                out.append(String.format("asset %s = %s, %s, %s, %s;\n",
                    assetName, type.declaration(), role, stringName, target));
            } else {
                String polarity = classifier.isOmission(norm.getAction()) ? "-" : "+";
                out.append(String.format("asset %s = %s, %s, %s, %s, %s;\n",
                    assetName, type.declaration(), polarity, role, stringName, target));
            }

            StringJoiner premise = new StringJoiner(" AND ");
            premise.add(ctx.institutionName);
            List<String> textConditions = new ArrayList<>();
            for (NormCondition condition : norm.getConditions()) {
                if (condition.isNormReference()) {
                    String referenced = referencedAsset(ctx, norm, condition.referencedNormId());
                    if (referenced != null) {
                        premise.add(referenced);
                    }
                } else {
                    textConditions.add(KelsenNames.sanitize(condition.text()));
                }
            }
            if (!textConditions.isEmpty()) {
                out.append("// Conditional norm\n");
                out.append(String.format("string condition%d = \"%s\";\n", ordinal, String.join(" y ", textConditions)));
                out.append(String.format("asset Condition%d = Service, +, %s, condition%d, %s;\n",
                    ordinal, role, ordinal, target));
                premise.add("Condition" + ordinal);
            }
            out.append(String.format("clause norm%d = { %s, %s(%s) };\n",
                ordinal, premise, norm.getDeontic().kelsenSymbol(), assetName));
        }
        out.append('\n');
    }

    private String referencedAsset(RenderContext ctx, Norm norm, int referencedId) {
        int ordinal = ctx.schema.ordinalOf(referencedId);
        if (ordinal < 0) {
            logger.warning(String.format("Norm %d references unknown norm %d, condition ignored",
                norm.getId(), referencedId));
            return null;
        }
        return normAssetName(ctx.schema.getNorms().get(ordinal - 1), ordinal);
    }

    private void renderViolations(RenderContext ctx, StringBuilder out) {
        List<Violation> violations = ctx.schema.getViolations();
        if (violations.isEmpty()) {
            return;
        }
        out.append("// Violation clauses\n");
        for (int i = 0; i < violations.size(); i++) {
            Violation violation = violations.get(i);
            int ordinal = i + 1;
            String role = KelsenNames.subject(violation.getRole());
            String target = ctx.targetFor(violation.getRole());
            String stem = KelsenNames.assetStem(violation.getConsequence());
            String consequence = KelsenNames.sanitize(violation.getConsequence());
            String deontic = violation.getDeontic().kelsenSymbol();

            if (!violation.isCompound()) {
                int normId = violation.getViolatedNormIds().getInt(0);
                int normOrdinal = ctx.schema.ordinalOf(normId);
                if (normOrdinal < 0) {
                    logger.warning("Violation " + ordinal + " references unknown norm " + normId + ", skipped");
                    continue;
                }
                String normAsset = normAssetName(ctx.schema.getNorms().get(normOrdinal - 1), normOrdinal);
                out.append(String.format("string violation_string_%d = \"%s\";\n", ordinal, consequence));
                out.append(String.format("asset %sConsequence%d = Service, +, %s, violation_string_%d, %s;\n",
                    stem, ordinal, role, ordinal, target));
                out.append(String.format("clause viol_clause_%d = { not(%s), %s(%sConsequence%d) };\n",
                    ordinal, normAsset, deontic, stem, ordinal));
            } else {
                int firstId = violation.getViolatedNormIds().getInt(0);
                int secondId = violation.getViolatedNormIds().getInt(1);
                out.append(String.format("// Compound violation for norms %d and %d\n", firstId, secondId));
                out.append(String.format("string compound_violation_string_%d = \"%s\";\n", ordinal, consequence));
                out.append(String.format("asset %sCompoundConsequence%d = Service, +, %s, compound_violation_string_%d, %s;\n",
                    stem, ordinal, role, ordinal, target));
                out.append(String.format("clause compound_viol_clause_%d = { not(%s) AND not(%s), %s(%sCompoundConsequence%d) };\n",
                    ordinal, assetOrUnknown(ctx, firstId), assetOrUnknown(ctx, secondId), deontic, stem, ordinal));
            }
        }
        out.append('\n');
    }

    private String assetOrUnknown(RenderContext ctx, int normId) {
        int ordinal = ctx.schema.ordinalOf(normId);
        if (ordinal < 0) {
            logger.warning("Compound violation references unknown norm " + normId);
            return "UnknownAsset" + normId;
        }
        return normAssetName(ctx.schema.getNorms().get(ordinal - 1), ordinal);
    }

    private void renderFacts(RenderContext ctx, StringBuilder out) {
        List<LegalFact> facts = ctx.schema.getFacts();
        if (facts.isEmpty()) {
            return;
        }
        out.append("// Facts\n");
        for (int i = 0; i < facts.size(); i++) {
            LegalFact fact = facts.get(i);
            out.append(String.format("fact %s = %s, \"%s\", \"%s\";\n",
                KelsenNames.factIdentifier(fact.description(), i + 1),
                relatedAsset(ctx, fact),
                KelsenNames.sanitize(fact.description()),
                KelsenNames.sanitize(fact.evidence())));
        }
        out.append('\n');
    }

    // First norm whose action appears in the fact description, else the institution asset.
    private static String relatedAsset(RenderContext ctx, LegalFact fact) {
        List<Norm> norms = ctx.schema.getNorms();
        for (int i = 0; i < norms.size(); i++) {
            if (fact.description().contains(norms.get(i).getAction())) {
                return normAssetName(norms.get(i), i + 1);
            }
        }
        return ctx.institutionName;
    }

    private void renderAgendas(RenderContext ctx, StringBuilder out) {
        List<Agenda> agendas = ctx.schema.getAgendas();
        if (agendas.isEmpty()) {
            return;
        }
        out.append("// Agendas\n");
        for (int i = 0; i < agendas.size(); i++) {
            Agenda agenda = agendas.get(i);
            boolean fulfilled = agenda.getCompliance() == ComplianceType.FULFILLED;
            String requester = agenda.getRequestingRole();
            String id = Character.toUpperCase(requester.charAt(0)) + requester.substring(1)
                + (fulfilled ? "Fulfillment" : "Breach") + (i + 1);

            out.append("agenda ").append(id).append(" = ").append(fulfilled ? "FULFILL" : "BREACH")
                .append(" {").append(ctx.institutionName);
            if (agenda.isEssential()) {
                List<Norm> norms = ctx.schema.getNorms();
                for (int n = 0; n < norms.size(); n++) {
                    out.append(", ").append(normAssetName(norms.get(n), n + 1));
                }
                out.append("};\n");
            } else if (!agenda.getRemedies().isEmpty()) {
                // One comment line per remedy; the closing brace stays outside the comments.
                for (String remedy : agenda.getRemedies()) {
                    out.append("\n    // ").append(KelsenNames.sanitize(remedy));
                }
                out.append("\n};\n");
            } else {
                out.append("};\n");
            }
        }
    }

    private static final class RenderContext {
        final Schema schema;
        final String institutionName;
        final String institutionLower;
        final List<String> roles;

        RenderContext(Schema schema, Institution institution, List<String> roles) {
            this.schema = schema;
            this.institutionName = institution.name();
            this.institutionLower = institution.name().toLowerCase(Locale.ROOT);
            this.roles = roles;
        }

        String targetFor(String role) {
            if (roles.size() < 2) {
                return PLACEHOLDER;
            }
            return KelsenNames.subject(roles.get(0).equals(role) ? roles.get(1) : roles.get(0));
        }
    }
}
