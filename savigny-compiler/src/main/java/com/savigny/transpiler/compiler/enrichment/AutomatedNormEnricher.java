/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.enrichment;

import com.savigny.transpiler.api.model.Institution;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.NormOrigin;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.compiler.config.AutomatedNorms;
import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import com.savigny.transpiler.compiler.config.NormTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Appends configured norms to a schema in three ordered tiers.
 *
 * <ol>
 *   <li>Domain defaults: every default norm configured for the schema's legal domain.</li>
 *   <li>Universal templates: every template of the domain, once per user-authored norm,
 *       with {@value #RULE_ID_PLACEHOLDER} and {@value #RULE_ACTION_PLACEHOLDER} substituted.</li>
 *   <li>Conditional on identifier: the norms configured under a user-authored norm's identifier.</li>
 * </ol>
 *
 * <p>Generated identifiers start at the next full hundred above the highest
 * user-authored identifier and are shared across tiers. Each generated norm
 * records its {@link NormOrigin}; a template whose origin is already present
 * is skipped, so enriching twice adds nothing the second time.
 */
public final class AutomatedNormEnricher {

    private static final Logger logger = Logger.getLogger(AutomatedNormEnricher.class.getName());

    public static final String RULE_ID_PLACEHOLDER = "%{rule_id}";
    public static final String RULE_ACTION_PLACEHOLDER = "%{rule_action}";

    private final ConfigurationValidator validator;

    public AutomatedNormEnricher(ConfigurationValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Counts of norms added by each tier.
     */
    public record EnrichmentResult(int domainDefaults, int templateNorms, int conditionalNorms) {
        public int total() {
            return domainDefaults + templateNorms + conditionalNorms;
        }
    }

    public EnrichmentResult enrich(Schema schema) {
        Objects.requireNonNull(schema, "schema");
        Optional<Institution> institution = schema.getInstitution();
        if (institution.isEmpty() || institution.get().legalDomain() == null) {
            logger.fine("Schema has no legal domain, skipping enrichment");
            return new EnrichmentResult(0, 0, 0);
        }
        AutomatedNorms automated = validator.getAutomatedNorms();
        if (automated.isEmpty()) {
            return new EnrichmentResult(0, 0, 0);
        }

        String domain = institution.get().legalDomain();
        List<Norm> userNorms = schema.getUserAuthoredNorms();
        IdSequence ids = new IdSequence(firstGeneratedId(schema));

        int defaults = applyDomainDefaults(schema, domain, lookup(automated.domainDefaults(), domain), ids);
        int templates = applyUniversalTemplates(schema, userNorms, domain,
            lookup(automated.universalTemplates(), domain), ids);
        int conditionals = applyConditionalOnId(schema, userNorms, automated.conditionalOnId(), ids);

        EnrichmentResult result = new EnrichmentResult(defaults, templates, conditionals);
        if (result.total() > 0) {
            logger.info(String.format("Enriched schema with %d automated norms (defaults=%d, templates=%d, conditional=%d)",
                result.total(), defaults, templates, conditionals));
        }
        return result;
    }

    /**
     * Next full hundred above the highest user identifier, moved past any
     * identifier already taken by earlier generated norms.
     */
    static int firstGeneratedId(Schema schema) {
        int maxUserId = 0;
        int maxId = 0;
        for (Norm norm : schema.getNorms()) {
            maxId = Math.max(maxId, norm.getId());
            if (norm.isUserAuthored()) {
                maxUserId = Math.max(maxUserId, norm.getId());
            }
        }
        int threshold = (maxUserId / 100 + 1) * 100;
        return Math.max(threshold, maxId + 1);
    }

    private int applyDomainDefaults(Schema schema, String domain, List<NormTemplate> templates, IdSequence ids) {
        int added = 0;
        for (int i = 0; i < templates.size(); i++) {
            NormOrigin origin = new NormOrigin(NormOrigin.Tier.DOMAIN_DEFAULT, domain, i);
            Optional<Norm> norm = instantiate(schema, templates.get(i), withReference(templates.get(i)), origin, ids, true);
            if (norm.isPresent()) {
                logger.fine(String.format("Added default norm %d for domain %s: %s",
                    norm.get().getId(), domain, norm.get().getAction()));
                added++;
            }
        }
        return added;
    }

    private int applyUniversalTemplates(Schema schema, List<Norm> userNorms, String domain,
                                        List<NormTemplate> templates, IdSequence ids) {
        if (templates.isEmpty()) {
            return 0;
        }
        int added = 0;
        for (Norm userNorm : userNorms) {
            for (int i = 0; i < templates.size(); i++) {
                NormTemplate template = templates.get(i);
                if (!template.isComplete()) {
                    logger.warning("Skipping incomplete universal template " + i + " for domain " + domain);
                    continue;
                }
                String action = substitute(template.action(), userNorm);
                NormOrigin origin = new NormOrigin(NormOrigin.Tier.UNIVERSAL_TEMPLATE, String.valueOf(userNorm.getId()), i);
                Optional<Norm> norm = instantiate(schema, template, action, origin, ids, false);
                if (norm.isPresent()) {
                    logger.fine(String.format("Added template-based norm %d for rule %d: %s",
                        norm.get().getId(), userNorm.getId(), action));
                    added++;
                }
            }
        }
        return added;
    }

    private int applyConditionalOnId(Schema schema, List<Norm> userNorms,
                                     Map<String, List<NormTemplate>> conditionalOnId, IdSequence ids) {
        if (conditionalOnId.isEmpty()) {
            return 0;
        }
        int added = 0;
        for (Norm userNorm : userNorms) {
            String trigger = String.valueOf(userNorm.getId());
            List<NormTemplate> templates = conditionalOnId.getOrDefault(trigger, List.of());
            for (int i = 0; i < templates.size(); i++) {
                NormOrigin origin = new NormOrigin(NormOrigin.Tier.CONDITIONAL_ON_ID, trigger, i);
                Optional<Norm> norm = instantiate(schema, templates.get(i), withReference(templates.get(i)), origin, ids, true);
                if (norm.isPresent()) {
                    logger.fine(String.format("Added conditional norm %d triggered by rule %d: %s",
                        norm.get().getId(), userNorm.getId(), norm.get().getAction()));
                    added++;
                }
            }
        }
        return added;
    }

    private Optional<Norm> instantiate(Schema schema, NormTemplate template, String action,
                                       NormOrigin origin, IdSequence ids, boolean applyScope) {
        if (!template.isComplete()) {
            logger.warning("Skipping incomplete automated norm " + origin);
            return Optional.empty();
        }
        if (schema.containsOrigin(origin)) {
            return Optional.empty();
        }
        Norm norm = new Norm(ids.next(), template.role(), validator.mapDeontic(template.deontic()), action, origin);
        if (applyScope && template.scope() != null) {
            norm.setScope(template.scope());
        }
        schema.addNorm(norm);
        return Optional.of(norm);
    }

    private static String withReference(NormTemplate template) {
        if (template.action() == null || template.reference() == null) {
            return template.action();
        }
        return template.action() + " [Ref: " + template.reference() + "]";
    }

    static String substitute(String template, Norm trigger) {
        return template
            .replace(RULE_ID_PLACEHOLDER, String.valueOf(trigger.getId()))
            .replace(RULE_ACTION_PLACEHOLDER, trigger.getAction());
    }

    // Exact key first, then ignoring case.
    private static List<NormTemplate> lookup(Map<String, List<NormTemplate>> byDomain, String domain) {
        List<NormTemplate> exact = byDomain.get(domain);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, List<NormTemplate>> entry : byDomain.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(domain)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    private static final class IdSequence {
        private int next;

        IdSequence(int first) {
            this.next = first;
        }

        int next() {
            return next++;
        }
    }
}
