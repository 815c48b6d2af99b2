/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.DeonticOperator;
import com.savigny.transpiler.api.model.InstitutionType;
import com.savigny.transpiler.api.model.Multiplicity;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Validates schema vocabulary against a configuration document and maps
 * free-text keywords onto model enumerations.
 *
 * <p>Membership tests are case-insensitive. Suggestions are the configured
 * entry closest by {@link EditDistance}, offered only within
 * {@value #MAX_SUGGESTION_DISTANCE} edits; the first entry wins on ties.
 *
 * <p>The only state besides the document is the current institution used
 * by role validation and role suggestion.
 */
public final class ConfigurationValidator {

    private static final Logger logger = Logger.getLogger(ConfigurationValidator.class.getName());

    public static final int MAX_SUGGESTION_DISTANCE = 3;

    private final ConfigurationDocument document;
    private String currentInstitution;

    public ConfigurationValidator(ConfigurationDocument document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public ConfigurationDocument getDocument() {
        return document;
    }

    public void setCurrentInstitution(String institution) {
        this.currentInstitution = institution;
    }

    public Optional<String> getCurrentInstitution() {
        return Optional.ofNullable(currentInstitution);
    }

    public AutomatedNorms getAutomatedNorms() {
        return document.automatedNorms();
    }

    public boolean isValidInstitution(String institution) {
        return containsIgnoreCase(document.institutions(), institution);
    }

    public boolean isValidType(String type) {
        return containsIgnoreCase(document.types(), type);
    }

    public boolean isValidDomain(String domain) {
        return containsIgnoreCase(document.domains(), domain);
    }

    /**
     * Checks the role against the current institution's vocabulary.
     * Always false while no institution is set.
     */
    public boolean isValidRole(String role) {
        return currentInstitution != null && isValidRoleForInstitution(currentInstitution, role);
    }

    public boolean isValidRoleForInstitution(String institution, String role) {
        return containsIgnoreCase(rolesFor(institution), role);
    }

    /**
     * Returns the configured roles of an institution in document order. The
     * institution key is matched exactly first, then ignoring case.
     */
    public List<String> rolesFor(String institution) {
        if (institution == null) {
            return List.of();
        }
        Map<String, List<String>> roles = document.roles();
        List<String> exact = roles.get(institution);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, List<String>> entry : roles.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(institution)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public DeonticOperator mapDeontic(String text) {
        if (text == null) {
            return DeonticOperator.OBLIGATION;
        }
        if (text.equalsIgnoreCase("debe")) {
            return DeonticOperator.OBLIGATION;
        } else if (text.equalsIgnoreCase("no-debe")) {
            return DeonticOperator.PROHIBITION;
        } else if (text.equalsIgnoreCase("puede")) {
            return DeonticOperator.PRIVILEGE;
        } else if (text.equalsIgnoreCase("tiene-derecho-a")) {
            return DeonticOperator.CLAIM_RIGHT;
        }
        logger.fine("Unrecognized deontic keyword '" + text + "', defaulting to OBLIGATION");
        return DeonticOperator.OBLIGATION;
    }

    public InstitutionType mapInstitutionType(String text) {
        if (text == null) {
            return InstitutionType.CONTRACT;
        }
        if (text.equalsIgnoreCase("contrato")) {
            return InstitutionType.CONTRACT;
        } else if (text.equalsIgnoreCase("procedimiento")) {
            return InstitutionType.PROCEDURE;
        } else if (text.equalsIgnoreCase("acto jurídico") || text.equalsIgnoreCase("acto-juridico")) {
            return InstitutionType.LEGAL_ACT;
        } else if (text.equalsIgnoreCase("hecho jurídico") || text.equalsIgnoreCase("hecho-juridico")) {
            return InstitutionType.LEGAL_FACT;
        }
        logger.fine("Unrecognized institution type '" + text + "', defaulting to CONTRACT");
        return InstitutionType.CONTRACT;
    }

    public Multiplicity mapMultiplicity(String text) {
        if (text == null) {
            return Multiplicity.MULTIPLE;
        }
        if (text.equalsIgnoreCase("múltiples") || text.equalsIgnoreCase("multiples")
            || text.equalsIgnoreCase("multiple")) {
            return Multiplicity.MULTIPLE;
        } else if (text.equalsIgnoreCase("una") || text.equalsIgnoreCase("un")
            || text.equalsIgnoreCase("single")) {
            return Multiplicity.SINGLE;
        }
        return Multiplicity.MULTIPLE;
    }

    public ComplianceType mapCompliance(String text) {
        if (text != null && text.equalsIgnoreCase("incumplimiento")) {
            return ComplianceType.BREACHED;
        }
        return ComplianceType.FULFILLED;
    }

    public Optional<String> suggestInstitution(String institution) {
        return closest(document.institutions(), institution);
    }

    /**
     * Suggests a role of the current institution. Empty while no institution is set.
     */
    public Optional<String> suggestRole(String role) {
        if (currentInstitution == null) {
            return Optional.empty();
        }
        return closest(rolesFor(currentInstitution), role);
    }

    // Exact matches are already valid, so they get no suggestion.
    private static Optional<String> closest(List<String> candidates, String input) {
        if (input == null || containsIgnoreCase(candidates, input)) {
            return Optional.empty();
        }
        int minDistance = Integer.MAX_VALUE;
        String suggestion = null;
        for (String candidate : candidates) {
            int distance = EditDistance.between(input, candidate);
            if (distance < minDistance && distance <= MAX_SUGGESTION_DISTANCE) {
                minDistance = distance;
                suggestion = candidate;
            }
        }
        return Optional.ofNullable(suggestion);
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (candidate == null) {
            return false;
        }
        for (String value : values) {
            if (value.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }
}
