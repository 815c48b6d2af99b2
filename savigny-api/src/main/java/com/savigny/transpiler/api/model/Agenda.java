/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A requested legal outcome: a role asks an adjudicator to establish
 * fulfillment or breach of the institution for the benefit of another role.
 *
 * <p>An essential agenda covers every norm of the schema; otherwise it lists
 * the remedies that follow, in order.
 */
public final class Agenda {

    private final String requestingRole;
    private final ComplianceType compliance;
    private final String institution;
    private final String beneficiaryRole;
    private final boolean essential;
    private final List<String> remedies = new ArrayList<>();

    public Agenda(String requestingRole, ComplianceType compliance, String institution,
                  String beneficiaryRole, boolean essential) {
        this.requestingRole = requireRole(requestingRole, "Requesting role");
        this.compliance = compliance != null ? compliance : ComplianceType.FULFILLED;
        this.institution = institution;
        this.beneficiaryRole = requireRole(beneficiaryRole, "Beneficiary role");
        this.essential = essential;
    }

    public String getRequestingRole() {
        return requestingRole;
    }

    public ComplianceType getCompliance() {
        return compliance;
    }

    /**
     * Institution named by the agenda, may be {@code null} when the agenda
     * refers implicitly to the schema's own institution.
     */
    public String getInstitution() {
        return institution;
    }

    public String getBeneficiaryRole() {
        return beneficiaryRole;
    }

    public boolean isEssential() {
        return essential;
    }

    public List<String> getRemedies() {
        return Collections.unmodifiableList(remedies);
    }

    public void addRemedy(String description) {
        remedies.add(Objects.requireNonNull(description, "description"));
    }

    private static String requireRole(String role, String label) {
        Objects.requireNonNull(role, label);
        if (role.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
        return role;
    }
}
