/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory representation of a parsed legal institution.
 *
 * <p>A schema exclusively owns its norms, violations, facts and agendas, and
 * keeps each collection in insertion order. It is built by a grammar-driven
 * builder, mutated in place by enrichment and read-only during generation.
 * Instances are not thread-safe.
 */
public final class Schema {

    private Institution institution;
    private final List<Norm> norms = new ArrayList<>();
    // norm identifier -> index in norms
    private final Int2IntOpenHashMap positions = newPositionIndex();
    private final List<Violation> violations = new ArrayList<>();
    private final List<LegalFact> facts = new ArrayList<>();
    private final List<Agenda> agendas = new ArrayList<>();

    public Optional<Institution> getInstitution() {
        return Optional.ofNullable(institution);
    }

    /**
     * Sets the institution, replacing any previous values.
     */
    public void setInstitution(String name, InstitutionType type, Multiplicity multiplicity, String legalDomain) {
        this.institution = new Institution(name, type, multiplicity, legalDomain);
    }

    public void setInstitution(Institution institution) {
        this.institution = Objects.requireNonNull(institution, "institution");
    }

    /**
     * Appends a norm.
     *
     * @throws IllegalArgumentException if a norm with the same identifier already exists
     */
    public void addNorm(Norm norm) {
        Objects.requireNonNull(norm, "norm");
        if (positions.containsKey(norm.getId())) {
            throw new IllegalArgumentException("Duplicate norm identifier: " + norm.getId());
        }
        positions.put(norm.getId(), norms.size());
        norms.add(norm);
    }

    public void addViolation(Violation violation) {
        violations.add(Objects.requireNonNull(violation, "violation"));
    }

    public void addFact(LegalFact fact) {
        facts.add(Objects.requireNonNull(fact, "fact"));
    }

    public void addAgenda(Agenda agenda) {
        agendas.add(Objects.requireNonNull(agenda, "agenda"));
    }

    public List<Norm> getNorms() {
        return Collections.unmodifiableList(norms);
    }

    public List<Violation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public List<LegalFact> getFacts() {
        return Collections.unmodifiableList(facts);
    }

    public List<Agenda> getAgendas() {
        return Collections.unmodifiableList(agendas);
    }

    public Optional<Norm> findNorm(int id) {
        int index = positions.get(id);
        return index < 0 ? Optional.empty() : Optional.of(norms.get(index));
    }

    /**
     * Returns the 1-based position of the norm with the given identifier, or
     * {@code -1} when no such norm exists.
     */
    public int ordinalOf(int id) {
        int index = positions.get(id);
        return index < 0 ? -1 : index + 1;
    }

    public boolean containsOrigin(NormOrigin origin) {
        for (Norm norm : norms) {
            if (origin.equals(norm.getOrigin().orElse(null))) {
                return true;
            }
        }
        return false;
    }

    public List<Norm> getUserAuthoredNorms() {
        List<Norm> result = new ArrayList<>();
        for (Norm norm : norms) {
            if (norm.isUserAuthored()) {
                result.add(norm);
            }
        }
        return result;
    }

    private static Int2IntOpenHashMap newPositionIndex() {
        Int2IntOpenHashMap map = new Int2IntOpenHashMap();
        map.defaultReturnValue(-1);
        return map;
    }
}
