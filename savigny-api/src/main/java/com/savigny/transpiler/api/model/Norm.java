/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single deontic rule: a role, an operator and an action, optionally
 * narrowed by a scope and guarded by conditions.
 *
 * <p>Norms are built incrementally while parsing (scope and conditions
 * arrive after the head of the norm) and are read-only once generation starts.
 */
public final class Norm {

    private final int id;
    private final String role;
    private final DeonticOperator deontic;
    private final String action;
    private final NormOrigin origin;
    private final List<NormCondition> conditions = new ArrayList<>();
    private String scope;

    public Norm(int id, String role, DeonticOperator deontic, String action) {
        this(id, role, deontic, action, null);
    }

    public Norm(int id, String role, DeonticOperator deontic, String action, NormOrigin origin) {
        this.id = id;
        this.role = Objects.requireNonNull(role, "role");
        this.deontic = Objects.requireNonNull(deontic, "deontic");
        this.action = Objects.requireNonNull(action, "action");
        this.origin = origin;
    }

    public int getId() {
        return id;
    }

    public String getRole() {
        return role;
    }

    public DeonticOperator getDeontic() {
        return deontic;
    }

    public String getAction() {
        return action;
    }

    public Optional<String> getScope() {
        return Optional.ofNullable(scope);
    }

    /**
     * Sets the object the norm acts upon, replacing any previous scope.
     */
    public void setScope(String scope) {
        this.scope = scope;
    }

    public List<NormCondition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void addCondition(NormCondition condition) {
        conditions.add(Objects.requireNonNull(condition, "condition"));
    }

    public boolean isConditional() {
        return !conditions.isEmpty();
    }

    public Optional<NormOrigin> getOrigin() {
        return Optional.ofNullable(origin);
    }

    /**
     * User-authored norms come from the source document; everything else was
     * synthesized by enrichment and carries an origin.
     */
    public boolean isUserAuthored() {
        return origin == null;
    }

    @Override
    public String toString() {
        return "Norm{" + id + ", " + role + " " + deontic + " '" + action + "'}";
    }
}
