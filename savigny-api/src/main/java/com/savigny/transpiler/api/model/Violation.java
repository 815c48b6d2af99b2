/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;

/**
 * Consequence attached to the breach of one norm, or of two norms jointly.
 */
public final class Violation {

    private final IntList violatedNormIds;
    private final String role;
    private final DeonticOperator deontic;
    private final String consequence;

    private Violation(IntList violatedNormIds, String role, DeonticOperator deontic, String consequence) {
        this.violatedNormIds = IntLists.unmodifiable(violatedNormIds);
        this.role = Objects.requireNonNull(role, "role");
        this.deontic = deontic != null ? deontic : DeonticOperator.CLAIM_RIGHT;
        this.consequence = Objects.requireNonNull(consequence, "consequence");
    }

    /**
     * Creates a violation of a single norm.
     *
     * @param deontic consequence operator, {@code null} for the claim-right default
     */
    public static Violation single(int normId, String role, DeonticOperator deontic, String consequence) {
        return new Violation(IntArrayList.of(normId), role, deontic, consequence);
    }

    /**
     * Creates a violation that requires both norms to be breached.
     *
     * @param deontic consequence operator, {@code null} for the claim-right default
     */
    public static Violation compound(int firstNormId, int secondNormId, String role,
                                     DeonticOperator deontic, String consequence) {
        return new Violation(IntArrayList.of(firstNormId, secondNormId), role, deontic, consequence);
    }

    public IntList getViolatedNormIds() {
        return violatedNormIds;
    }

    public boolean isCompound() {
        return violatedNormIds.size() == 2;
    }

    public String getRole() {
        return role;
    }

    public DeonticOperator getDeontic() {
        return deontic;
    }

    public String getConsequence() {
        return consequence;
    }
}
