/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.Objects;

/**
 * A condition attached to a norm: either free text or a reference to another
 * norm of the same schema by identifier.
 */
public record NormCondition(String text, int referencedNormId) {

    private static final int NO_REFERENCE = -1;

    public NormCondition {
        if (text == null && referencedNormId == NO_REFERENCE) {
            throw new IllegalArgumentException("Condition needs either text or a norm reference");
        }
    }

    public static NormCondition text(String text) {
        return new NormCondition(Objects.requireNonNull(text, "text"), NO_REFERENCE);
    }

    public static NormCondition normReference(int normId) {
        if (normId < 0) {
            throw new IllegalArgumentException("Norm reference must be non-negative: " + normId);
        }
        return new NormCondition(null, normId);
    }

    public boolean isNormReference() {
        return text == null;
    }

    @Override
    public String toString() {
        return isNormReference() ? "regla " + referencedNormId : text;
    }
}
