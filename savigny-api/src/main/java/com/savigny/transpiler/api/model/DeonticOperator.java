/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

/**
 * The four deontic modalities a norm or a violation consequence can carry.
 * Each operator knows the symbol it is rendered with in Kelsen clauses.
 */
public enum DeonticOperator {
    OBLIGATION("OB"),
    PROHIBITION("PR"),
    PRIVILEGE("PVG"),
    CLAIM_RIGHT("CR");

    private final String kelsenSymbol;

    DeonticOperator(String kelsenSymbol) {
        this.kelsenSymbol = kelsenSymbol;
    }

    public String kelsenSymbol() {
        return kelsenSymbol;
    }
}
