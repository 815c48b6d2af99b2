/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.lexer;

/**
 * Classified token kinds handed to the grammar builder.
 */
public enum TokenKind {
    STRING,
    INSTITUTION,
    NUMBER,
    NORM_REFERENCE,
    OBLIGATION,
    PROHIBITION,
    PRIVILEGE,
    CLAIM_RIGHT,
    CONDITIONAL,
    CONJUNCTION,
    VIOLATION,
    THEN,
    FACT,
    EVIDENCE,
    SEEK,
    ESTABLISH,
    FULFILLED,
    BREACHED,
    ADJUDICATE,
    ESSENTIAL,
    FOLLOWING,
    SCOPE,
    INSTITUTION_TYPE,
    MULTIPLICITY,
    LEGAL_DOMAIN,
    ROLE,
    INSTITUTION_NAME,
    END;

    public boolean isDeontic() {
        return this == OBLIGATION || this == PROHIBITION || this == PRIVILEGE || this == CLAIM_RIGHT;
    }
}
