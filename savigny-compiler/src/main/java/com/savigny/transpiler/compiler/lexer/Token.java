/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.lexer;

import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.DeonticOperator;

/**
 * A classified lexical unit.
 *
 * @param kind token kind
 * @param text raw text as it appeared in the source (without quotes for literals)
 * @param value semantic value: a {@link String}, an {@link Integer}, a
 *              {@link DeonticOperator}, a {@link ComplianceType}, or {@code null}
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenKind kind, String text, Object value, int line, int column) {

    public String stringValue() {
        return value instanceof String s ? s : text;
    }

    public int intValue() {
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalStateException("Token " + kind + " has no integer value");
    }

    public DeonticOperator deonticValue() {
        if (value instanceof DeonticOperator d) {
            return d;
        }
        throw new IllegalStateException("Token " + kind + " has no deontic value");
    }

    public ComplianceType complianceValue() {
        if (value instanceof ComplianceType c) {
            return c;
        }
        throw new IllegalStateException("Token " + kind + " has no compliance value");
    }

    @Override
    public String toString() {
        return kind + "('" + text + "' @" + line + ":" + column + ")";
    }
}
