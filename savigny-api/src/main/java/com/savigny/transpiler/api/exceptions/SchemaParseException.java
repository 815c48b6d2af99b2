/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.exceptions;

/**
 * Syntax error in a schema source, with the position of the offending token.
 */
public class SchemaParseException extends TranspilationException {

    private final int line;
    private final int column;

    public SchemaParseException(String message, int line, int column) {
        super(String.format("%s (line %d, column %d)", message, line, column));
        this.line = line;
        this.column = column;
    }

    public SchemaParseException(String message, int line, int column, Throwable cause) {
        super(String.format("%s (line %d, column %d)", message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
