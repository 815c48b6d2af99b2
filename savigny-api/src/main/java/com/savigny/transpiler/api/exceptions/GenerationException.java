/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.exceptions;

/**
 * Raised when Kelsen code cannot be rendered, e.g. the schema has no institution.
 * No partial output accompanies this exception.
 */
public class GenerationException extends TranspilationException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
