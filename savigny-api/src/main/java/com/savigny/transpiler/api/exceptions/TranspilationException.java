/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.exceptions;

/**
 * Base class of every fatal transpilation failure.
 *
 * <p>Unchecked so that loading, parsing and generation can be composed without
 * threading checked exceptions through every stage.
 */
public class TranspilationException extends RuntimeException {

    public TranspilationException(String message) {
        super(message);
    }

    public TranspilationException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranspilationException(Throwable cause) {
        super(cause);
    }
}
