/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.exceptions;

/**
 * Raised when a configuration or legal-context document cannot be loaded.
 */
public class DocumentLoadException extends TranspilationException {

    public enum Reason {
        /** The document could not be located or read. */
        RESOURCE_MISSING,
        /** The document was read but is not a valid document of the expected shape. */
        MALFORMED_DOCUMENT
    }

    private final Reason reason;
    private final String location;

    public DocumentLoadException(Reason reason, String location, String message) {
        super(message);
        this.reason = reason;
        this.location = location;
    }

    public DocumentLoadException(Reason reason, String location, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.location = location;
    }

    public Reason getReason() {
        return reason;
    }

    public String getLocation() {
        return location;
    }
}
