/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api;

import com.savigny.transpiler.api.model.Schema;

import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Contract for turning a legal institution schema into a Kelsen program.
 */
public interface ISchemaTranspiler {

    /**
     * Scans, parses, enriches and renders a schema source.
     *
     * @param source schema text
     * @return the Kelsen program
     * @throws com.savigny.transpiler.api.exceptions.TranspilationException if any stage fails
     */
    String transpile(String source);

    /**
     * Enriches and renders a schema built by an external grammar engine.
     * The schema is mutated in place by enrichment.
     *
     * @param schema schema with its institution set
     * @return the Kelsen program
     */
    String transpile(Schema schema);

    /**
     * Reads a UTF-8 schema file and transpiles it.
     *
     * @param sourcePath path to the schema file
     * @return the Kelsen program
     * @throws IOException if the file cannot be read
     */
    default String transpile(Path sourcePath) throws IOException {
        return transpile(Files.readString(sourcePath, StandardCharsets.UTF_8));
    }

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking stage progress.
     *
     * @param listener the listener (null to disable)
     */
    default void setTranspilationListener(TranspilationListener listener) {
    }
}
