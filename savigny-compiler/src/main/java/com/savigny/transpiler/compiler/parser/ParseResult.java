/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.parser;

import com.savigny.transpiler.api.model.Schema;

import java.util.List;
import java.util.Objects;

/**
 * A parsed schema together with the vocabulary issues found while building it.
 */
public record ParseResult(Schema schema, List<ValidationIssue> issues) {

    public ParseResult {
        Objects.requireNonNull(schema, "schema");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
