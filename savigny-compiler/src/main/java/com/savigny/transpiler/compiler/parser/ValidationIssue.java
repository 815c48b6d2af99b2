/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.parser;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A vocabulary entry not found in the configuration. Issues are reported but
 * never stop parsing.
 *
 * @param kind what kind of entry was checked
 * @param value the offending text
 * @param suggestion closest configured entry, or {@code null}
 * @param line 1-based source line of the offending token
 */
public record ValidationIssue(Kind kind, String value, String suggestion, int line) {

    public enum Kind {
        UNKNOWN_INSTITUTION,
        UNKNOWN_TYPE,
        UNKNOWN_DOMAIN,
        UNKNOWN_ROLE
    }

    public ValidationIssue {
        Objects.requireNonNull(kind, "kind");
    }

    public Optional<String> suggested() {
        return Optional.ofNullable(suggestion);
    }

    public String describe() {
        String base = String.format("Line %d: unknown %s '%s'", line,
            kind.name().substring("UNKNOWN_".length()).toLowerCase(Locale.ROOT), value);
        return suggestion == null ? base : base + ", did you mean '" + suggestion + "'?";
    }
}
