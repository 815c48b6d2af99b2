/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.Objects;

/**
 * A legally relevant fact and the evidence that supports it.
 */
public record LegalFact(String description, String evidence) {
    public LegalFact {
        Objects.requireNonNull(description, "description");
        if (evidence == null) evidence = "";
    }
}
