/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.Objects;

/**
 * The legal instrument a schema describes.
 *
 * @param name institution name as written in the source, e.g. {@code CompraVenta}
 * @param type institution type
 * @param multiplicity whether the institution involves one or several parties per role
 * @param legalDomain legal domain, e.g. {@code derecho-patrimonial-privado}
 */
public record Institution(
    String name,
    InstitutionType type,
    Multiplicity multiplicity,
    String legalDomain
) {
    public Institution {
        Objects.requireNonNull(name, "name");
        if (type == null) type = InstitutionType.CONTRACT;
        if (multiplicity == null) multiplicity = Multiplicity.MULTIPLE;
    }
}
