/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

/**
 * Kelsen asset categories. Services carry a polarity operator, properties do not.
 */
public enum AssetType {
    SERVICE("Service"),
    MOVABLE_PROPERTY("Property, M"),
    IMMOVABLE_PROPERTY("Property, NM");

    private final String declaration;

    AssetType(String declaration) {
        this.declaration = declaration;
    }

    /**
     * Type prefix used in an asset declaration.
     */
    public String declaration() {
        return declaration;
    }

    public boolean isProperty() {
        return this != SERVICE;
    }
}
