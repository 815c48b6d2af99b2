/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.codegen;

/**
 * Decides how a described object is encoded as a Kelsen asset.
 */
public interface AssetClassifier {

    /**
     * Classifies the object a norm acts upon.
     *
     * @param description object or scope description, may be {@code null}
     */
    AssetType classify(String description);

    /**
     * Whether the action describes an omission, rendered as a negative service.
     */
    boolean isOmission(String action);
}
