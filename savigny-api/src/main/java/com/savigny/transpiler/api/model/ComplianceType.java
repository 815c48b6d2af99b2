/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

/**
 * Outcome an agenda asks the adjudicator to establish.
 */
public enum ComplianceType {
    FULFILLED,
    BREACHED
}
