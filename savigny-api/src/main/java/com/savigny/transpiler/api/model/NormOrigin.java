/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import java.util.Objects;

/**
 * Provenance of an automatically generated norm.
 *
 * <p>Two generated norms with equal origins were synthesized from the same
 * configured template for the same trigger, which is what makes re-running
 * enrichment a no-op.
 *
 * @param tier enrichment tier that produced the norm
 * @param trigger legal domain for domain defaults, triggering norm identifier otherwise
 * @param templateIndex position of the template within its configured list
 */
public record NormOrigin(Tier tier, String trigger, int templateIndex) {

    public enum Tier {
        DOMAIN_DEFAULT,
        UNIVERSAL_TEMPLATE,
        CONDITIONAL_ON_ID
    }

    public NormOrigin {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(trigger, "trigger");
    }
}
