/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A configured norm that enrichment instantiates.
 *
 * @param role role that bears the norm
 * @param deontic deontic keyword, e.g. {@code debe} or {@code no-debe}
 * @param action action text, may contain {@code %{rule_id}} and {@code %{rule_action}} placeholders
 * @param reference optional legal reference appended to the action as {@code [Ref: ...]}
 * @param scope optional scope of the generated norm
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormTemplate(
    @JsonProperty("role") String role,
    @JsonProperty("deontic") String deontic,
    @JsonProperty("action") String action,
    @JsonProperty("reference") String reference,
    @JsonProperty("scope") String scope
) {
    public boolean isComplete() {
        return role != null && deontic != null && action != null;
    }
}
