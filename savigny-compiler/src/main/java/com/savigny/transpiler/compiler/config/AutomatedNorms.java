/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The three enrichment tiers of the configuration document.
 *
 * @param domainDefaults norms added once per schema, keyed by legal domain
 * @param universalTemplates templates applied to every user norm, keyed by legal domain
 * @param conditionalOnId norms added when a user norm with the key identifier exists
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AutomatedNorms(
    @JsonProperty("domain_defaults") Map<String, List<NormTemplate>> domainDefaults,
    @JsonProperty("universal_templates") Map<String, List<NormTemplate>> universalTemplates,
    @JsonProperty("conditional_on_id") Map<String, List<NormTemplate>> conditionalOnId
) {
    public AutomatedNorms {
        domainDefaults = ConfigurationDocument.orderedCopy(domainDefaults);
        universalTemplates = ConfigurationDocument.orderedCopy(universalTemplates);
        conditionalOnId = ConfigurationDocument.orderedCopy(conditionalOnId);
    }

    public static AutomatedNorms none() {
        return new AutomatedNorms(null, null, null);
    }

    public boolean isEmpty() {
        return domainDefaults.isEmpty() && universalTemplates.isEmpty() && conditionalOnId.isEmpty();
    }
}
