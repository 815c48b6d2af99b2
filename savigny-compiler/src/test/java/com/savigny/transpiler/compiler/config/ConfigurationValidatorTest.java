/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.config;

import com.savigny.transpiler.api.model.ComplianceType;
import com.savigny.transpiler.api.model.DeonticOperator;
import com.savigny.transpiler.api.model.InstitutionType;
import com.savigny.transpiler.api.model.Multiplicity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationValidatorTest {

    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> roles = new LinkedHashMap<>();
        roles.put("CompraVenta", List.of("comprador", "vendedor"));
        roles.put("Arrendamiento", List.of("arrendador", "arrendatario"));
        ConfigurationDocument document = new ConfigurationDocument(
            List.of("CompraVenta", "Arrendamiento", "Amparo"),
            List.of("contrato", "procedimiento"),
            List.of("derecho-civil", "derecho-laboral"),
            roles,
            null);
        validator = new ConfigurationValidator(document);
    }

    @Test
    @DisplayName("Membership checks ignore case")
    void shouldValidateIgnoringCase() {
        assertThat(validator.isValidInstitution("compraventa")).isTrue();
        assertThat(validator.isValidInstitution("Permuta")).isFalse();
        assertThat(validator.isValidType("CONTRATO")).isTrue();
        assertThat(validator.isValidDomain("derecho-penal")).isFalse();
        assertThat(validator.isValidInstitution(null)).isFalse();
    }

    @Test
    @DisplayName("Role validation depends on the current institution")
    void shouldValidateRolesForCurrentInstitution() {
        assertThat(validator.isValidRole("comprador")).isFalse();

        validator.setCurrentInstitution("compraventa");

        assertThat(validator.isValidRole("Comprador")).isTrue();
        assertThat(validator.isValidRole("arrendador")).isFalse();
        assertThat(validator.isValidRoleForInstitution("Arrendamiento", "arrendador")).isTrue();
        assertThat(validator.isValidRoleForInstitution("Amparo", "juez")).isFalse();
    }

    @Test
    @DisplayName("Suggestions are the closest entry within three edits")
    void shouldSuggestClosestEntry() {
        assertThat(validator.suggestInstitution("CompraVnta")).contains("CompraVenta");
        assertThat(validator.suggestInstitution("Amparos")).contains("Amparo");
        assertThat(validator.suggestInstitution("Fideicomiso")).isEmpty();
        assertThat(validator.suggestInstitution("compraventa")).isEmpty();

        validator.setCurrentInstitution("CompraVenta");
        assertThat(validator.suggestRole("compradr")).contains("comprador");
        assertThat(validator.suggestRole("vendedro")).contains("vendedor");
        assertThat(validator.suggestRole("juez")).isEmpty();
    }

    @Test
    @DisplayName("Role suggestions need a current institution")
    void shouldNotSuggestRoleWithoutInstitution() {
        assertThat(validator.suggestRole("compradr")).isEmpty();
    }

    @Test
    @DisplayName("Keyword mappings fall back to their defaults")
    void shouldMapKeywords() {
        assertThat(validator.mapDeontic("no-debe")).isEqualTo(DeonticOperator.PROHIBITION);
        assertThat(validator.mapDeontic("Tiene-Derecho-A")).isEqualTo(DeonticOperator.CLAIM_RIGHT);
        assertThat(validator.mapDeontic("quizas")).isEqualTo(DeonticOperator.OBLIGATION);
        assertThat(validator.mapInstitutionType("procedimiento")).isEqualTo(InstitutionType.PROCEDURE);
        assertThat(validator.mapInstitutionType("acto jurídico")).isEqualTo(InstitutionType.LEGAL_ACT);
        assertThat(validator.mapInstitutionType("hecho-juridico")).isEqualTo(InstitutionType.LEGAL_FACT);
        assertThat(validator.mapInstitutionType(null)).isEqualTo(InstitutionType.CONTRACT);
        assertThat(validator.mapMultiplicity("single")).isEqualTo(Multiplicity.SINGLE);
        assertThat(validator.mapMultiplicity("varias")).isEqualTo(Multiplicity.MULTIPLE);
        assertThat(validator.mapCompliance("incumplimiento")).isEqualTo(ComplianceType.BREACHED);
        assertThat(validator.mapCompliance("otro")).isEqualTo(ComplianceType.FULFILLED);
    }

    @Test
    @DisplayName("A missing automated norms section is empty")
    void shouldDefaultAutomatedNorms() {
        assertThat(validator.getAutomatedNorms().isEmpty()).isTrue();
    }
}
