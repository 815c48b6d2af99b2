/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaTest {

    private Schema schema;

    @BeforeEach
    void setUp() {
        schema = new Schema();
        schema.setInstitution("CompraVenta", InstitutionType.CONTRACT, Multiplicity.MULTIPLE, "derecho-civil");
    }

    @Test
    @DisplayName("Should keep norms in insertion order and resolve ordinals by identifier")
    void shouldKeepInsertionOrder() {
        schema.addNorm(new Norm(7, "comprador", DeonticOperator.OBLIGATION, "pagar"));
        schema.addNorm(new Norm(3, "vendedor", DeonticOperator.OBLIGATION, "entregar"));

        assertThat(schema.getNorms()).extracting(Norm::getId).containsExactly(7, 3);
        assertThat(schema.ordinalOf(3)).isEqualTo(2);
        assertThat(schema.ordinalOf(99)).isEqualTo(-1);
        assertThat(schema.findNorm(7)).get().extracting(Norm::getAction).isEqualTo("pagar");
        assertThat(schema.findNorm(8)).isEmpty();
    }

    @Test
    @DisplayName("Should reject duplicate norm identifiers")
    void shouldRejectDuplicateIds() {
        schema.addNorm(new Norm(1, "comprador", DeonticOperator.OBLIGATION, "pagar"));

        assertThatThrownBy(() -> schema.addNorm(new Norm(1, "vendedor", DeonticOperator.PRIVILEGE, "cobrar")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate norm identifier: 1");
        assertThat(schema.getNorms()).hasSize(1);
    }

    @Test
    @DisplayName("Should expose read-only collections")
    void shouldExposeReadOnlyViews() {
        schema.addFact(new LegalFact("entrega", null));

        assertThatThrownBy(() -> schema.getFacts().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(schema.getFacts().get(0).evidence()).isEmpty();
    }

    @Test
    @DisplayName("Should replace the institution on a second declaration")
    void shouldReplaceInstitution() {
        schema.setInstitution("Arrendamiento", InstitutionType.CONTRACT, Multiplicity.SINGLE, null);

        assertThat(schema.getInstitution()).get()
            .satisfies(institution -> {
                assertThat(institution.name()).isEqualTo("Arrendamiento");
                assertThat(institution.multiplicity()).isEqualTo(Multiplicity.SINGLE);
                assertThat(institution.legalDomain()).isNull();
            });
    }

    @Test
    @DisplayName("Should distinguish user-authored norms from generated ones")
    void shouldTrackOrigins() {
        NormOrigin origin = new NormOrigin(NormOrigin.Tier.DOMAIN_DEFAULT, "derecho-civil", 0);
        schema.addNorm(new Norm(1, "comprador", DeonticOperator.OBLIGATION, "pagar"));
        schema.addNorm(new Norm(100, "vendedor", DeonticOperator.OBLIGATION, "sanear", origin));

        assertThat(schema.getUserAuthoredNorms()).extracting(Norm::getId).containsExactly(1);
        assertThat(schema.containsOrigin(origin)).isTrue();
        assertThat(schema.containsOrigin(new NormOrigin(NormOrigin.Tier.DOMAIN_DEFAULT, "derecho-civil", 1))).isFalse();
    }

    @Test
    @DisplayName("Compound violations hold both norm identifiers and default to claim-right")
    void shouldBuildCompoundViolation() {
        Violation violation = Violation.compound(1, 2, "vendedor", null, "rescindir");

        assertThat(violation.isCompound()).isTrue();
        assertThat(violation.getViolatedNormIds().toIntArray()).containsExactly(1, 2);
        assertThat(violation.getDeontic()).isEqualTo(DeonticOperator.CLAIM_RIGHT);
    }

    @Test
    @DisplayName("Agendas require non-blank requesting and beneficiary roles")
    void shouldRejectBlankAgendaRoles() {
        assertThatThrownBy(() -> new Agenda("  ", ComplianceType.BREACHED, "CompraVenta", "vendedor", false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Requesting role must not be blank");
        assertThatThrownBy(() -> new Agenda("comprador", ComplianceType.BREACHED, "CompraVenta", "", false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Beneficiary role must not be blank");
        assertThatThrownBy(() -> new Agenda(null, null, null, "vendedor", true))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Conditions are either text or a norm reference")
    void shouldModelConditions() {
        Norm norm = new Norm(3, "comprador", DeonticOperator.PRIVILEGE, "rescindir");
        norm.addCondition(NormCondition.normReference(2));
        norm.addCondition(NormCondition.text("mora del vendedor"));

        assertThat(norm.isConditional()).isTrue();
        assertThat(norm.getConditions().get(0).isNormReference()).isTrue();
        assertThat(norm.getConditions().get(0).referencedNormId()).isEqualTo(2);
        assertThat(norm.getConditions().get(1).isNormReference()).isFalse();
        assertThat(norm.getConditions().get(1).text()).isEqualTo("mora del vendedor");
    }
}
