/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler.enrichment;

import com.savigny.transpiler.api.model.DeonticOperator;
import com.savigny.transpiler.api.model.InstitutionType;
import com.savigny.transpiler.api.model.Multiplicity;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.NormOrigin;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.compiler.DocumentLoader;
import com.savigny.transpiler.compiler.config.ConfigurationDocument;
import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AutomatedNormEnricherTest {

    private static final String CONFIG = """
        {
          "instituciones": ["CompraVenta"],
          "automated_norms": {
            "domain_defaults": {
              "derecho-civil": [
                {"role": "vendedor", "deontic": "debe", "action": "sanear el bien", "reference": "CC Art. 2119"},
                {"role": "vendedor", "deontic": "no-debe", "action": "ocultar vicios", "scope": "inmueble"}
              ]
            },
            "universal_templates": {
              "Derecho-Civil": [
                {"role": "comprador", "deontic": "puede", "action": "exigir regla %{rule_id}: %{rule_action} (%{rule_id})"},
                {"role": "comprador", "action": "sin operador"}
              ]
            },
            "conditional_on_id": {
              "2": [
                {"role": "vendedor", "deontic": "debe", "action": "entregar factura", "scope": "documento",
                 "reference": "LFPC 32"}
              ]
            }
          }
        }
        """;

    private AutomatedNormEnricher enricher;
    private Schema schema;

    @BeforeEach
    void setUp() {
        ConfigurationDocument document = new DocumentLoader().parseConfiguration(CONFIG);
        enricher = new AutomatedNormEnricher(new ConfigurationValidator(document));
        schema = new Schema();
        schema.setInstitution("CompraVenta", InstitutionType.CONTRACT, Multiplicity.MULTIPLE, "derecho-civil");
        schema.addNorm(new Norm(1, "comprador", DeonticOperator.OBLIGATION, "pagar el precio"));
        schema.addNorm(new Norm(2, "vendedor", DeonticOperator.OBLIGATION, "entregar el bien"));
    }

    @Test
    @DisplayName("Should add every tier and count each one")
    void shouldAddAllTiers() {
        AutomatedNormEnricher.EnrichmentResult result = enricher.enrich(schema);

        assertThat(result.domainDefaults()).isEqualTo(2);
        assertThat(result.templateNorms()).isEqualTo(2);
        assertThat(result.conditionalNorms()).isEqualTo(1);
        assertThat(schema.getNorms()).hasSize(2 + result.total());
        assertThat(schema.getNorms().subList(0, 2)).extracting(Norm::getId).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Generated identifiers start at the next hundred and stay unique")
    void shouldNumberGeneratedNorms() {
        enricher.enrich(schema);

        List<Integer> generated = schema.getNorms().stream()
            .filter(norm -> !norm.isUserAuthored())
            .map(Norm::getId)
            .toList();
        assertThat(generated).containsExactly(100, 101, 102, 103, 104);
    }

    @Test
    @DisplayName("Domain defaults carry the reference suffix and scope")
    void shouldApplyDefaultReferenceAndScope() {
        enricher.enrich(schema);

        Norm sanear = schema.findNorm(100).orElseThrow();
        assertThat(sanear.getAction()).isEqualTo("sanear el bien [Ref: CC Art. 2119]");
        assertThat(sanear.getOrigin()).contains(new NormOrigin(NormOrigin.Tier.DOMAIN_DEFAULT, "derecho-civil", 0));

        Norm ocultar = schema.findNorm(101).orElseThrow();
        assertThat(ocultar.getDeontic()).isEqualTo(DeonticOperator.PROHIBITION);
        assertThat(ocultar.getScope()).contains("inmueble");
    }

    @Test
    @DisplayName("Templates substitute every placeholder occurrence and skip incomplete entries")
    void shouldSubstituteTemplatePlaceholders() {
        enricher.enrich(schema);

        assertThat(schema.findNorm(102).orElseThrow().getAction()).isEqualTo("exigir regla 1: pagar el precio (1)");
        assertThat(schema.findNorm(103).orElseThrow().getAction()).isEqualTo("exigir regla 2: entregar el bien (2)");
        assertThat(schema.getNorms()).extracting(Norm::getAction).doesNotContain("sin operador");
    }

    @Test
    @DisplayName("Conditional norms fire only for their trigger identifier")
    void shouldApplyConditionalNorms() {
        enricher.enrich(schema);

        Norm factura = schema.findNorm(104).orElseThrow();
        assertThat(factura.getAction()).isEqualTo("entregar factura [Ref: LFPC 32]");
        assertThat(factura.getScope()).contains("documento");
        assertThat(factura.getOrigin()).get().extracting(NormOrigin::trigger).isEqualTo("2");
    }

    @Test
    @DisplayName("Enriching twice adds nothing the second time")
    void shouldBeIdempotent() {
        enricher.enrich(schema);
        int size = schema.getNorms().size();

        AutomatedNormEnricher.EnrichmentResult second = enricher.enrich(schema);

        assertThat(second.total()).isZero();
        assertThat(schema.getNorms()).hasSize(size);
    }

    @Test
    @DisplayName("Identifiers stay above user norms in the hundreds")
    void shouldStartAboveHighestUserHundred() {
        schema.addNorm(new Norm(250, "comprador", DeonticOperator.PRIVILEGE, "rescindir"));

        assertThat(AutomatedNormEnricher.firstGeneratedId(schema)).isEqualTo(300);
    }

    @Test
    @DisplayName("A schema without a legal domain is left untouched")
    void shouldSkipSchemaWithoutDomain() {
        schema.setInstitution("CompraVenta", InstitutionType.CONTRACT, Multiplicity.MULTIPLE, null);

        assertThat(enricher.enrich(schema).total()).isZero();
        assertThat(schema.getNorms()).hasSize(2);
    }

    @Test
    @DisplayName("Should replace both placeholders")
    void shouldSubstitute() {
        Norm trigger = new Norm(7, "comprador", DeonticOperator.OBLIGATION, "pagar");

        assertThat(AutomatedNormEnricher.substitute("%{rule_id}-%{rule_action}-%{rule_id}", trigger))
            .isEqualTo("7-pagar-7");
    }
}
