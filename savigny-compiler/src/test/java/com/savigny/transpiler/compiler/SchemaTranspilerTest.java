/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler;

import com.savigny.transpiler.api.TranspilationListener;
import com.savigny.transpiler.api.exceptions.GenerationException;
import com.savigny.transpiler.api.exceptions.SchemaParseException;
import com.savigny.transpiler.api.exceptions.TranspilationException;
import com.savigny.transpiler.api.model.DeonticOperator;
import com.savigny.transpiler.api.model.InstitutionType;
import com.savigny.transpiler.api.model.Multiplicity;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.compiler.config.ConfigurationDocument;
import com.savigny.transpiler.compiler.context.LegalContext;
import com.savigny.transpiler.compiler.parser.SchemaParser;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchemaTranspilerTest {

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @Mock
    private TranspilationListener listener;

    private ConfigurationDocument configuration;
    private LegalContext context;

    @BeforeEach
    void setUp() throws Exception {
        // Setup OpenTelemetry mocks
        lenient().when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);
        lenient().when(span.makeCurrent()).thenReturn(scope);

        DocumentLoader loader = new DocumentLoader();
        configuration = loader.loadConfiguration(resource("schema_config.json"));
        context = loader.loadContext(resource("legal_context.json"));
    }

    private static Path resource(String name) throws Exception {
        return Paths.get(SchemaTranspilerTest.class.getResource("/" + name).toURI());
    }

    @Test
    @DisplayName("Should transpile the sample schema end to end")
    void shouldTranspileSampleSchema() throws Exception {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, context, tracer);

        String code = transpiler.transpile(resource("compraventa.schema"));

        assertThat(code)
            .startsWith("// String definitions for actions\nstring compraventa = \"acuerda compraventa\";\n")
            .contains("string pagar_precio_1 = \"pagar precio\";")
            .contains("asset CompraVenta = Service, +, COMPRADOR, compraventa, VENDEDOR;")
            .contains("asset EntregarAsset2 = Property, NM, VENDEDOR, entregar_bien_2, COMPRADOR;")
            .contains("clause norm3 = { CompraVenta AND EntregarAsset2, PVG(RescindirAsset3) };")
            .contains("asset SanearAsset4 = ")
            .contains("asset ExigirAsset5 = ")
            .contains("asset EntregarAsset8 = Service, +, VENDEDOR, entregar_factura_8, COMPRADOR;")
            .contains("// Violation clauses\n")
            .contains("// LEGAL CONTEXT EXTENSIONS")
            .contains("clause art2248_obligation = { CompraVenta, OB(art2248Asset) };")
            .doesNotContain("art2398");

        verify(tracer).spanBuilder("transpile-schema");
        verify(tracer).spanBuilder("parsing");
        verify(tracer).spanBuilder("context-validation");
        verify(span, never()).recordException(any());
    }

    @Test
    @DisplayName("Should report all four stages with their metrics")
    void shouldNotifyListenerOfStages() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, context, tracer);
        transpiler.setTranspilationListener(listener);

        transpiler.transpile("""
            Institution CompraVenta contrato derecho-civil
            1. comprador debe pagar precio
            2. vendedor debe entregar bien
            """);

        InOrder order = inOrder(listener);
        order.verify(listener).onStageStart(SchemaTranspiler.PARSING, 1, 4);
        order.verify(listener).onStageComplete(eq(SchemaTranspiler.PARSING), any());
        order.verify(listener).onStageStart(SchemaTranspiler.ENRICHMENT, 2, 4);
        order.verify(listener).onStageStart(SchemaTranspiler.CONTEXT_VALIDATION, 3, 4);
        order.verify(listener).onStageStart(SchemaTranspiler.GENERATION, 4, 4);
        verify(listener, never()).onError(anyString(), any());

        ArgumentCaptor<TranspilationListener.StageResult> results =
            ArgumentCaptor.forClass(TranspilationListener.StageResult.class);
        verify(listener, times(4)).onStageComplete(anyString(), results.capture());
        List<TranspilationListener.StageResult> captured = results.getAllValues();

        assertThat(captured.get(0).metrics()).containsEntry("normCount", 2).containsEntry("validationIssues", 0);
        // one default, one template per user norm, one conditional on norm 2
        assertThat(captured.get(1).metrics())
            .containsEntry("generatedNorms", 4)
            .containsEntry("domainDefaults", 1)
            .containsEntry("templateNorms", 2)
            .containsEntry("conditionalNorms", 1);
        assertThat(captured.get(2).metrics()).containsEntry("unmatchedNorms", 0);
        assertThat(captured.get(3).stageName()).isEqualTo(SchemaTranspiler.GENERATION);
        assertThat(captured.get(3).metrics()).containsKey("outputLength");
    }

    @Test
    @DisplayName("A single obligation renders its string, subject, service asset and clause")
    void shouldRenderSingleObligation() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);

        String code = transpiler.transpile("""
            Institution CompraVenta contrato derecho-patrimonial-privado
            1. comprador debe pagar el precio
            violacion 1 entonces vendedor "indemnizar daños"
            """);

        assertThat(code)
            .contains("string pagar_precio_1 = \"pagar precio\";")
            .contains("subject COMPRADOR = ")
            .contains("asset PagarAsset1 = Service, +, COMPRADOR, pagar_precio_1, VENDEDOR;")
            .contains("clause norm1 = { CompraVenta, OB(PagarAsset1) };")
            .contains("clause viol_clause_1 = { not(PagarAsset1), CR(");
    }

    @Test
    @DisplayName("Roles outside the explicit mappings are counted as unmatched")
    void shouldCountUnmatchedNorms() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, context, tracer);
        transpiler.setTranspilationListener(listener);

        transpiler.transpile("Institution CompraVenta contrato\n1. juez debe resolver controversia\n");

        ArgumentCaptor<TranspilationListener.StageResult> result =
            ArgumentCaptor.forClass(TranspilationListener.StageResult.class);
        verify(listener).onStageComplete(eq(SchemaTranspiler.CONTEXT_VALIDATION), result.capture());
        assertThat(result.getValue().metrics()).containsEntry("unmatchedNorms", 1);
    }

    @Test
    @DisplayName("Without a legal context no extension is rendered")
    void shouldSkipContextWhenAbsent() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);

        String code = transpiler.transpile("Institution CompraVenta contrato\n1. comprador debe pagar precio\n");

        assertThat(code)
            .contains("clause norm1 = { CompraVenta, OB(PagarAsset1) };")
            .doesNotContain("LEGAL CONTEXT");
    }

    @Test
    @DisplayName("Schemas built elsewhere are enriched and rendered")
    void shouldTranspilePrebuiltSchema() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);
        Schema schema = new Schema();
        schema.setInstitution("CompraVenta", InstitutionType.CONTRACT, Multiplicity.MULTIPLE, "derecho-civil");
        schema.addNorm(new Norm(1, "comprador", DeonticOperator.OBLIGATION, "pagar precio"));

        String code = transpiler.transpile(schema);

        assertThat(schema.getNorms()).extracting(Norm::getId).containsExactly(1, 100, 101);
        assertThat(code).contains("clause norm3 = ");
    }

    @Test
    @DisplayName("A schema without institution cannot be generated")
    void shouldRejectSchemaWithoutInstitution() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);

        assertThatThrownBy(() -> transpiler.transpile(new Schema()))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("must have an institution");
        verify(span).recordException(any(GenerationException.class));
        verify(span).end();
    }

    @Test
    @DisplayName("Parse errors are reported to the listener and rethrown")
    void shouldPropagateParseErrors() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);
        transpiler.setTranspilationListener(listener);

        assertThatThrownBy(() -> transpiler.transpile("Institution CompraVenta contrato\n1. comprador pagar\n"))
            .isInstanceOf(SchemaParseException.class)
            .hasMessageContaining("Expected deontic operator");

        verify(listener).onError(eq(SchemaTranspiler.PARSING), any(SchemaParseException.class));
        verify(listener, never()).onStageStart(eq(SchemaTranspiler.ENRICHMENT), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Unexpected failures are wrapped with the stage name")
    void shouldWrapUnexpectedFailures() {
        SchemaParser failing = mock(SchemaParser.class);
        when(failing.parse(any(), any())).thenThrow(new IllegalStateException("grammar exploded"));
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);
        transpiler.setSchemaParser(failing);
        transpiler.setTranspilationListener(listener);

        assertThatThrownBy(() -> transpiler.transpile("Institution CompraVenta contrato"))
            .isInstanceOf(TranspilationException.class)
            .hasMessage("PARSING failed: grammar exploded")
            .hasCauseInstanceOf(IllegalStateException.class);

        verify(listener).onError(eq(SchemaTranspiler.PARSING), any(IllegalStateException.class));
    }

    @Test
    @DisplayName("A missing schema file surfaces as an I/O error")
    void shouldFailOnMissingSourceFile() {
        SchemaTranspiler transpiler = new SchemaTranspiler(configuration, tracer);

        assertThatThrownBy(() -> transpiler.transpile(Paths.get("does-not-exist.schema")))
            .isInstanceOf(NoSuchFileException.class);
    }
}
