/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SavignyApplicationTest {

    private static final String CONFIG = """
        {
          "instituciones": ["CompraVenta"],
          "tipos": ["contrato"],
          "dominios": ["derecho-civil"],
          "roles": {"CompraVenta": ["comprador", "vendedor"]}
        }
        """;

    private static final String CONTEXT = """
        {
          "sources": {
            "codigo_civil": {
              "nombre": "Codigo Civil Federal",
              "tipo": "codigo",
              "normas": {
                "art2248": {
                  "id": "2248",
                  "estructura": {"accion": "transferir la propiedad", "activo": "vendedor",
                                 "pasivo": "comprador", "objeto": "bien", "condiciones": ["CompraVenta"]}
                }
              }
            }
          }
        }
        """;

    private static final String SCHEMA = """
        Institution CompraVenta contrato derecho-civil
        1. comprador debe pagar precio
        2. vendedor debe entregar bien actua inmueble
        """;

    @TempDir
    Path tempDir;

    private Path config;
    private Path input;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final SavignyApplication application = new SavignyApplication();

    @BeforeEach
    void setUp() throws IOException {
        config = Files.writeString(tempDir.resolve("schema_config.json"), CONFIG);
        input = Files.writeString(tempDir.resolve("compraventa.schema"), SCHEMA);
    }

    private int run(String... args) {
        return application.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Help prints usage and succeeds")
    void shouldPrintHelp() {
        int status = run("--help");

        assertThat(status).isEqualTo(SavignyApplication.EXIT_OK);
        assertThat(stdout()).startsWith("Usage: savigny [options] input_file [output_file]");
        assertThat(stderr()).isEmpty();
    }

    @Test
    @DisplayName("Missing input file is a usage error")
    void shouldRequireInputFile() {
        int status = run("-c", config.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_USAGE);
        assertThat(stderr()).startsWith("Error: No input file specified").contains("Usage: savigny");
    }

    @Test
    @DisplayName("Options without a value are usage errors")
    void shouldRejectOptionWithoutValue() {
        assertThat(run(input.toString(), "--config")).isEqualTo(SavignyApplication.EXIT_USAGE);
        assertThat(stderr()).contains("Missing argument for --config");
    }

    @Test
    @DisplayName("More than two positional arguments are rejected")
    void shouldRejectExtraArguments() {
        assertThat(run("a.schema", "b.kelsen", "c.kelsen")).isEqualTo(SavignyApplication.EXIT_USAGE);
        assertThat(stderr()).contains("Too many arguments");
    }

    @Test
    @DisplayName("Without an output file the program goes to standard output")
    void shouldWriteToStdout() {
        int status = run("-c", config.toString(), input.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_OK);
        assertThat(stdout())
            .startsWith("// String definitions for actions\n")
            .contains("clause norm1 = { CompraVenta, OB(PagarAsset1) };")
            .doesNotContain("LEGAL CONTEXT");
    }

    @Test
    @DisplayName("Should write the program and context extensions to the output file")
    void shouldWriteOutputFile() throws IOException {
        Path context = Files.writeString(tempDir.resolve("legal_context.json"), CONTEXT);
        Path output = tempDir.resolve("compraventa.kelsen");

        int status = run("-v", "--config", config.toString(), "--context", context.toString(),
            input.toString(), output.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_OK);
        assertThat(stdout()).isEmpty();
        assertThat(output).exists();
        assertThat(Files.readString(output))
            .contains("asset EntregarAsset2 = Property, NM, VENDEDOR, entregar_bien_2, COMPRADOR;")
            .contains("clause art2248_obligation = { CompraVenta, OB(art2248Asset) };");
    }

    @Test
    @DisplayName("An unreadable configuration fails with status 1")
    void shouldFailOnMissingConfiguration() {
        int status = run("-c", tempDir.resolve("missing.json").toString(), input.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_FAILURE);
        assertThat(stderr()).startsWith("Error: Document not found");
    }

    @Test
    @DisplayName("A missing schema file fails with status 1")
    void shouldFailOnMissingInput() {
        Path missing = tempDir.resolve("missing.schema");

        int status = run("-c", config.toString(), missing.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_FAILURE);
        assertThat(stderr()).contains("Error: Failed to open input file " + missing);
    }

    @Test
    @DisplayName("Syntax errors fail with status 1")
    void shouldFailOnSyntaxError() throws IOException {
        Files.writeString(input, "Institution CompraVenta contrato\n1. comprador pagar precio\n");

        int status = run("-c", config.toString(), input.toString());

        assertThat(status).isEqualTo(SavignyApplication.EXIT_FAILURE);
        assertThat(stderr()).contains("Error: Expected deontic operator");
    }

    @Test
    @DisplayName("Tracing is disabled unless requested")
    void shouldCreateTracingService() {
        try (TracingService disabled = TracingService.create(false);
             TracingService enabled = TracingService.create(true)) {
            assertThat(disabled.isEnabled()).isFalse();
            assertThat(enabled.isEnabled()).isTrue();
            assertThat(enabled.getTracer()).isNotNull();
        }
    }
}
