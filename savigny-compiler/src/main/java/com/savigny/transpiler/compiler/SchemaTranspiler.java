/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.compiler;

import com.savigny.transpiler.api.ISchemaTranspiler;
import com.savigny.transpiler.api.TranspilationListener;
import com.savigny.transpiler.api.exceptions.GenerationException;
import com.savigny.transpiler.api.exceptions.TranspilationException;
import com.savigny.transpiler.api.model.Institution;
import com.savigny.transpiler.api.model.Norm;
import com.savigny.transpiler.api.model.Schema;
import com.savigny.transpiler.compiler.codegen.ContextExtensionRenderer;
import com.savigny.transpiler.compiler.codegen.KelsenGenerator;
import com.savigny.transpiler.compiler.config.ConfigurationDocument;
import com.savigny.transpiler.compiler.config.ConfigurationValidator;
import com.savigny.transpiler.compiler.context.ContextEngine;
import com.savigny.transpiler.compiler.context.LegalContext;
import com.savigny.transpiler.compiler.enrichment.AutomatedNormEnricher;
import com.savigny.transpiler.compiler.lexer.LexicalScanner;
import com.savigny.transpiler.compiler.parser.ParseResult;
import com.savigny.transpiler.compiler.parser.SchemaParser;
import com.savigny.transpiler.compiler.parser.TokenSchemaParser;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns schema sources into Kelsen programs.
 *
 * <p>The pipeline runs four stages, each in its own span and reported to the
 * {@link TranspilationListener} when one is set:
 * <ol>
 *   <li>PARSING: scan the source and build the schema</li>
 *   <li>ENRICHMENT: append configured automated norms</li>
 *   <li>CONTEXT_VALIDATION: check user norms against the legal context</li>
 *   <li>GENERATION: render the Kelsen program, plus context extensions</li>
 * </ol>
 * Without a legal context the validation stage is a no-op and no extension is rendered.
 *
 * <p>Instances are not thread-safe; the configuration and context handles may be shared.
 */
public class SchemaTranspiler implements ISchemaTranspiler {

    private static final Logger logger = Logger.getLogger(SchemaTranspiler.class.getName());

    static final String PARSING = "PARSING";
    static final String ENRICHMENT = "ENRICHMENT";
    static final String CONTEXT_VALIDATION = "CONTEXT_VALIDATION";
    static final String GENERATION = "GENERATION";
    private static final int TOTAL_STAGES = 4;

    private final ConfigurationValidator validator;
    private final ContextEngine contextEngine;
    private final KelsenGenerator generator;
    private final ContextExtensionRenderer extensionRenderer;
    private Tracer tracer;
    private TranspilationListener listener;
    private SchemaParser schemaParser = new TokenSchemaParser();

    public SchemaTranspiler(ConfigurationDocument configuration, Tracer tracer) {
        this(configuration, null, tracer);
    }

    /**
     * @param configuration vocabulary and automated norms
     * @param context legal-context corpus, or {@code null} to skip the context pass
     * @param tracer tracer for stage spans
     */
    public SchemaTranspiler(ConfigurationDocument configuration, LegalContext context, Tracer tracer) {
        this.validator = new ConfigurationValidator(Objects.requireNonNull(configuration, "configuration"));
        this.contextEngine = context == null ? null : new ContextEngine(context);
        this.generator = new KelsenGenerator();
        this.extensionRenderer = contextEngine == null ? null : new ContextExtensionRenderer(contextEngine, validator);
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setTranspilationListener(TranspilationListener listener) {
        this.listener = listener;
    }

    /**
     * Replaces the bundled grammar.
     */
    public void setSchemaParser(SchemaParser schemaParser) {
        this.schemaParser = Objects.requireNonNull(schemaParser, "schemaParser");
    }

    public ConfigurationValidator getValidator() {
        return validator;
    }

    @Override
    public String transpile(String source) {
        Objects.requireNonNull(source, "source");
        Span span = tracer.spanBuilder("transpile-schema").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("sourceLength", source.length());
            Schema schema = runStage(PARSING, 1, () -> {
                ParseResult result;
                try {
                    result = schemaParser.parse(new LexicalScanner(source), validator);
                } catch (UncheckedIOException e) {
                    throw new TranspilationException("Failed to read schema source", e);
                }
                return new StageOutcome<>(result.schema(), Map.<String, Object>of(
                    "normCount", result.schema().getNorms().size(),
                    "validationIssues", result.issues().size()));
            });
            return enrichAndGenerate(schema);
        } catch (TranspilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String transpile(Schema schema) {
        Span span = tracer.spanBuilder("transpile-schema").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (schema == null || schema.getInstitution().isEmpty()) {
                throw new GenerationException("Schema must have an institution before generation");
            }
            return enrichAndGenerate(schema);
        } catch (TranspilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private String enrichAndGenerate(Schema schema) {
        schema.getInstitution().map(Institution::name).ifPresent(validator::setCurrentInstitution);

        runStage(ENRICHMENT, 2, () -> {
            AutomatedNormEnricher.EnrichmentResult result = new AutomatedNormEnricher(validator).enrich(schema);
            return new StageOutcome<>(result, Map.<String, Object>of(
                "generatedNorms", result.total(),
                "domainDefaults", result.domainDefaults(),
                "templateNorms", result.templateNorms(),
                "conditionalNorms", result.conditionalNorms()));
        });

        runStage(CONTEXT_VALIDATION, 3, () -> {
            int unmatched = validateAgainstContext(schema);
            return new StageOutcome<>(unmatched, Map.<String, Object>of("unmatchedNorms", unmatched));
        });

        return runStage(GENERATION, 4, () -> {
            String code = generator.generate(schema);
            if (extensionRenderer != null) {
                code = code + extensionRenderer.render(schema, code);
            }
            return new StageOutcome<>(code, Map.<String, Object>of("outputLength", code.length()));
        });
    }

    // Advisory only: a norm whose role no explicit mapping targets is logged, never rejected.
    private int validateAgainstContext(Schema schema) {
        if (contextEngine == null) {
            return 0;
        }
        String institution = schema.getInstitution().map(Institution::name).orElse(null);
        if (contextEngine.getContext().explicitMappings(institution).isEmpty()) {
            logger.fine("No explicit role mappings for " + institution + ", skipping norm validation");
            return 0;
        }
        int unmatched = 0;
        List<Norm> norms = schema.getUserAuthoredNorms();
        for (Norm norm : norms) {
            if (!contextEngine.validateNorm(norm, institution)) {
                unmatched++;
                logger.warning(String.format("Norm %d: role '%s' is not mapped for %s in the legal context",
                    norm.getId(), norm.getRole(), institution));
            }
        }
        return unmatched;
    }

    private <T> T runStage(String stageName, int stageNumber, StageBody<T> body) {
        Span span = tracer.spanBuilder(stageName.toLowerCase(Locale.ROOT).replace('_', '-')).startSpan();
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            StageOutcome<T> outcome = body.run();
            long duration = System.nanoTime() - start;
            outcome.metrics().forEach((key, value) -> span.setAttribute(key, String.valueOf(value)));
            if (listener != null) {
                listener.onStageComplete(stageName,
                    new TranspilationListener.StageResult(stageName, duration, new HashMap<>(outcome.metrics())));
            }
            return outcome.value();
        } catch (TranspilationException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw new TranspilationException(stageName + " failed: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    @FunctionalInterface
    private interface StageBody<T> {
        StageOutcome<T> run();
    }

    private record StageOutcome<T>(T value, Map<String, Object> metrics) {
    }
}
