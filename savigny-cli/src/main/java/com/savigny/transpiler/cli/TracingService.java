/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.cli;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

/**
 * Supplies the tracer for a CLI run.
 *
 * <p>Tracing is off unless the {@code savigny.tracing} system property is
 * {@code true}; spans are then written through {@link LoggingSpanExporter}.
 * The SDK is not registered globally.
 */
public final class TracingService implements AutoCloseable {

    static final String INSTRUMENTATION_NAME = "com.savigny.transpiler";

    private final OpenTelemetrySdk sdk;
    private final Tracer tracer;

    private TracingService(OpenTelemetrySdk sdk, Tracer tracer) {
        this.sdk = sdk;
        this.tracer = tracer;
    }

    public static TracingService fromSystemProperties() {
        return create(Boolean.getBoolean("savigny.tracing"));
    }

    public static TracingService create(boolean enabled) {
        if (!enabled) {
            return new TracingService(null, OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
        }
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
            .setTracerProvider(
                SdkTracerProvider.builder()
                    .addSpanProcessor(SimpleSpanProcessor.create(LoggingSpanExporter.create()))
                    .build()
            )
            .build();
        return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME));
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return sdk != null;
    }

    @Override
    public void close() {
        if (sdk != null) {
            sdk.getSdkTracerProvider().close();
        }
    }
}
