/*
 * Copyright (c) 2025 Savigny Transpiler
 * Licensed under the Apache License, Version 2.0
 */
package com.savigny.transpiler.api;

import java.util.Map;

/**
 * Callback interface for transpilation stage events.
 *
 * <p>The pipeline consists of 4 stages:
 * <ol>
 *   <li>PARSING - Scan the source and build the schema</li>
 *   <li>ENRICHMENT - Append automatically generated norms</li>
 *   <li>CONTEXT_VALIDATION - Check user norms against the legal context</li>
 *   <li>GENERATION - Render Kelsen code</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * transpiler.setTranspilationListener(new TranspilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface TranspilationListener {

    /**
     * Called when a stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "GENERATION")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a stage fails. The exception is rethrown to the caller afterwards.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "normCount", "generatedNorms")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
