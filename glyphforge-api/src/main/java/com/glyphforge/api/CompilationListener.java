/*
 * Copyright (c) 2025 Glyphforge
 * Licensed under the Apache License, Version 2.0
 */
package com.glyphforge.api;

import java.util.Map;

/**
 * Callback interface for pattern compilation stage events.
 *
 * <p>Compiling a pattern source runs three stages:
 * <ol>
 *   <li>TOKENIZE - split source text into tokens</li>
 *   <li>PARSE - build the bracket tree</li>
 *   <li>INTERPRET - evaluate commands and register patterns</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * IPatternCompiler compiler = new PatternCompiler(registry);
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d us%n", stageName, result.durationMicros());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "TOKENIZE", "PARSE")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails. The source is abandoned afterwards.
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param metrics stage-specific counts (e.g., "tokenCount", "patternCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
