/*
 * Copyright (c) 2025 Graph Transliterator
 * Licensed under the Apache License, Version 2.0
 */
package com.graphtransliterator.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 * Lets tooling and tests observe compilation progress.
 *
 * <p>The compilation pipeline consists of 5 stages:
 * <ol>
 *   <li>VALIDATION - Check token, class and rule references</li>
 *   <li>RULE_ORDERING - Compute rule costs and sort by specificity</li>
 *   <li>GRAPH_BUILDING - Build the tokenizer pattern and matching graph</li>
 *   <li>ONMATCH_INDEXING - Index on-match rules by boundary tokens</li>
 *   <li>AMBIGUITY_CHECK - Detect unresolved equal-cost rule overlaps</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n",
 *             stageName, result.durationNanos() / 1_000_000);
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * ITransliteratorCompiler compiler = new TransliteratorCompiler(tracer);
 * compiler.setCompilationListener(listener);
 * TransliteratorModel model = compiler.compile(settings);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "VALIDATION", "GRAPH_BUILDING")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage encounters an error.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "ruleCount", "nodeCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
