/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 * Allows command-line front ends and monitoring systems to track progress.
 *
 * <p>The compilation pipeline consists of 5 stages:
 * <ol>
 *   <li>REFORM_PARSING - Validate and resolve the reform document</li>
 *   <li>CLOSURE_BUILDING - Walk the registry from the requested targets</li>
 *   <li>ORDERING - Topologically sort the closure</li>
 *   <li>REFORM_APPLICATION - Overlay reform values on the parameter table</li>
 *   <li>SYNTHESIS - Emit the target module</li>
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
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * compiler.setCompilationListener(listener);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "CLOSURE_BUILDING")
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
     * Called when a compilation stage fails.
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
     * @param metrics Stage-specific metrics (e.g., "variableCount", "missingCount")
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
