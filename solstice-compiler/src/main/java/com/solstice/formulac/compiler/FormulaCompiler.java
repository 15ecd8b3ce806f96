/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.compiler;

import com.solstice.formulac.api.CompilationListener;
import com.solstice.formulac.api.HostRegistry;
import com.solstice.formulac.api.IFormulaCompiler;
import com.solstice.formulac.api.exceptions.CyclicDependencyException;
import com.solstice.formulac.api.model.CompilationRequest;
import com.solstice.formulac.api.model.CompilationResult;
import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.api.model.GeneratedModule;
import com.solstice.formulac.compiler.analysis.FormulaAnalyzer;
import com.solstice.formulac.compiler.closure.ClosureBuilder;
import com.solstice.formulac.compiler.closure.ClosureResult;
import com.solstice.formulac.compiler.config.CompilerConfig;
import com.solstice.formulac.compiler.graph.DependencyGraph;
import com.solstice.formulac.compiler.reform.ReformOverlay;
import com.solstice.formulac.compiler.synthesis.CodeSynthesizer;
import com.solstice.formulac.compiler.synthesis.JavaScriptModuleSynthesizer;
import com.solstice.formulac.compiler.synthesis.PythonModuleSynthesizer;
import com.solstice.formulac.compiler.synthesis.SynthesisRequest;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles rule formulas into a standalone calculation module.
 *
 * <p>The compilation process runs these stages in order:
 * <ol>
 *   <li>REFORM_PARSING: resolve the reform document at the request instant.
 *       Malformed documents fail here, before any other work.</li>
 *   <li>CLOSURE_BUILDING: walk the host registry from the targets, analyzing
 *       each formula and resolving the parameters it reads.</li>
 *   <li>ORDERING: topologically sort the closure. A cycle is reported as a
 *       diagnostic, or rejected in strict mode.</li>
 *   <li>REFORM_APPLICATION: overlay the reform on the parameter table.</li>
 *   <li>SYNTHESIS: emit the module in the requested language.</li>
 * </ol>
 * {@link #plan(CompilationRequest)} runs every stage except SYNTHESIS.
 *
 * <p>Each stage runs in its own span and is reported to the registered
 * {@link CompilationListener}. A compiler holds no per-run state, so one
 * instance may serve any number of sequential requests.
 */
public class FormulaCompiler implements IFormulaCompiler {

    private static final Logger logger = Logger.getLogger(FormulaCompiler.class.getName());

    private final CompilerConfig config;
    private final Tracer tracer;
    private final ClosureBuilder closureBuilder;
    private final ReformOverlay reformOverlay = new ReformOverlay();
    private CompilationListener listener;

    public FormulaCompiler(HostRegistry registry, Tracer tracer) {
        this(registry, CompilerConfig.defaults(), tracer);
    }

    public FormulaCompiler(HostRegistry registry, CompilerConfig config, Tracer tracer) {
        this.config = config;
        this.tracer = tracer;
        this.closureBuilder = new ClosureBuilder(registry, new FormulaAnalyzer(config));
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public CompilationResult compile(CompilationRequest request) {
        return run(request, true);
    }

    @Override
    public CompilationResult plan(CompilationRequest request) {
        return run(request, false);
    }

    private CompilationResult run(CompilationRequest request, boolean synthesize) {
        int totalStages = synthesize ? 5 : 4;
        Span span = tracer.spanBuilder(synthesize ? "compile-formulas" : "plan-formulas").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("targets", String.join(",", request.targets()));
            span.setAttribute("instant", request.instant());
            span.setAttribute("language", request.language().name());
            long startTime = System.nanoTime();

            Map<String, Object> overrides = runStage("REFORM_PARSING", 1, totalStages, metrics -> {
                if (!request.hasReform()) {
                    metrics.put("overrideCount", 0);
                    return Map.<String, Object>of();
                }
                Map<String, Object> parsed = reformOverlay.parse(request.reform(), request.instant());
                metrics.put("overrideCount", parsed.size());
                return parsed;
            });

            ClosureResult closure = runStage("CLOSURE_BUILDING", 2, totalStages, metrics -> {
                ClosureResult result = closureBuilder.build(request.targets(), request.instant());
                metrics.put("variableCount", result.graph().getVariables().size());
                metrics.put("parameterCount", result.graph().getParameters().size());
                metrics.put("missingCount", result.diagnostics().stream()
                        .filter(d -> d.kind() == Diagnostic.Kind.MISSING_VARIABLE).count());
                return result;
            });
            DependencyGraph graph = closure.graph();
            List<Diagnostic> diagnostics = new ArrayList<>(closure.diagnostics());

            List<String> order = runStage("ORDERING", 3, totalStages, metrics -> {
                List<String> sorted = new ArrayList<>(graph.topologicalSort(request.targets()));
                sorted.removeIf(name -> !graph.hasVariable(name));
                List<String> unorderable = graph.unorderableNodes(request.targets());
                metrics.put("orderedCount", sorted.size());
                metrics.put("unorderableCount", unorderable.size());
                if (!unorderable.isEmpty()) {
                    boolean strict = request.strict() != null ? request.strict() : config.isStrictCycles();
                    if (strict) {
                        throw new CyclicDependencyException(unorderable);
                    }
                    logger.warning("Circular variable definitions among " + unorderable
                            + "; they are emitted after the orderable variables");
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.CYCLIC_DEPENDENCY, String.join(", ", unorderable),
                            "Variables could not be fully ordered: " + String.join(", ", unorderable)));
                }
                return sorted;
            });

            Map<String, Object> parameters = runStage("REFORM_APPLICATION", 4, totalStages, metrics -> {
                metrics.put("overrideCount", overrides.size());
                return overrides.isEmpty()
                        ? graph.parameterTable()
                        : reformOverlay.apply(graph.parameterTable(), overrides);
            });

            GeneratedModule module = null;
            if (synthesize) {
                module = runStage("SYNTHESIS", 5, totalStages, metrics -> {
                    SynthesisRequest synthesis = new SynthesisRequest(graph, order, request.targets(),
                            closure.references(), parameters, request.instant(), request.moduleFormat());
                    GeneratedModule generated = synthesizerFor(request).synthesize(synthesis);
                    metrics.put("declarationCount", generated.declarations().size());
                    metrics.put("warningCount", generated.warnings().size());
                    return generated;
                });
                diagnostics.addAll(module.warnings());
            }

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            span.setAttribute("variableCount", order.size());
            span.setAttribute("diagnosticCount", diagnostics.size());
            logger.info(String.format("Compiled %d variables for %s in %.2f ms (%d diagnostics)",
                    order.size(), request.targets(), compilationTime / 1_000_000.0, diagnostics.size()));

            return new CompilationResult(order, new LinkedHashMap<>(graph.getVariables()), parameters,
                    module, diagnostics, compilationTime);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private CodeSynthesizer synthesizerFor(CompilationRequest request) {
        return switch (request.language()) {
            case PYTHON -> new PythonModuleSynthesizer(config);
            case JAVASCRIPT -> new JavaScriptModuleSynthesizer(config, false);
            case TYPESCRIPT -> new JavaScriptModuleSynthesizer(config, true);
        };
    }

    private <T> T runStage(String stageName, int stageNumber, int totalStages, Stage<T> stage) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, totalStages);
        }
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            Map<String, Object> metrics = new LinkedHashMap<>();
            T result = stage.run(metrics);
            long duration = System.nanoTime() - start;
            metrics.forEach((key, value) -> span.setAttribute(key, String.valueOf(value)));
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, Map.copyOf(metrics)));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    @FunctionalInterface
    private interface Stage<T> {
        T run(Map<String, Object> metrics);
    }
}
