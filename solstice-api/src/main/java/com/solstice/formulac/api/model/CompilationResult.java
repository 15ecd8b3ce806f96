package com.solstice.formulac.api.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one compilation run.
 *
 * @param order             the closure of the requested targets, dependencies first
 * @param variables         analyzed variables by name, in discovery order
 * @param parameters        effective parameter table (reform applied)
 * @param module            generated module, or null for a dry run
 * @param diagnostics       recoverable conditions met along the way
 * @param compilationNanos  wall-clock compilation time
 */
public record CompilationResult(
        List<String> order,
        Map<String, VariableInfo> variables,
        Map<String, Object> parameters,
        GeneratedModule module,
        List<Diagnostic> diagnostics,
        long compilationNanos
) {
    public boolean hasModule() {
        return module != null;
    }

    public boolean hasDiagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }

    public List<Diagnostic> diagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
