package com.solstice.formulac.compiler.closure;

import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.compiler.analysis.ReferenceSet;
import com.solstice.formulac.compiler.graph.DependencyGraph;

import java.util.List;
import java.util.Map;

/**
 * Closure of a set of targets.
 *
 * @param graph       every reachable known variable with its edges and resolved parameters
 * @param references  analysis of each registered variable's formula, by name
 * @param diagnostics missing variables and unparseable formulas met on the way
 */
public record ClosureResult(
        DependencyGraph graph,
        Map<String, ReferenceSet> references,
        List<Diagnostic> diagnostics
) {
    public ClosureResult {
        references = Map.copyOf(references);
        diagnostics = List.copyOf(diagnostics);
    }

    public ReferenceSet referencesOf(String name) {
        return references.get(name);
    }
}
