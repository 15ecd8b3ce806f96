package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.compiler.analysis.ReferenceSet;
import com.solstice.formulac.compiler.graph.DependencyGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one synthesis run.
 *
 * @param graph        analyzed closure
 * @param order        closure in evaluation order
 * @param targets      originally requested variables
 * @param references   per-variable analysis; variables without an entry are analyzed on demand
 * @param parameters   effective parameter table, reform already applied
 * @param instant      date the parameters were resolved at
 * @param moduleFormat export convention for structured targets, null for the configured default
 */
public record SynthesisRequest(
        DependencyGraph graph,
        List<String> order,
        List<String> targets,
        Map<String, ReferenceSet> references,
        Map<String, Object> parameters,
        String instant,
        ModuleFormat moduleFormat
) {
    public SynthesisRequest {
        order = List.copyOf(order);
        targets = List.copyOf(targets);
        references = references != null ? Map.copyOf(references) : Map.of();
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public SynthesisRequest withModuleFormat(ModuleFormat format) {
        return new SynthesisRequest(graph, order, targets, references, parameters, instant, format);
    }
}
