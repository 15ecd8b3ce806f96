package com.solstice.formulac.compiler.closure;

import com.solstice.formulac.api.HostRegistry;
import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.api.model.ParameterValue;
import com.solstice.formulac.api.model.VariableDefinition;
import com.solstice.formulac.compiler.analysis.FormulaAnalyzer;
import com.solstice.formulac.compiler.analysis.ReferenceSet;
import com.solstice.formulac.compiler.graph.DependencyGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Walks the host registry from the requested targets to every variable they
 * transitively need.
 *
 * <p>Names are processed first-in first-out. Each name is looked up once; a
 * name the registry does not know is reported as a missing variable and left
 * out of the graph, while its dependents keep the edge. After the walk every
 * parameter path referenced anywhere in the closure is resolved once at the
 * requested instant.
 */
public class ClosureBuilder {

    private static final Logger logger = Logger.getLogger(ClosureBuilder.class.getName());

    private final HostRegistry registry;
    private final FormulaAnalyzer analyzer;

    public ClosureBuilder(HostRegistry registry, FormulaAnalyzer analyzer) {
        this.registry = registry;
        this.analyzer = analyzer;
    }

    public ClosureResult build(Collection<String> targets, String instant) {
        DependencyGraph graph = new DependencyGraph();
        Map<String, ReferenceSet> references = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Optional<VariableDefinition>> lookups = new HashMap<>();

        Queue<String> worklist = new ArrayDeque<>(new LinkedHashSet<>(targets));
        Set<String> processed = new HashSet<>();

        while (!worklist.isEmpty()) {
            String name = worklist.poll();
            if (!processed.add(name)) {
                continue;
            }
            Optional<VariableDefinition> found = lookup(lookups, name);
            if (found.isEmpty()) {
                logger.warning("Variable '" + name + "' not found in registry, skipping");
                diagnostics.add(Diagnostic.missingVariable(name));
                continue;
            }
            VariableDefinition definition = found.get();
            ReferenceSet refs = analyzer.analyze(definition.formula());
            if (!refs.structural()) {
                logger.warning("Formula of '" + name + "' could not be parsed, dependencies recovered by pattern scan");
                diagnostics.add(new Diagnostic(Diagnostic.Kind.UNPARSEABLE_FORMULA, name,
                        "Formula of '" + name + "' could not be parsed structurally; references are best-effort"));
            }

            Set<String> dependencies = new LinkedHashSet<>(refs.variables());
            for (String candidate : refs.listCandidates()) {
                if (lookup(lookups, candidate).isPresent()) {
                    dependencies.add(candidate);
                }
            }

            graph.addVariable(name, dependencies, refs.parameters(), definition.formula(),
                    definition.entity(), definition.definitionPeriod(), definition.valueType(),
                    definition.defaultValue(), !definition.hasFormula());
            references.put(name, refs);
            logger.fine("Analyzed '" + name + "': " + dependencies.size() + " dependencies, "
                    + refs.parameters().size() + " parameters");

            for (String dependency : dependencies) {
                if (!processed.contains(dependency)) {
                    worklist.add(dependency);
                }
            }
        }

        resolveParameters(graph, references.values(), instant);
        return new ClosureResult(graph, references, diagnostics);
    }

    private void resolveParameters(DependencyGraph graph, Collection<ReferenceSet> references, String instant) {
        Set<String> paths = new LinkedHashSet<>();
        references.forEach(refs -> paths.addAll(refs.parameters()));
        int resolved = 0;
        for (String path : paths) {
            Optional<ParameterValue> value = registry.findParameter(path, instant);
            if (value.isPresent()) {
                graph.addParameter(value.get());
                resolved++;
            } else {
                logger.fine("No value for parameter '" + path + "' at " + instant);
            }
        }
        logger.fine("Resolved " + resolved + "/" + paths.size() + " parameters at " + instant);
    }

    private Optional<VariableDefinition> lookup(Map<String, Optional<VariableDefinition>> lookups, String name) {
        return lookups.computeIfAbsent(name, registry::findVariable);
    }
}
