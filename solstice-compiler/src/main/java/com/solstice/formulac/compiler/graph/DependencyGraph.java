/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.compiler.graph;

import com.solstice.formulac.api.model.ParameterValue;
import com.solstice.formulac.api.model.VariableInfo;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variables, their dependency edges and resolved parameter values for one
 * compilation run.
 *
 * <p>Construction never rejects input: edges may point at names that were
 * never registered (missing variables) and may form cycles. Ordering is
 * computed on demand by {@link #topologicalSort(Collection)}.
 *
 * <h2>Ordering</h2>
 * <p>Nodes of the requested closure are encoded to integer ids in discovery
 * order (targets first, then dependencies breadth-first) and ordered with
 * Kahn's algorithm. Nodes whose in-degree never drops to zero, because they sit
 * on or downstream of a cycle, are appended in discovery order. The result
 * is deterministic and always contains exactly the closure.
 */
public class DependencyGraph {

    private final Map<String, VariableInfo> variables = new LinkedHashMap<>();
    private final Map<String, ParameterValue> parameters = new LinkedHashMap<>();

    public void addVariable(String name, Set<String> dependencies, String formulaSource,
                            String entity, String definitionPeriod, String valueType,
                            Object defaultValue, boolean isInput) {
        addVariable(name, dependencies, Set.of(), formulaSource, entity, definitionPeriod,
                valueType, defaultValue, isInput);
    }

    /**
     * Registers or overwrites a variable node along with the parameter paths
     * its formula reads.
     */
    public void addVariable(String name, Set<String> dependencies, Set<String> parameterDependencies,
                            String formulaSource, String entity, String definitionPeriod,
                            String valueType, Object defaultValue, boolean isInput) {
        variables.put(name, new VariableInfo(name, formulaSource, dependencies, parameterDependencies,
                isInput, defaultValue, entity, definitionPeriod, valueType));
    }

    public void addVariable(VariableInfo info) {
        variables.put(info.name(), info);
    }

    public void addParameter(String path, Object value) {
        parameters.put(path, new ParameterValue(path, value));
    }

    public void addParameter(ParameterValue value) {
        parameters.put(value.path(), value);
    }

    public VariableInfo getVariable(String name) {
        return variables.get(name);
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Map<String, VariableInfo> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, ParameterValue> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Path to resolved scalar, in registration order.
     */
    public Map<String, Object> parameterTable() {
        Map<String, Object> table = new LinkedHashMap<>();
        parameters.forEach((path, value) -> table.put(path, value.value()));
        return table;
    }

    /**
     * Every name reachable from {@code name} through dependency edges,
     * excluding {@code name} itself even when it lies on a cycle.
     */
    public Set<String> transitiveDependencies(String name) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(name);
        while (!stack.isEmpty()) {
            VariableInfo info = variables.get(stack.pop());
            if (info == null) continue;
            for (String dep : info.dependencies()) {
                if (!dep.equals(name) && visited.add(dep)) {
                    stack.push(dep);
                }
            }
        }
        return visited;
    }

    /**
     * The closure of {@code targets} ordered so every variable follows its
     * dependencies, cycles excepted.
     */
    public List<String> topologicalSort(Collection<String> targets) {
        Ordering ordering = order(targets);
        List<String> result = new ArrayList<>(ordering.dictionary.size());
        for (int i = 0; i < ordering.sorted.size(); i++) {
            result.add(ordering.dictionary.decode(ordering.sorted.getInt(i)));
        }
        for (int i = 0; i < ordering.leftover.size(); i++) {
            result.add(ordering.dictionary.decode(ordering.leftover.getInt(i)));
        }
        return result;
    }

    /**
     * Closure members Kahn's algorithm could not place, in discovery order.
     * Empty when the closure is acyclic.
     */
    public List<String> unorderableNodes(Collection<String> targets) {
        Ordering ordering = order(targets);
        List<String> result = new ArrayList<>(ordering.leftover.size());
        for (int i = 0; i < ordering.leftover.size(); i++) {
            result.add(ordering.dictionary.decode(ordering.leftover.getInt(i)));
        }
        return result;
    }

    private Ordering order(Collection<String> targets) {
        NameDictionary dictionary = new NameDictionary();
        IntArrayFIFOQueue discovery = new IntArrayFIFOQueue();
        for (String target : targets) {
            if (dictionary.getId(target) < 0) {
                discovery.enqueue(dictionary.encode(target));
            }
        }
        while (!discovery.isEmpty()) {
            VariableInfo info = variables.get(dictionary.decode(discovery.dequeueInt()));
            if (info == null) continue;
            for (String dep : info.dependencies()) {
                if (dictionary.getId(dep) < 0) {
                    discovery.enqueue(dictionary.encode(dep));
                }
            }
        }

        int n = dictionary.size();
        int[] inDegree = new int[n];
        List<IntList> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dependents.add(new IntArrayList());
        }
        for (int id = 0; id < n; id++) {
            VariableInfo info = variables.get(dictionary.decode(id));
            if (info == null) continue;
            for (String dep : info.dependencies()) {
                int depId = dictionary.getId(dep);
                dependents.get(depId).add(id);
                inDegree[id]++;
            }
        }

        IntArrayFIFOQueue ready = new IntArrayFIFOQueue();
        for (int id = 0; id < n; id++) {
            if (inDegree[id] == 0) ready.enqueue(id);
        }
        boolean[] placed = new boolean[n];
        IntList sorted = new IntArrayList(n);
        while (!ready.isEmpty()) {
            int id = ready.dequeueInt();
            placed[id] = true;
            sorted.add(id);
            IntList next = dependents.get(id);
            for (int i = 0; i < next.size(); i++) {
                int dependent = next.getInt(i);
                if (--inDegree[dependent] == 0) {
                    ready.enqueue(dependent);
                }
            }
        }

        IntList leftover = new IntArrayList();
        for (int id = 0; id < n; id++) {
            if (!placed[id]) leftover.add(id);
        }
        return new Ordering(dictionary, sorted, leftover);
    }

    private record Ordering(NameDictionary dictionary, IntList sorted, IntList leftover) {
    }
}
