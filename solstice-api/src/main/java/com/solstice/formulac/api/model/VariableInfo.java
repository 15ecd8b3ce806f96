/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Analyzed metadata of one variable in a dependency graph.
 *
 * <p>Dependency sets keep insertion order so that graph traversals are
 * deterministic across runs.
 */
public record VariableInfo(
        String name,
        String formulaSource,
        Set<String> dependencies,
        Set<String> parameterDependencies,
        boolean isInput,
        Object defaultValue,
        String entity,
        String definitionPeriod,
        String valueType
) {
    public VariableInfo {
        formulaSource = formulaSource != null ? formulaSource : "";
        dependencies = dependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Set.of();
        parameterDependencies = parameterDependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(parameterDependencies))
                : Set.of();
        defaultValue = defaultValue != null ? defaultValue : 0;
        entity = entity != null ? entity : "person";
        definitionPeriod = definitionPeriod != null ? definitionPeriod : "year";
        valueType = valueType != null ? valueType : "float";
    }
}
