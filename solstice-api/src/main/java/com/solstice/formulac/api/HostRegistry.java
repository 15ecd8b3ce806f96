/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api;

import com.solstice.formulac.api.model.ParameterValue;
import com.solstice.formulac.api.model.VariableDefinition;

import java.util.Optional;

/**
 * Read-only view of the rule-modeling system that owns variable formulas
 * and the date-versioned parameter tree.
 *
 * <p>The compiler queries each variable and each parameter path at most once
 * per compilation run. Lookups are never retried.
 */
public interface HostRegistry {

    /**
     * Looks up a variable declaration.
     *
     * @param name variable name
     * @return the declaration, or empty if the registry does not know the name
     */
    Optional<VariableDefinition> findVariable(String name);

    /**
     * Resolves a parameter at an instant.
     *
     * @param path    dot-separated parameter path (e.g. "gov.tax.basic_rate")
     * @param instant date formatted {@code YYYY-MM-DD}
     * @return the scalar in force at that instant, or empty if none
     */
    Optional<ParameterValue> findParameter(String path, String instant);
}
