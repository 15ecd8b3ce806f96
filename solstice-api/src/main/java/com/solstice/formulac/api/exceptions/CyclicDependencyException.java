/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api.exceptions;

import java.util.List;

/**
 * Thrown in strict mode when the requested closure contains variables that
 * cannot be placed in a dependency-respecting order.
 */
public class CyclicDependencyException extends CompilationException {

    private final List<String> unorderedVariables;

    public CyclicDependencyException(List<String> unorderedVariables) {
        super("Circular variable definitions detected among: " + String.join(", ", unorderedVariables));
        this.unorderedVariables = List.copyOf(unorderedVariables);
    }

    /**
     * Variables on a cycle or depending on one, in discovery order.
     */
    public List<String> getUnorderedVariables() {
        return unorderedVariables;
    }
}
