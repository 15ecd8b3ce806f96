/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A synthesized, self-contained calculation module.
 *
 * @param language     output syntax
 * @param inputs       input-leaf names accepted by the entry point, in order
 * @param declarations computed declarations in evaluation order
 * @param source       full module text
 * @param warnings     synthesis warnings (e.g. unresolved parameters)
 */
public record GeneratedModule(
        TargetLanguage language,
        List<String> inputs,
        List<Declaration> declarations,
        String source,
        List<Diagnostic> warnings
) {
    public GeneratedModule {
        inputs = List.copyOf(inputs);
        declarations = List.copyOf(declarations);
        warnings = List.copyOf(warnings);
    }

    /**
     * One computed variable of the module.
     *
     * @param name       variable name
     * @param statements intermediate statements, already in target syntax
     * @param expression the terminal result expression in target syntax
     */
    public record Declaration(String name, List<String> statements, String expression) {
        public Declaration {
            statements = List.copyOf(statements);
        }
    }

    /**
     * Every name in the returned aggregate: inputs first, then declarations.
     */
    public List<String> resultNames() {
        List<String> names = new ArrayList<>(inputs);
        declarations.forEach(d -> names.add(d.name()));
        return names;
    }
}
