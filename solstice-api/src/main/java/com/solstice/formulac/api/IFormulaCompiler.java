package com.solstice.formulac.api;

import com.solstice.formulac.api.model.CompilationRequest;
import com.solstice.formulac.api.model.CompilationResult;

/**
 * Contract for compiling rule formulas into a standalone calculation module.
 */
public interface IFormulaCompiler {

    /**
     * Builds the closure of the requested targets, orders it and synthesizes
     * the module in the requested language.
     *
     * @param request compilation request
     * @return result carrying the generated module and any diagnostics
     * @throws com.solstice.formulac.api.exceptions.CompilationException if the
     *         reform document is malformed, or a cycle is found in strict mode
     */
    CompilationResult compile(CompilationRequest request);

    /**
     * Same as {@link #compile} but skips synthesis: the result carries the
     * ordered closure and the effective parameter table but no module.
     */
    CompilationResult plan(CompilationRequest request);

    /**
     * Registers a listener notified as compilation stages start and finish.
     */
    void setCompilationListener(CompilationListener listener);
}
