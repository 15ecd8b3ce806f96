package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.api.model.GeneratedModule;
import com.solstice.formulac.api.model.TargetLanguage;

/**
 * Emits a self-contained module exposing one entry point, {@code calculate},
 * that accepts every input leaf (with its default) and returns every value of
 * the closure, inputs included.
 *
 * <p>Output is deterministic: the same request always produces byte-identical
 * source.
 */
public interface CodeSynthesizer {

    TargetLanguage language();

    GeneratedModule synthesize(SynthesisRequest request);
}
