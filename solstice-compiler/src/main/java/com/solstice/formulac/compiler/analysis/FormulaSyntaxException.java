package com.solstice.formulac.compiler.analysis;

/**
 * Raised by the lexer when a formula cannot be tokenized structurally.
 * Never escapes the analyzer, which falls back to a pattern scan.
 */
public class FormulaSyntaxException extends Exception {

    private final int offset;

    public FormulaSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
