package com.solstice.formulac.api.model;

/**
 * A recoverable condition collected during compilation. The compiler still
 * produces a best-effort artifact when diagnostics are present.
 */
public record Diagnostic(Kind kind, String subject, String message) {

    public enum Kind {
        /** Requested or transitive variable unknown to the registry. */
        MISSING_VARIABLE,
        /** Formula could not be parsed structurally; pattern scan used instead. */
        UNPARSEABLE_FORMULA,
        /** Referenced parameter path has no value; access left intact. */
        UNRESOLVED_PARAMETER,
        /** Closure contains variables that cannot be totally ordered. */
        CYCLIC_DEPENDENCY
    }

    public static Diagnostic missingVariable(String name) {
        return new Diagnostic(Kind.MISSING_VARIABLE, name, "Variable '" + name + "' not found");
    }

    @Override
    public String toString() {
        return kind + " [" + subject + "]: " + message;
    }
}
