package com.solstice.formulac.api.model;

/**
 * Export convention of a generated JavaScript module.
 */
public enum ModuleFormat {
    /** {@code export { calculate }; export default calculate;} */
    ESM,
    /** {@code module.exports = { calculate };} */
    COMMONJS,
    /** Self-contained wrapper assigning {@code calculate} on the global object. */
    IIFE,
    /** Plain declarations, no export statement. */
    NONE;

    public static ModuleFormat fromString(String value) {
        if (value == null) return null;
        try {
            return ModuleFormat.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
