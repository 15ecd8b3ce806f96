package com.solstice.formulac.api.model;

/**
 * A host registry's description of one variable, before analysis.
 *
 * @param name             variable name
 * @param formula          formula source text, or null for input leaves
 * @param entity           declared entity keyword (e.g. "person")
 * @param definitionPeriod period granularity (e.g. "year", "month")
 * @param valueType        value-type tag (e.g. "float", "bool")
 * @param defaultValue     default used when the variable is an input
 */
public record VariableDefinition(
        String name,
        String formula,
        String entity,
        String definitionPeriod,
        String valueType,
        Object defaultValue
) {
    public VariableDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        entity = entity != null ? entity : "person";
        definitionPeriod = definitionPeriod != null ? definitionPeriod : "year";
        valueType = valueType != null ? valueType : "float";
        defaultValue = defaultValue != null ? defaultValue : 0;
    }

    public static VariableDefinition input(String name, Object defaultValue) {
        return new VariableDefinition(name, null, null, null, null, defaultValue);
    }

    public static VariableDefinition computed(String name, String formula) {
        return new VariableDefinition(name, formula, null, null, null, null);
    }

    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }
}
