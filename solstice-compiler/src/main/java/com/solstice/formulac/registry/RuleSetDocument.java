package com.solstice.formulac.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * On-disk form of a rule set.
 *
 * <pre>
 * {
 *   "variables": {
 *     "income_tax": {"entity": "person", "value_type": "float",
 *                    "formula": "def formula(person, period, parameters): ..."},
 *     "income": {"default_value": 0}
 *   },
 *   "parameters": {
 *     "gov": {"tax": {"rate": {"values": {"2023-01-01": 0.2}, "unit": "/1"}}}
 *   }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleSetDocument(
        @JsonProperty("variables") Map<String, VariableEntry> variables,
        @JsonProperty("parameters") JsonNode parameters
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VariableEntry(
            @JsonProperty("entity") String entity,
            @JsonProperty("definition_period") String definitionPeriod,
            @JsonProperty("value_type") String valueType,
            @JsonProperty("default_value") Object defaultValue,
            @JsonProperty("formula") String formula
    ) {
    }
}
