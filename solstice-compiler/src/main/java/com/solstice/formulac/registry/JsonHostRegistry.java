/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstice.formulac.api.HostRegistry;
import com.solstice.formulac.api.exceptions.CompilationException;
import com.solstice.formulac.api.model.ParameterValue;
import com.solstice.formulac.api.model.VariableDefinition;
import com.solstice.formulac.compiler.reform.DatedValues;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * {@link HostRegistry} backed by a {@link RuleSetDocument}.
 *
 * <p>The parameter tree is flattened to dot paths on load. An object counts
 * as a parameter leaf when it carries a {@code values} object (with optional
 * {@code description}, {@code reference} and {@code unit}) or when all of its
 * keys are {@code YYYY-MM-DD} dates; any other object nests path segments.
 * A bare scalar applies at every instant. Array nodes (rate scales) are not
 * scalars and are skipped.
 */
public class JsonHostRegistry implements HostRegistry {

    private static final Logger logger = Logger.getLogger(JsonHostRegistry.class.getName());

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, VariableDefinition> variables;
    private final Map<String, ParameterEntry> parameters;

    private JsonHostRegistry(Map<String, VariableDefinition> variables, Map<String, ParameterEntry> parameters) {
        this.variables = variables;
        this.parameters = parameters;
    }

    /**
     * Loads a rule-set document from disk.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws CompilationException if the document is structurally invalid
     */
    public static JsonHostRegistry load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        JsonHostRegistry registry = fromJson(content);
        logger.info("Loaded rule set " + path + ": " + registry.variables.size() + " variables, "
                + registry.parameters.size() + " parameters");
        return registry;
    }

    public static JsonHostRegistry fromJson(String content) throws IOException {
        return fromDocument(objectMapper.readValue(content, RuleSetDocument.class));
    }

    public static JsonHostRegistry fromDocument(RuleSetDocument document) {
        if (document == null) {
            throw new CompilationException("Rule set document cannot be empty");
        }
        Map<String, VariableDefinition> variables = new LinkedHashMap<>();
        if (document.variables() != null) {
            for (Map.Entry<String, RuleSetDocument.VariableEntry> entry : document.variables().entrySet()) {
                String name = entry.getKey();
                RuleSetDocument.VariableEntry v = entry.getValue();
                if (name == null || name.isBlank()) {
                    throw new CompilationException("Rule set contains a variable with an empty name");
                }
                variables.put(name, v == null
                        ? VariableDefinition.input(name, 0)
                        : new VariableDefinition(name, v.formula(), v.entity(), v.definitionPeriod(),
                        v.valueType(), v.defaultValue()));
            }
        }

        Map<String, ParameterEntry> parameters = new LinkedHashMap<>();
        JsonNode tree = document.parameters();
        if (tree != null && !tree.isNull()) {
            if (!tree.isObject()) {
                throw new CompilationException("Rule set 'parameters' must be a JSON object");
            }
            flatten("", tree, parameters);
        }
        return new JsonHostRegistry(Collections.unmodifiableMap(variables), Collections.unmodifiableMap(parameters));
    }

    @Override
    public Optional<VariableDefinition> findVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public Optional<ParameterValue> findParameter(String path, String instant) {
        ParameterEntry entry = parameters.get(path);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.dated() == null) {
            return Optional.of(new ParameterValue(path, entry.constant(), entry.metadata()));
        }
        String effective = DatedValues.latestOnOrBefore(entry.dated().keySet(), instant);
        if (effective == null) {
            logger.fine("Parameter '" + path + "' has no value on or before " + instant);
            return Optional.empty();
        }
        return Optional.of(new ParameterValue(path, entry.dated().get(effective), entry.metadata()));
    }

    public Map<String, VariableDefinition> getVariables() {
        return variables;
    }

    public int parameterCount() {
        return parameters.size();
    }

    private static void flatten(String prefix, JsonNode node, Map<String, ParameterEntry> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (DatedValues.isScalar(value)) {
                out.put(path, new ParameterEntry(DatedValues.scalar(value), null, Map.of()));
            } else if (value.isObject() && value.path("values").isObject()) {
                Map<String, String> metadata = new LinkedHashMap<>();
                for (String key : new String[]{"description", "reference", "unit"}) {
                    if (value.path(key).isValueNode()) {
                        metadata.put(key, value.get(key).asText());
                    }
                }
                out.put(path, new ParameterEntry(null, dated(path, value.get("values")), metadata));
            } else if (value.isObject() && isDateKeyed(value)) {
                out.put(path, new ParameterEntry(null, dated(path, value), Map.of()));
            } else if (value.isObject()) {
                flatten(path, value, out);
            } else {
                logger.fine("Skipping non-scalar parameter '" + path + "'");
            }
        }
    }

    private static boolean isDateKeyed(JsonNode node) {
        if (node.size() == 0) return false;
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            if (!DatedValues.isDate(names.next())) return false;
        }
        return true;
    }

    private static TreeMap<String, Object> dated(String path, JsonNode values) {
        TreeMap<String, Object> byDate = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = values.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!DatedValues.isDate(entry.getKey())) {
                throw new CompilationException("Parameter '" + path + "' has non-date key '" + entry.getKey() + "'");
            }
            if (!DatedValues.isScalar(entry.getValue())) {
                throw new CompilationException("Parameter '" + path + "' at " + entry.getKey() + " must be a scalar");
            }
            byDate.put(entry.getKey(), DatedValues.scalar(entry.getValue()));
        }
        return byDate;
    }

    /**
     * Either a constant (dated is null) or a date-versioned series.
     */
    private record ParameterEntry(Object constant, TreeMap<String, Object> dated, Map<String, String> metadata) {
    }
}
