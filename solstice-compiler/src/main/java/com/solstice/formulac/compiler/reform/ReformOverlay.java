/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.compiler.reform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstice.formulac.api.exceptions.InvalidReformException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parses reform documents and overlays their values on a parameter table.
 *
 * <p>A reform document is a JSON object keyed by parameter path. Each value is
 * either a scalar override:
 * <pre>{"gov.tax.basic_rate": 0.22}</pre>
 * or an object of {@code YYYY-MM-DD} effective dates:
 * <pre>{"gov.tax.basic_rate": {"2023-01-01": 0.20, "2024-01-01": 0.25}}</pre>
 * For the latter the latest date on or before the instant wins; a path with
 * no qualifying date is left out.
 */
public class ReformOverlay {

    private static final Logger logger = Logger.getLogger(ReformOverlay.class.getName());

    private final ObjectMapper objectMapper;

    public ReformOverlay() {
        this(new ObjectMapper());
    }

    public ReformOverlay(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Resolves a reform document at an instant.
     *
     * @param document reform JSON
     * @param instant  date formatted {@code YYYY-MM-DD}
     * @return path to override value, in document order
     * @throws InvalidReformException if the document is malformed
     */
    public Map<String, Object> parse(String document, String instant) {
        if (!DatedValues.isDate(instant)) {
            throw new IllegalArgumentException("Instant must be formatted YYYY-MM-DD, got: " + instant);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new InvalidReformException("Reform document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidReformException("Reform document must be a JSON object");
        }

        Map<String, Object> overrides = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey();
            JsonNode value = field.getValue();
            if (path.isBlank()) {
                throw new InvalidReformException("Reform parameter path cannot be empty");
            }
            if (DatedValues.isScalar(value)) {
                overrides.put(path, DatedValues.scalar(value));
            } else if (value.isObject()) {
                resolveDated(path, value, instant, overrides);
            } else {
                throw new InvalidReformException("Reform value for '" + path + "' must be a scalar or a date-keyed object");
            }
        }
        logger.fine("Reform resolved " + overrides.size() + " overrides at " + instant);
        return overrides;
    }

    /**
     * Resolves a reform document at January 1st of {@code year}.
     */
    public Map<String, Object> parse(String document, int year) {
        return parse(document, String.format("%04d-01-01", year));
    }

    /**
     * Overlays {@code overrides} on {@code base}. Neither input is modified.
     */
    public Map<String, Object> apply(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(overrides);
        return merged;
    }

    private void resolveDated(String path, JsonNode versions, String instant, Map<String, Object> overrides) {
        List<String> dates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = versions.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!DatedValues.isDate(entry.getKey())) {
                throw new InvalidReformException("Reform value for '" + path + "' has non-date key '"
                        + entry.getKey() + "', expected YYYY-MM-DD");
            }
            if (!DatedValues.isScalar(entry.getValue())) {
                throw new InvalidReformException("Reform value for '" + path + "' at " + entry.getKey()
                        + " must be a scalar");
            }
            dates.add(entry.getKey());
        }
        String effective = DatedValues.latestOnOrBefore(dates, instant);
        if (effective == null) {
            logger.fine("Reform for '" + path + "' has no value effective at " + instant);
            return;
        }
        overrides.put(path, DatedValues.scalar(versions.get(effective)));
    }
}
