package com.solstice.formulac.api.model;

import java.util.Map;

/**
 * A parameter resolved at one instant.
 *
 * <p>Metadata (description, reference, unit) is informational only and is
 * never written to generated modules.
 */
public record ParameterValue(String path, Object value, Map<String, String> metadata) {

    public ParameterValue {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Parameter path cannot be empty");
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public ParameterValue(String path, Object value) {
        this(path, value, Map.of());
    }

    public String description() {
        return metadata.get("description");
    }

    public String unit() {
        return metadata.get("unit");
    }
}
