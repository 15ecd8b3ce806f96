/*
 * Copyright (c) 2025 Solstice Formula Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.solstice.formulac.api.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Everything one compilation run needs from its caller.
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationRequest request = CompilationRequest.builder()
 *     .targets(List.of("income_tax"))
 *     .instant("2024-01-01")
 *     .language(TargetLanguage.JAVASCRIPT)
 *     .moduleFormat(ModuleFormat.ESM)
 *     .reform("{\"gov.tax.basic_rate\": 0.22}")
 *     .build();
 * </pre>
 *
 * @param targets      requested variable names, duplicates removed, order kept
 * @param instant      parameter resolution date ({@code YYYY-MM-DD})
 * @param reform       optional reform document (JSON), null for none
 * @param language     output syntax
 * @param moduleFormat export convention (structured targets only), null for the configured default
 * @param strict       reject cyclic closures instead of degrading the ordering, null for the configured default
 */
public record CompilationRequest(
        List<String> targets,
        String instant,
        String reform,
        TargetLanguage language,
        ModuleFormat moduleFormat,
        Boolean strict
) {
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    public CompilationRequest {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target variable is required");
        }
        targets = List.copyOf(new LinkedHashSet<>(targets));
        instant = instant != null ? instant : LocalDate.now().toString();
        if (!ISO_DATE.matcher(instant).matches()) {
            throw new IllegalArgumentException("Instant must be formatted YYYY-MM-DD, got: " + instant);
        }
        language = language != null ? language : TargetLanguage.PYTHON;
    }

    public boolean hasReform() {
        return reform != null && !reform.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> targets = new ArrayList<>();
        private String instant;
        private String reform;
        private TargetLanguage language;
        private ModuleFormat moduleFormat;
        private Boolean strict;

        private Builder() {
        }

        public Builder target(String name) {
            this.targets.add(name);
            return this;
        }

        public Builder targets(List<String> names) {
            this.targets.addAll(names);
            return this;
        }

        public Builder instant(String instant) {
            this.instant = instant;
            return this;
        }

        public Builder year(int year) {
            this.instant = String.format("%04d-01-01", year);
            return this;
        }

        public Builder reform(String reform) {
            this.reform = reform;
            return this;
        }

        public Builder language(TargetLanguage language) {
            this.language = language;
            return this;
        }

        public Builder moduleFormat(ModuleFormat moduleFormat) {
            this.moduleFormat = moduleFormat;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public CompilationRequest build() {
            return new CompilationRequest(targets, instant, reform, language, moduleFormat, strict);
        }
    }
}
