package com.solstice.formulac.compiler.config;

import com.solstice.formulac.api.model.ModuleFormat;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Immutable configuration shared by every compilation run.
 *
 * <p>Holds the closed set of entity keywords recognized in formulas, the
 * built-in function-name mapping used by the JavaScript backend, and output
 * defaults. Instances are never mutated after {@link Builder#build()}, so one
 * configuration may be passed to any number of compilers.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * SOLSTICE_ENTITY_KEYWORDS=person,household,tax_unit
 * SOLSTICE_STRICT_CYCLES=true
 * SOLSTICE_MODULE_FORMAT=COMMONJS
 * SOLSTICE_INCLUDE_JSDOC=false
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Built-in defaults
 * CompilerConfig config = CompilerConfig.defaults();
 *
 * // solstice.properties from the classpath, then environment overrides
 * CompilerConfig config = CompilerConfig.loadDefault();
 *
 * // Custom
 * CompilerConfig config = CompilerConfig.builder()
 *     .entityKeywords(Set.of("person", "household"))
 *     .strictCycles(true)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    private static final String ENV_ENTITY_KEYWORDS = "SOLSTICE_ENTITY_KEYWORDS";
    private static final String ENV_STRICT_CYCLES = "SOLSTICE_STRICT_CYCLES";
    private static final String ENV_MODULE_FORMAT = "SOLSTICE_MODULE_FORMAT";
    private static final String ENV_INCLUDE_JSDOC = "SOLSTICE_INCLUDE_JSDOC";

    public static final Set<String> DEFAULT_ENTITY_KEYWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(
            Arrays.asList("person", "household", "tax_unit", "benunit", "family", "state")));

    public static final String DEFAULT_ENTITY = "person";

    /**
     * Host-dialect math helpers and their JavaScript equivalents.
     */
    public static final Map<String, String> DEFAULT_FUNCTION_MAPPINGS;

    static {
        Map<String, String> mappings = new LinkedHashMap<>();
        for (String prefix : new String[]{"np.", "numpy."}) {
            mappings.put(prefix + "maximum", "Math.max");
            mappings.put(prefix + "minimum", "Math.min");
            mappings.put(prefix + "ceil", "Math.ceil");
            mappings.put(prefix + "floor", "Math.floor");
            mappings.put(prefix + "abs", "Math.abs");
            mappings.put(prefix + "sqrt", "Math.sqrt");
            mappings.put(prefix + "round", "Math.round");
            mappings.put(prefix + "exp", "Math.exp");
            mappings.put(prefix + "log", "Math.log");
        }
        mappings.put("math.ceil", "Math.ceil");
        mappings.put("math.floor", "Math.floor");
        mappings.put("math.sqrt", "Math.sqrt");
        mappings.put("math.exp", "Math.exp");
        mappings.put("math.log", "Math.log");
        // bare names, as brought in by `from numpy import ...`
        mappings.put("maximum", "Math.max");
        mappings.put("minimum", "Math.min");
        mappings.put("ceil", "Math.ceil");
        mappings.put("floor", "Math.floor");
        mappings.put("sqrt", "Math.sqrt");
        mappings.put("exp", "Math.exp");
        mappings.put("log", "Math.log");
        mappings.put("max_", "Math.max");
        mappings.put("min_", "Math.min");
        mappings.put("max", "Math.max");
        mappings.put("min", "Math.min");
        mappings.put("abs", "Math.abs");
        mappings.put("round", "Math.round");
        DEFAULT_FUNCTION_MAPPINGS = Collections.unmodifiableMap(mappings);
    }

    private final Set<String> entityKeywords;
    private final String memberAccessor;
    private final String defaultEntity;
    private final Map<String, String> functionMappings;
    private final boolean strictCycles;
    private final ModuleFormat moduleFormat;
    private final boolean includeJsDoc;

    private CompilerConfig(Builder builder) {
        this.entityKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(builder.entityKeywords));
        this.memberAccessor = builder.memberAccessor;
        this.defaultEntity = builder.defaultEntity;
        this.functionMappings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.functionMappings));
        this.strictCycles = builder.strictCycles;
        this.moduleFormat = builder.moduleFormat;
        this.includeJsDoc = builder.includeJsDoc;
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@code solstice.properties} from the classpath, then applies
     * environment overrides.
     */
    public static CompilerConfig loadDefault() {
        return loadFromProperties("solstice.properties");
    }

    /**
     * Loads configuration from a properties file on the classpath or file system.
     * Environment variables override file values.
     *
     * @param propertiesPath classpath resource name or file path
     */
    public static CompilerConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = CompilerConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builder().applyProperties(props).applyEnvironment().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .entityKeywords(entityKeywords)
                .memberAccessor(memberAccessor)
                .defaultEntity(defaultEntity)
                .functionMappings(functionMappings)
                .strictCycles(strictCycles)
                .moduleFormat(moduleFormat)
                .includeJsDoc(includeJsDoc);
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public Set<String> getEntityKeywords() {
        return entityKeywords;
    }

    public boolean isEntityKeyword(String name) {
        return entityKeywords.contains(name);
    }

    /**
     * Method name of the member-projection call ({@code household.members("x", period)}).
     */
    public String getMemberAccessor() {
        return memberAccessor;
    }

    public String getDefaultEntity() {
        return defaultEntity;
    }

    public Map<String, String> getFunctionMappings() {
        return functionMappings;
    }

    public boolean isStrictCycles() {
        return strictCycles;
    }

    public ModuleFormat getModuleFormat() {
        return moduleFormat;
    }

    public boolean isIncludeJsDoc() {
        return includeJsDoc;
    }

    @Override
    public String toString() {
        return "CompilerConfig{entityKeywords=" + entityKeywords +
                ", strictCycles=" + strictCycles +
                ", moduleFormat=" + moduleFormat +
                ", includeJsDoc=" + includeJsDoc + '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {
        private Set<String> entityKeywords = DEFAULT_ENTITY_KEYWORDS;
        private String memberAccessor = "members";
        private String defaultEntity = DEFAULT_ENTITY;
        private Map<String, String> functionMappings = DEFAULT_FUNCTION_MAPPINGS;
        private boolean strictCycles = false;
        private ModuleFormat moduleFormat = ModuleFormat.ESM;
        private boolean includeJsDoc = true;

        private Builder() {
        }

        public Builder entityKeywords(Set<String> keywords) {
            this.entityKeywords = keywords;
            return this;
        }

        public Builder memberAccessor(String accessor) {
            this.memberAccessor = accessor;
            return this;
        }

        public Builder defaultEntity(String entity) {
            this.defaultEntity = entity;
            return this;
        }

        public Builder functionMappings(Map<String, String> mappings) {
            this.functionMappings = mappings;
            return this;
        }

        public Builder strictCycles(boolean strict) {
            this.strictCycles = strict;
            return this;
        }

        public Builder moduleFormat(ModuleFormat format) {
            this.moduleFormat = format;
            return this;
        }

        public Builder includeJsDoc(boolean include) {
            this.includeJsDoc = include;
            return this;
        }

        Builder applyProperties(Properties props) {
            String keywords = props.getProperty("solstice.entity.keywords");
            if (keywords != null) {
                entityKeywords(parseKeywords(keywords));
            }
            String accessor = props.getProperty("solstice.member.accessor");
            if (accessor != null && !accessor.isBlank()) {
                memberAccessor(accessor.trim());
            }
            String entity = props.getProperty("solstice.default.entity");
            if (entity != null && !entity.isBlank()) {
                defaultEntity(entity.trim());
            }
            String strict = props.getProperty("solstice.strict.cycles");
            if (strict != null) {
                strictCycles(Boolean.parseBoolean(strict.trim()));
            }
            String format = props.getProperty("solstice.module.format");
            if (format != null) {
                applyModuleFormat(format, "solstice.module.format");
            }
            String jsDoc = props.getProperty("solstice.include.jsdoc");
            if (jsDoc != null) {
                includeJsDoc(Boolean.parseBoolean(jsDoc.trim()));
            }
            return this;
        }

        Builder applyEnvironment() {
            getEnv(ENV_ENTITY_KEYWORDS).ifPresent(val -> entityKeywords(parseKeywords(val)));
            getEnv(ENV_STRICT_CYCLES).ifPresent(val -> strictCycles(Boolean.parseBoolean(val)));
            getEnv(ENV_MODULE_FORMAT).ifPresent(val -> applyModuleFormat(val, ENV_MODULE_FORMAT));
            getEnv(ENV_INCLUDE_JSDOC).ifPresent(val -> includeJsDoc(Boolean.parseBoolean(val)));
            return this;
        }

        private void applyModuleFormat(String value, String source) {
            ModuleFormat format = ModuleFormat.fromString(value);
            if (format == null) {
                logger.warning("Invalid " + source + ": " + value + ", using default: " + this.moduleFormat);
            } else {
                this.moduleFormat = format;
            }
        }

        public CompilerConfig build() {
            if (entityKeywords == null || entityKeywords.isEmpty()) {
                throw new IllegalStateException("At least one entity keyword is required");
            }
            if (memberAccessor == null || memberAccessor.isBlank()) {
                throw new IllegalStateException("Member accessor cannot be empty");
            }
            if (functionMappings == null) {
                functionMappings = Map.of();
            }
            if (moduleFormat == null) {
                moduleFormat = ModuleFormat.ESM;
            }
            return new CompilerConfig(this);
        }

        private static Set<String> parseKeywords(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            return (value != null && !value.isBlank()) ? Optional.of(value.trim()) : Optional.empty();
        }
    }
}
