package com.solstice.formulac.compiler.config;

import com.solstice.formulac.api.model.ModuleFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CompilerConfigTest {

    @Test
    @DisplayName("Should provide built-in defaults")
    void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.getEntityKeywords()).contains("person", "household", "tax_unit");
        assertThat(config.isEntityKeyword("members")).isFalse();
        assertThat(config.getMemberAccessor()).isEqualTo("members");
        assertThat(config.getDefaultEntity()).isEqualTo("person");
        assertThat(config.getFunctionMappings()).containsEntry("max_", "Math.max").containsEntry("np.floor", "Math.floor");
        assertThat(config.isStrictCycles()).isFalse();
        assertThat(config.getModuleFormat()).isEqualTo(ModuleFormat.ESM);
        assertThat(config.isIncludeJsDoc()).isTrue();
    }

    @Test
    @DisplayName("Should load settings from a classpath properties file")
    void testClasspathProperties() {
        CompilerConfig config = CompilerConfig.loadFromProperties("config/strict.properties");

        assertThat(config.getEntityKeywords()).containsExactly("person", "benunit", "household");
        assertThat(config.isStrictCycles()).isTrue();
        assertThat(config.getModuleFormat()).isEqualTo(ModuleFormat.COMMONJS);
        assertThat(config.isIncludeJsDoc()).isFalse();
    }

    @Test
    @DisplayName("Should load settings from a file path")
    void testFileProperties(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.properties");
        Files.writeString(file, "solstice.module.format=iife\nsolstice.default.entity=household\n");

        CompilerConfig config = CompilerConfig.loadFromProperties(file.toString());

        assertThat(config.getModuleFormat()).isEqualTo(ModuleFormat.IIFE);
        assertThat(config.getDefaultEntity()).isEqualTo("household");
    }

    @Test
    @DisplayName("Should fall back to defaults for a missing file or an invalid format")
    void testFallbacks() {
        assertThat(CompilerConfig.loadFromProperties("does/not/exist.properties").getModuleFormat())
                .isEqualTo(ModuleFormat.ESM);

        Properties props = new Properties();
        props.setProperty("solstice.module.format", "amd");
        assertThat(CompilerConfig.builder().applyProperties(props).build().getModuleFormat())
                .isEqualTo(ModuleFormat.ESM);
    }

    @Test
    @DisplayName("Should reject an empty keyword set")
    void testValidation() {
        assertThatThrownBy(() -> CompilerConfig.builder().entityKeywords(Set.of()).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> CompilerConfig.builder().memberAccessor(" ").build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should copy every setting through toBuilder")
    void testToBuilder() {
        CompilerConfig original = CompilerConfig.builder()
                .entityKeywords(Set.of("person"))
                .strictCycles(true)
                .moduleFormat(ModuleFormat.NONE)
                .build();

        CompilerConfig copy = original.toBuilder().includeJsDoc(false).build();

        assertThat(copy.getEntityKeywords()).containsExactly("person");
        assertThat(copy.isStrictCycles()).isTrue();
        assertThat(copy.getModuleFormat()).isEqualTo(ModuleFormat.NONE);
        assertThat(copy.isIncludeJsDoc()).isFalse();
        assertThat(original.isIncludeJsDoc()).isTrue();
    }
}
