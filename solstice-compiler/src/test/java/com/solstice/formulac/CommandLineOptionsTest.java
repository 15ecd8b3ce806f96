package com.solstice.formulac;

import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.api.model.TargetLanguage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    @DisplayName("Should parse separate and inline option values")
    void testParse() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "--rules", "rules.json", "--variables=income_tax, net_income", "--target", "js",
                "--module=iife", "-o", "out.js", "--year", "2025", "--strict"});

        assertThat(options.rules()).isEqualTo(Path.of("rules.json"));
        assertThat(options.variables()).containsExactly("income_tax", "net_income");
        assertThat(options.language()).isEqualTo(TargetLanguage.JAVASCRIPT);
        assertThat(options.moduleFormat()).isEqualTo(ModuleFormat.IIFE);
        assertThat(options.output()).isEqualTo(Path.of("out.js"));
        assertThat(options.instant()).isEqualTo("2025-01-01");
        assertThat(options.strict()).isTrue();
        assertThat(options.dryRun()).isFalse();
    }

    @Test
    @DisplayName("Should apply defaults for optional settings")
    void testDefaults() {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"--rules", "r.json", "--variables", "a"});

        assertThat(options.language()).isEqualTo(TargetLanguage.PYTHON);
        assertThat(options.instant()).isNull();
        assertThat(options.moduleFormat()).isNull();
        assertThat(options.strict()).isNull();
        assertThat(options.title()).isEqualTo("Policy Calculator");
    }

    @Test
    @DisplayName("Should not require other options with --help")
    void testHelp() {
        assertThat(CommandLineOptions.parse(new String[]{"-h"}).help()).isTrue();
    }

    @Test
    @DisplayName("Should reject invalid argument combinations")
    void testInvalid() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--variables", "a"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--rules");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--rules", "r.json"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--variables");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--rules", "r.json", "--variables", "a", "--date", "2024-01-01", "--year", "2024"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("not both");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--rules", "r.json", "--variables", "a", "--date", "01/01/2024"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("YYYY-MM-DD");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--rules", "r.json", "--variables", "a", "--target", "ruby"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Unknown target");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--rules", "--variables", "a"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("requires a value");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--rules", "r.json", "--verbose"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Unknown option");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--dry-run=yes"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("takes no value");
    }
}
