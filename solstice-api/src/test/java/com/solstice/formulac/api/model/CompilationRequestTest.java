package com.solstice.formulac.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CompilationRequestTest {

    @Test
    @DisplayName("Should default the language and the instant")
    void testDefaults() {
        CompilationRequest request = CompilationRequest.builder().target("income_tax").build();

        assertThat(request.language()).isEqualTo(TargetLanguage.PYTHON);
        assertThat(request.instant()).isEqualTo(LocalDate.now().toString());
        assertThat(request.hasReform()).isFalse();
        assertThat(request.strict()).isNull();
        assertThat(request.moduleFormat()).isNull();
    }

    @Test
    @DisplayName("Should deduplicate targets keeping their order")
    void testTargets() {
        CompilationRequest request = CompilationRequest.builder()
                .targets(List.of("b", "a", "b"))
                .year(2024)
                .reform(" ")
                .build();

        assertThat(request.targets()).containsExactly("b", "a");
        assertThat(request.instant()).isEqualTo("2024-01-01");
        assertThat(request.hasReform()).isFalse();
    }

    @Test
    @DisplayName("Should reject missing targets and malformed instants")
    void testValidation() {
        assertThatThrownBy(() -> CompilationRequest.builder().build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilationRequest.builder().target("a").instant("2024-1-1").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("YYYY-MM-DD");
    }

    @Test
    @DisplayName("Should parse language and module format names")
    void testEnumParsing() {
        assertThat(TargetLanguage.fromString("py")).isEqualTo(TargetLanguage.PYTHON);
        assertThat(TargetLanguage.fromString("TS")).isEqualTo(TargetLanguage.TYPESCRIPT);
        assertThat(TargetLanguage.fromString("ruby")).isNull();
        assertThat(ModuleFormat.fromString("commonjs")).isEqualTo(ModuleFormat.COMMONJS);
        assertThat(ModuleFormat.fromString("amd")).isNull();
    }

    @Test
    @DisplayName("Should filter result diagnostics by kind")
    void testResultDiagnostics() {
        CompilationResult result = new CompilationResult(List.of("a"), Map.of(), Map.of(), null,
                List.of(Diagnostic.missingVariable("ghost"),
                        new Diagnostic(Diagnostic.Kind.CYCLIC_DEPENDENCY, "x, y", "cycle")), 1L);

        assertThat(result.hasModule()).isFalse();
        assertThat(result.hasDiagnostics(Diagnostic.Kind.MISSING_VARIABLE)).isTrue();
        assertThat(result.hasDiagnostics(Diagnostic.Kind.UNRESOLVED_PARAMETER)).isFalse();
        assertThat(result.diagnostics(Diagnostic.Kind.CYCLIC_DEPENDENCY)).extracting(Diagnostic::subject)
                .containsExactly("x, y");
    }
}
