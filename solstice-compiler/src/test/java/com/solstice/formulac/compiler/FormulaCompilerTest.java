package com.solstice.formulac.compiler;

import com.solstice.formulac.api.CompilationListener;
import com.solstice.formulac.api.HostRegistry;
import com.solstice.formulac.api.exceptions.CyclicDependencyException;
import com.solstice.formulac.api.exceptions.InvalidReformException;
import com.solstice.formulac.api.model.CompilationRequest;
import com.solstice.formulac.api.model.CompilationResult;
import com.solstice.formulac.api.model.Diagnostic;
import com.solstice.formulac.api.model.ModuleFormat;
import com.solstice.formulac.api.model.TargetLanguage;
import com.solstice.formulac.compiler.config.CompilerConfig;
import com.solstice.formulac.registry.JsonHostRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class FormulaCompilerTest {

    private static final List<String> TAX = List.of("income_tax");

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
    }

    private static String resource(String name) {
        try (InputStream in = FormulaCompilerTest.class.getResourceAsStream("/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    private FormulaCompiler compiler(String ruleSet) throws IOException {
        return compiler(ruleSet, CompilerConfig.defaults());
    }

    private FormulaCompiler compiler(String ruleSet, CompilerConfig config) throws IOException {
        FormulaCompiler compiler = new FormulaCompiler(
                JsonHostRegistry.fromJson(resource("rulesets/" + ruleSet)), config, tracer);
        compiler.setCompilationListener(listener);
        return compiler;
    }

    @Test
    @DisplayName("Should compile a simple chain through every stage")
    void testCompile() throws IOException {
        CompilationResult result = compiler("basic.json").compile(
                CompilationRequest.builder().target("c").instant("2024-01-01").build());

        assertThat(result.order()).containsExactly("a", "b", "c");
        assertThat(result.hasModule()).isTrue();
        assertThat(result.module().language()).isEqualTo(TargetLanguage.PYTHON);
        assertThat(result.module().source()).contains("c = results['b'] + 1");
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.compilationNanos()).isPositive();
        assertThat(listener.started).containsExactly(
                "REFORM_PARSING", "CLOSURE_BUILDING", "ORDERING", "REFORM_APPLICATION", "SYNTHESIS");
        assertThat(listener.completed).containsExactlyElementsOf(listener.started);
        assertThat(listener.results.get(1).metrics()).containsEntry("variableCount", 3);
    }

    @Test
    @DisplayName("Should plan without synthesizing a module")
    void testPlan() throws IOException {
        CompilationResult result = compiler("income_tax.json").plan(
                CompilationRequest.builder().targets(TAX).instant("2024-01-01").build());

        assertThat(result.hasModule()).isFalse();
        assertThat(result.order()).containsExactly("employment_income", "pension_income", "is_blind",
                "total_income", "personal_allowance", "taxable_income", "income_tax");
        assertThat(result.parameters()).containsEntry("gov.tax.basic_rate", 0.2)
                .containsEntry("gov.tax.allowances.personal", 12570L);
        assertThat(listener.started).hasSize(4).doesNotContain("SYNTHESIS");
    }

    @Test
    @DisplayName("Should emit the requested language and module format")
    void testLanguageSelection() throws IOException {
        FormulaCompiler compiler = compiler("basic.json");

        CompilationResult js = compiler.compile(CompilationRequest.builder().target("c").instant("2024-01-01")
                .language(TargetLanguage.JAVASCRIPT).moduleFormat(ModuleFormat.COMMONJS).build());
        CompilationResult ts = compiler.compile(CompilationRequest.builder().target("c").instant("2024-01-01")
                .language(TargetLanguage.TYPESCRIPT).build());

        assertThat(js.module().source()).contains("const c = b + 1;").endsWith("module.exports = { calculate };\n");
        assertThat(ts.module().language()).isEqualTo(TargetLanguage.TYPESCRIPT);
        assertThat(ts.module().source()).contains("export default calculate;");
    }

    @Test
    @DisplayName("Should report missing variables and still produce a module")
    void testMissingVariable() throws IOException {
        CompilationResult result = compiler("basic.json").compile(
                CompilationRequest.builder().target("c").target("ghost").instant("2024-01-01").build());

        assertThat(result.order()).containsExactly("a", "b", "c");
        assertThat(result.diagnostics(Diagnostic.Kind.MISSING_VARIABLE))
                .extracting(Diagnostic::subject).containsExactly("ghost");
        assertThat(result.module().resultNames()).containsExactly("a", "b", "c");
    }

    @Nested
    @DisplayName("Reforms")
    class Reforms {

        @Test
        @DisplayName("Should overlay dated reform values effective at the instant")
        void testDatedReform() throws IOException {
            CompilationResult result = compiler("income_tax.json").compile(CompilationRequest.builder()
                    .targets(TAX).instant("2024-06-01").reform(resource("reforms/basic_rate_dated.json")).build());

            assertThat(result.parameters()).containsEntry("gov.tax.basic_rate", 0.25);
            assertThat(result.module().source()).contains("income_tax = results['taxable_income'] * 0.25");
        }

        @Test
        @DisplayName("Should overlay scalar reform values")
        void testScalarReform() throws IOException {
            CompilationResult result = compiler("income_tax.json").compile(CompilationRequest.builder()
                    .targets(TAX).year(2024).reform(resource("reforms/flat_allowance.json")).build());

            assertThat(result.parameters()).containsEntry("gov.tax.allowances.personal", 15000L);
            assertThat(result.module().source()).contains("personal_allowance = 15000 + where(blind, 3070, 0)");
            assertThat(listener.results.get(0).metrics()).containsEntry("overrideCount", 1);
        }

        @Test
        @DisplayName("Should reject a malformed reform before touching the registry")
        void testInvalidReform() {
            HostRegistry registry = mock(HostRegistry.class);
            FormulaCompiler compiler = new FormulaCompiler(registry, tracer);
            compiler.setCompilationListener(listener);

            assertThatThrownBy(() -> compiler.compile(CompilationRequest.builder()
                    .targets(TAX).instant("2024-01-01").reform("{\"gov.tax.basic_rate\": [0.2]}").build()))
                    .isInstanceOf(InvalidReformException.class);
            verifyNoInteractions(registry);
            assertThat(listener.failed).containsExactly("REFORM_PARSING");
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        @DisplayName("Should degrade to a diagnostic by default")
        void testLenient() throws IOException {
            CompilationResult result = compiler("cyclic.json").compile(
                    CompilationRequest.builder().target("z").instant("2024-01-01").build());

            assertThat(result.order()).containsExactly("seed", "z", "x", "y");
            assertThat(result.hasDiagnostics(Diagnostic.Kind.CYCLIC_DEPENDENCY)).isTrue();
            assertThat(result.hasModule()).isTrue();
        }

        @Test
        @DisplayName("Should fail in strict mode requested per compilation")
        void testStrictRequest() throws IOException {
            FormulaCompiler compiler = compiler("cyclic.json");

            assertThatThrownBy(() -> compiler.compile(
                    CompilationRequest.builder().target("z").instant("2024-01-01").strict(true).build()))
                    .isInstanceOfSatisfying(CyclicDependencyException.class, e ->
                            assertThat(e.getUnorderedVariables()).containsExactly("z", "x", "y"));
            assertThat(listener.failed).containsExactly("ORDERING");
        }

        @Test
        @DisplayName("Should fail when the configuration enables strict cycles")
        void testStrictConfig() throws IOException {
            FormulaCompiler compiler = compiler("cyclic.json", CompilerConfig.builder().strictCycles(true).build());

            assertThatThrownBy(() -> compiler.plan(
                    CompilationRequest.builder().target("x").instant("2024-01-01").build()))
                    .isInstanceOf(CyclicDependencyException.class);
        }

        @Test
        @DisplayName("Should let a request override strict configuration")
        void testRequestOverridesConfig() throws IOException {
            FormulaCompiler compiler = compiler("cyclic.json", CompilerConfig.builder().strictCycles(true).build());

            CompilationResult result = compiler.plan(
                    CompilationRequest.builder().target("x").instant("2024-01-01").strict(false).build());

            assertThat(result.hasDiagnostics(Diagnostic.Kind.CYCLIC_DEPENDENCY)).isTrue();
        }
    }

    private static class RecordingListener implements CompilationListener {
        final List<String> started = new ArrayList<>();
        final List<String> completed = new ArrayList<>();
        final List<String> failed = new ArrayList<>();
        final List<StageResult> results = new ArrayList<>();

        @Override
        public void onStageStart(String stageName, int stageNumber, int totalStages) {
            started.add(stageName);
        }

        @Override
        public void onStageComplete(String stageName, StageResult result) {
            completed.add(stageName);
            results.add(result);
        }

        @Override
        public void onError(String stageName, Exception error) {
            failed.add(stageName);
        }
    }
}
