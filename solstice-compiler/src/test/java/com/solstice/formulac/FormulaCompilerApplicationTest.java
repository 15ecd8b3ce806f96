package com.solstice.formulac;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FormulaCompilerApplicationTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private FormulaCompilerApplication app;
    private Path rules;

    @BeforeEach
    void setUp() throws IOException {
        app = new FormulaCompilerApplication(new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
        rules = copy("rulesets/income_tax.json");
    }

    private Path copy(String resource) throws IOException {
        Path target = dir.resolve(Path.of(resource).getFileName());
        try (InputStream in = getClass().getResourceAsStream("/" + resource)) {
            assertThat(in).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should print a Python module to standard output")
    void testPythonToStdout() {
        int status = app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax",
                "--date", "2024-01-01"});

        assertThat(status).isZero();
        assertThat(out()).contains("def calculate(").contains("income_tax = results['taxable_income'] * 0.2");
    }

    @Test
    @DisplayName("Should write a JavaScript module with a reform applied")
    void testJavaScriptToFile() throws IOException {
        Path reform = copy("reforms/basic_rate_dated.json");
        Path output = dir.resolve("calc.mjs");

        int status = app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax",
                "--date", "2024-06-01", "--reform", reform.toString(), "--target", "javascript",
                "--output", output.toString()});

        assertThat(status).isZero();
        assertThat(Files.readString(output))
                .contains("const income_tax = taxable_income * 0.25;")
                .contains("export default calculate;");
        assertThat(out()).isEmpty();
        assertThat(err()).contains("Wrote javascript module to");
    }

    @Test
    @DisplayName("Should print the evaluation plan on a dry run")
    void testDryRun() {
        int status = app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax",
                "--year", "2024", "--dry-run"});

        assertThat(status).isZero();
        assertThat(out())
                .contains("Evaluation order (7 variables):")
                .contains("1. employment_income (input, default 0)")
                .contains("7. income_tax (computed)")
                .contains("depends on: total_income, personal_allowance")
                .contains("gov.tax.basic_rate = 0.2")
                .doesNotContain("def calculate");
    }

    @Test
    @DisplayName("Should write an HTML calculator next to the module")
    void testHtml() throws IOException {
        Path html = dir.resolve("calc.html");

        int status = app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax",
                "--year", "2024", "--html", html.toString(), "--title", "Income Tax"});

        assertThat(status).isZero();
        assertThat(Files.readString(html))
                .contains("<title>Income Tax</title>")
                .contains("id=\"result-income_tax\"")
                .contains("const income_tax = taxable_income * 0.2;");
    }

    @Test
    @DisplayName("Should report missing variables as warnings")
    void testMissingVariable() {
        int status = app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax,ghost",
                "--year", "2024"});

        assertThat(status).isZero();
        assertThat(err()).contains("Warning: Variable 'ghost' not found");
    }

    @Test
    @DisplayName("Should exit with 1 on strict cycles, malformed reforms and unreadable files")
    void testFailures() throws IOException {
        Path cyclic = copy("rulesets/cyclic.json");
        Path badReform = dir.resolve("bad.json");
        Files.writeString(badReform, "{\"gov.tax.basic_rate\": {\"soon\": 1}}");

        assertThat(app.run(new String[]{"--rules", cyclic.toString(), "--variables", "z", "--strict"})).isEqualTo(1);
        assertThat(app.run(new String[]{"--rules", rules.toString(), "--variables", "income_tax",
                "--reform", badReform.toString()})).isEqualTo(1);
        assertThat(app.run(new String[]{"--rules", dir.resolve("missing.json").toString(), "--variables", "a"}))
                .isEqualTo(1);
        assertThat(err()).contains("Compilation failed: Circular variable definitions")
                .contains("non-date key 'soon'")
                .contains("I/O error");
    }

    @Test
    @DisplayName("Should exit with 2 and print usage on invalid arguments")
    void testUsageError() {
        assertThat(app.run(new String[]{"--variables", "a"})).isEqualTo(2);
        assertThat(err()).contains("Missing required option --rules").contains("Usage:");
        assertThat(app.run(new String[]{"--help"})).isZero();
        assertThat(out()).contains("Usage:");
    }
}
