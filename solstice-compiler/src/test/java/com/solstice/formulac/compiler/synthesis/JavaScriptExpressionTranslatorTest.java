package com.solstice.formulac.compiler.synthesis;

import com.solstice.formulac.compiler.config.CompilerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JavaScriptExpressionTranslatorTest {

    private final JavaScriptExpressionTranslator translator =
            new JavaScriptExpressionTranslator(CompilerConfig.defaults());

    @Test
    @DisplayName("Should map math helpers to Math functions")
    void testFunctionMapping() {
        assertThat(translator.translate("max_(income - allowance, 0)"))
                .isEqualTo("Math.max(income - allowance, 0)");
        assertThat(translator.translate("np.minimum(a, np.maximum(b, 0))"))
                .isEqualTo("Math.min(a, Math.max(b, 0))");
        assertThat(translator.translate("round(x) + math.floor(y)")).isEqualTo("Math.round(x) + Math.floor(y)");
        assertThat(translator.translate("maximum(a, minimum(b, 0))")).isEqualTo("Math.max(a, Math.min(b, 0))");
        assertThat(translator.translate("ceil(a) + floor(b) + sqrt(c) + exp(d) + log(e)"))
                .isEqualTo("Math.ceil(a) + Math.floor(b) + Math.sqrt(c) + Math.exp(d) + Math.log(e)");
    }

    @Test
    @DisplayName("Should not map names that are not called")
    void testUncalledNames() {
        assertThat(translator.translate("max + min_value")).isEqualTo("max + min_value");
    }

    @Test
    @DisplayName("Should rewrite floor division")
    void testFloorDivision() {
        assertThat(translator.translate("income // 12")).isEqualTo("Math.floor(income / 12)");
        assertThat(translator.translate("f(a, b) // weeks[0] + 1")).isEqualTo("Math.floor(f(a, b) / weeks[0]) + 1");
    }

    @Test
    @DisplayName("Should take floor division operands with Python precedence")
    void testFloorDivisionPrecedence() {
        assertThat(translator.translate("x * 3 // 2")).isEqualTo("Math.floor(x * 3 / 2)");
        assertThat(translator.translate("x / 2 // 2")).isEqualTo("Math.floor(x / 2 / 2)");
        assertThat(translator.translate("-x // 2")).isEqualTo("Math.floor(-x / 2)");
        assertThat(translator.translate("x // 2 ** 2")).isEqualTo("Math.floor(x / 2 ** 2)");
        assertThat(translator.translate("a + b * c // d - e")).isEqualTo("a + Math.floor(b * c / d) - e");
        assertThat(translator.translate("a // b // c")).isEqualTo("Math.floor(Math.floor(a / b) / c)");
        assertThat(translator.translate("a // b * c")).isEqualTo("Math.floor(a / b) * c");
        assertThat(translator.translate("a - -b // 2")).isEqualTo("a - Math.floor(-b / 2)");
        assertThat(translator.translate("max(a, b * 2 // 3)")).isEqualTo("Math.max(a, Math.floor(b * 2 / 3))");
        assertThat(translator.translate("1e-5 * x // 2")).isEqualTo("Math.floor(1e-5 * x / 2)");
        assertThat(translator.translate("c if a // 2 else d")).isEqualTo("c if Math.floor(a / 2) else d");
    }

    @Test
    @DisplayName("Should translate boolean operators and constants")
    void testBooleans() {
        assertThat(translator.translate("a and b or c")).isEqualTo("a && b || c");
        assertThat(translator.translate("not eligible and age > 65")).isEqualTo("!(eligible) && age > 65");
        assertThat(translator.translate("f(not a, b)")).isEqualTo("f(!(a), b)");
        assertThat(translator.translate("True if x else None")).startsWith("true");
        assertThat(translator.translate("flag == False")).isEqualTo("flag == false");
    }

    @Test
    @DisplayName("Should drop digit separators")
    void testDigitSeparators() {
        assertThat(translator.translate("12_570 + 1_000.5")).isEqualTo("12570 + 1000.5");
    }

    @Test
    @DisplayName("Should never touch string literals")
    void testStrings() {
        assertThat(translator.translate("\"not and or True // max_(\"")).isEqualTo("\"not and or True // max_(\"");
    }
}
