package com.solstice.formulac.compiler.synthesis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConditionalFlattenerTest {

    private final ConditionalFlattener flattener = new ConditionalFlattener();

    @Test
    @DisplayName("Should turn where calls into ternaries")
    void testSimple() {
        assertThat(flattener.flatten("where(blind, 3070, 0)")).isEqualTo("((blind) ? (3070) : (0))");
        assertThat(flattener.flatten("np.where(a > b, a, b)")).isEqualTo("((a > b) ? (a) : (b))");
    }

    @Test
    @DisplayName("Should flatten conditionals nested in any argument")
    void testNested() {
        assertThat(flattener.flatten("where(a, where(b, 1, 2), numpy.where(c, 3, 4))"))
                .isEqualTo("((a) ? (((b) ? (1) : (2))) : (((c) ? (3) : (4))))");
    }

    @Test
    @DisplayName("Should leave malformed sites and strings alone")
    void testMalformed() {
        assertThat(flattener.flatten("where(a, b)")).isEqualTo("where(a, b)");
        assertThat(flattener.flatten("where(a, b, c")).isEqualTo("where(a, b, c");
        assertThat(flattener.flatten("\"where(a, b, c)\"")).isEqualTo("\"where(a, b, c)\"");
        assertThat(flattener.flatten("somewhere(a, b, c)")).isEqualTo("somewhere(a, b, c)");
    }
}
