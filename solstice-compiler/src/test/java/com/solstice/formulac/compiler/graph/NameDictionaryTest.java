package com.solstice.formulac.compiler.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NameDictionaryTest {

    @Test
    @DisplayName("Should assign dense ids in first-seen order")
    void testEncode() {
        NameDictionary dictionary = new NameDictionary();

        assertThat(dictionary.encode("income")).isZero();
        assertThat(dictionary.encode("tax")).isEqualTo(1);
        assertThat(dictionary.encode("income")).isZero();
        assertThat(dictionary.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should decode ids and report unknown names")
    void testDecode() {
        NameDictionary dictionary = new NameDictionary();
        dictionary.encode("income");

        assertThat(dictionary.decode(0)).isEqualTo("income");
        assertThat(dictionary.decode(7)).isNull();
        assertThat(dictionary.getId("income")).isZero();
        assertThat(dictionary.getId("unknown")).isEqualTo(-1);
    }
}
