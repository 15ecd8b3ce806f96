package com.solstice.formulac.compiler.reform;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DatedValuesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should recognize YYYY-MM-DD keys only")
    void testIsDate() {
        assertThat(DatedValues.isDate("2024-04-06")).isTrue();
        assertThat(DatedValues.isDate("2024-4-6")).isFalse();
        assertThat(DatedValues.isDate("values")).isFalse();
        assertThat(DatedValues.isDate(null)).isFalse();
    }

    @Test
    @DisplayName("Should select the latest date not after the instant")
    void testLatestOnOrBefore() {
        List<String> dates = List.of("2025-04-06", "2020-01-01", "2023-04-06");

        assertThat(DatedValues.latestOnOrBefore(dates, "2024-01-01")).isEqualTo("2023-04-06");
        assertThat(DatedValues.latestOnOrBefore(dates, "2025-04-06")).isEqualTo("2025-04-06");
        assertThat(DatedValues.latestOnOrBefore(dates, "2019-12-31")).isNull();
    }

    @Test
    @DisplayName("Should convert JSON scalars to Java values")
    void testScalar() throws Exception {
        assertThat(DatedValues.scalar(mapper.readTree("12570"))).isEqualTo(12570L);
        assertThat(DatedValues.scalar(mapper.readTree("0.2"))).isEqualTo(0.2);
        assertThat(DatedValues.scalar(mapper.readTree("true"))).isEqualTo(true);
        assertThat(DatedValues.scalar(mapper.readTree("\"GBP\""))).isEqualTo("GBP");
        assertThat(DatedValues.scalar(mapper.readTree("null"))).isNull();
        assertThatThrownBy(() -> DatedValues.scalar(mapper.readTree("[1]")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
