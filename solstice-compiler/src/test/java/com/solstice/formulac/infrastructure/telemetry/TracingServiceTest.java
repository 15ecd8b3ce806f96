package com.solstice.formulac.infrastructure.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TracingServiceTest {

    @Test
    @DisplayName("Should share one tracer across callers")
    void testSingleton() {
        assertThat(TracingService.getInstance()).isSameAs(TracingService.getInstance());
        assertThat(TracingService.getInstance().getTracer()).isNotNull();
    }

    @Test
    @DisplayName("Should build spans whether or not tracing is enabled")
    void testSpan() {
        Span span = TracingService.getInstance().getTracer().spanBuilder("closure-building").startSpan();

        assertThatCode(() -> {
            span.setAttribute("variableCount", 3L);
            span.end();
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should read the enable switch from the system property")
    void testEnableSwitch() {
        String previous = System.getProperty("solstice.tracing.enabled");
        try {
            System.setProperty("solstice.tracing.enabled", "true");
            boolean expected = System.getenv("SOLSTICE_TRACING_ENABLED") == null
                    || System.getenv("SOLSTICE_TRACING_ENABLED").isBlank()
                    || Boolean.parseBoolean(System.getenv("SOLSTICE_TRACING_ENABLED").trim());
            assertThat(TracingService.isEnabled()).isEqualTo(expected);
        } finally {
            if (previous == null) {
                System.clearProperty("solstice.tracing.enabled");
            } else {
                System.setProperty("solstice.tracing.enabled", previous);
            }
        }
    }
}
