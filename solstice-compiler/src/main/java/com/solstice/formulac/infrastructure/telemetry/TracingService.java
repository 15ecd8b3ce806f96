package com.solstice.formulac.infrastructure.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

import java.util.logging.Logger;

/**
 * Provides the tracer used around compilation stages.
 *
 * <p>Tracing is off unless {@code SOLSTICE_TRACING_ENABLED=true} (or the system
 * property {@code solstice.tracing.enabled}); when on, finished spans are
 * written through java.util.logging.
 */
public class TracingService {

    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.solstice.formula-compiler";
    private static final TracingService INSTANCE;

    static {
        INSTANCE = new TracingService(isEnabled() ? sdkTracer() : OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    private final Tracer tracer;

    private TracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public static TracingService getInstance() {
        return INSTANCE;
    }

    public Tracer getTracer() {
        return tracer;
    }

    static boolean isEnabled() {
        String env = System.getenv("SOLSTICE_TRACING_ENABLED");
        if (env != null && !env.isBlank()) {
            return Boolean.parseBoolean(env.trim());
        }
        return Boolean.getBoolean("solstice.tracing.enabled");
    }

    private static Tracer sdkTracer() {
        logger.info("Tracing enabled, exporting spans to the log");
        return OpenTelemetrySdk.builder()
                .setTracerProvider(
                        SdkTracerProvider.builder()
                                .addSpanProcessor(SimpleSpanProcessor.create(LoggingSpanExporter.create()))
                                .build()
                )
                .build()
                .getTracer(INSTRUMENTATION_NAME);
    }
}
