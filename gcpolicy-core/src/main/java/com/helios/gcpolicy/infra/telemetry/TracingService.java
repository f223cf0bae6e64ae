/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.gcpolicy.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for GC policy operations.
 *
 * Configuration via environment variables:
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - SERVICE_NAME: Service identifier (default: gc-policy)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.helios.gcpolicy";
    private static final String DEFAULT_SERVICE_NAME = "gc-policy";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = create(TracingService::lookupEnvironment);
                    if (instance.isEnabled()) {
                        Runtime.getRuntime().addShutdownHook(new Thread(instance::shutdown, "otel-shutdown-hook"));
                    }
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Tracing service that records nothing.
     */
    public static TracingService noop() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null);
    }

    /**
     * Builds a tracing service from the given settings. Keys are the
     * environment variable names listed above.
     */
    static TracingService create(Function<String, String> environment) {
        try {
            if (Boolean.parseBoolean(setting(environment, "OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return noop();
            }

            Resource resource = Resource.getDefault().merge(Resource.create(
                    Attributes.of(SERVICE_NAME, setting(environment, "SERVICE_NAME", DEFAULT_SERVICE_NAME))));

            Sampler sampler = configureSampler(environment);
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter(environment))
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("OpenTelemetry initialized: sampler=" + sampler.getDescription());

            return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Sampler configureSampler(Function<String, String> environment) {
        String ratio = setting(environment, "OTEL_TRACE_SAMPLING_RATIO", "1.0");
        double samplingRatio;
        try {
            samplingRatio = Math.max(0.0, Math.min(1.0, Double.parseDouble(ratio)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default");
            samplingRatio = 1.0;
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static SpanExporter configureExporter(Function<String, String> environment) {
        String exporterType = setting(environment, "OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = setting(environment, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> LoggingSpanExporter.create();
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    /**
     * Graceful shutdown with timeout.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String setting(Function<String, String> environment, String key, String defaultValue) {
        String value = environment.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static String lookupEnvironment(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }
}
