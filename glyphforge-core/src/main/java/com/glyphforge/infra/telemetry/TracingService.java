package com.glyphforge.infra.telemetry;

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
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for recognition and compilation stages.
 *
 * Tracing is off unless enabled, since most runs are one-shot CLI invocations.
 *
 * Configuration via environment variables or system properties:
 * - OTEL_ENABLED: Turn tracing on (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - SERVICE_NAME: Service identifier (default: glyphforge)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.glyphforge";
    private static final String DEFAULT_SERVICE_NAME = "glyphforge";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;

        if (!isNoop) {
            registerShutdownHook();
        }
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
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * A tracer that records nothing, for tests and embedded use.
     */
    public static Tracer noopTracer() {
        return OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME);
    }

    private static TracingService initialize() {
        try {
            if (!Boolean.parseBoolean(getEnvOrProperty("OTEL_ENABLED", "false"))) {
                logger.fine("OpenTelemetry tracing is disabled");
                return createNoopInstance();
            }

            logger.info("Initializing OpenTelemetry tracing...");

            Resource resource = Resource.getDefault().merge(Resource.create(
                Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                    .build()));

            Sampler sampler = configureSampler();
            SpanExporter spanExporter = configureExporter();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .setSampler(sampler)
                .addSpanProcessor(
                    BatchSpanProcessor.builder(spanExporter)
                        .setMaxQueueSize(2048)
                        .setMaxExportBatchSize(256)
                        .setScheduleDelay(Duration.ofSeconds(5))
                        .setExporterTimeout(Duration.ofSeconds(30))
                        .build())
                .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

            logger.info("OpenTelemetry initialized: sampler=" + sampler.getDescription());
            return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return createNoopInstance();
        }
    }

    private static TracingService createNoopInstance() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static Sampler configureSampler() {
        double ratio;
        try {
            ratio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0"));
            ratio = Math.max(0.0, Math.min(1.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using 1.0");
            ratio = 1.0;
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();

        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
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

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
    }

    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (Exception e) {
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
        return !isNoop;
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
