package com.glyphforge.infra.metrics;

import com.glyphforge.infra.metrics.internal.NoOpMetricsRegistry;

import java.util.Map;

/**
 * Framework-agnostic metrics registry.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = new InMemoryMetricsRegistry();
 * metrics.counter("grids_processed").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    String GRIDS_PROCESSED = "grids_processed";
    String COMPONENTS_DISCOVERED = "components_discovered";
    String PATTERN_MATCHES = "pattern_matches";
    String DSL_WARNINGS = "dsl_warnings";
    String RECOGNITION_LATENCY = "recognition_latency";

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     */
    Timer timer(String name, String... tags);

    /**
     * Point-in-time view of every metric, keyed by metric name including tags.
     * Counters map to their count, timers to a map of count and percentiles.
     */
    Map<String, Object> snapshot();

    static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }
}
