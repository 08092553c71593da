package com.glyphforge.infra.metrics.impl.inmemory;

import com.glyphforge.infra.metrics.Counter;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.infra.metrics.Timer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry backing the service's {@code /metrics} endpoint. Thread-safe.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.count()));
        timers.forEach((name, timer) -> {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("count", timer.count());
            stats.put("p50_micros", timer.percentile(0.50).toNanos() / 1_000);
            stats.put("p99_micros", timer.percentile(0.99).toNanos() / 1_000);
            snapshot.put(name, stats);
        });
        return snapshot;
    }

    static String key(String name, String... tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + String.join(",", tags));
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return sb.append('}').toString();
    }
}
