package com.glyphforge.infra.metrics.internal;

import com.glyphforge.infra.metrics.Counter;
import com.glyphforge.infra.metrics.MetricsRegistry;
import com.glyphforge.infra.metrics.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Registry that discards everything.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter NOOP_COUNTER = new Counter() {
        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0;
        }
    };

    private static final Timer NOOP_TIMER = new Timer() {
        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            return callable.call();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0;
        }

        @Override
        public Duration percentile(double percentile) {
            return Duration.ZERO;
        }
    };

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return NOOP_COUNTER;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NOOP_TIMER;
    }

    @Override
    public Map<String, Object> snapshot() {
        return Map.of();
    }
}
