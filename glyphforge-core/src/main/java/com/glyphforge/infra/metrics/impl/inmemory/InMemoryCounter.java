package com.glyphforge.infra.metrics.impl.inmemory;

import com.glyphforge.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong(0);

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment must be non-negative: " + amount);
        }
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }
}
