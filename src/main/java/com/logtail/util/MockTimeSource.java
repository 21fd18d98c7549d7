package com.logtail.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mock time source for testing.
 * Allows controlled time progression.
 */
public final class MockTimeSource implements TimeSource {
    private final AtomicLong nanoTime;

    public MockTimeSource(long initialNanos) {
        this.nanoTime = new AtomicLong(initialNanos);
    }

    @Override
    public long nanoTime() {
        return nanoTime.get();
    }

    /**
     * Advances time by the specified duration.
     */
    public void advance(Duration duration) {
        nanoTime.addAndGet(duration.toNanos());
    }
}
