package com.questrail.testtree.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to. Case bodies advance it to simulate slow
 * cases, so deadlines and durations are deterministic.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advanceMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("a monotonic clock cannot go back " + millis + " ms");
        }
        nowNanos.addAndGet(millis * 1_000_000L);
    }
}
