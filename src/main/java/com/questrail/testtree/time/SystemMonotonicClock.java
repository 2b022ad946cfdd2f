package com.questrail.testtree.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Used for run deadlines and case durations in production runs and in
 * worker processes. Unaffected by wall-clock adjustments; thread-safe.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
