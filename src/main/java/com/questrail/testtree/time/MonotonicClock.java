package com.questrail.testtree.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for run deadlines and case durations.
 *
 * <h2>Binding invariant</h2>
 * Deadline checks and elapsed-time measurement MUST use a monotonic time source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
