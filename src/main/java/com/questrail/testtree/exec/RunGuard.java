package com.questrail.testtree.exec;

import com.questrail.testtree.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * RunGuard
 * -----------------------------------------------------------------------------
 * Cancellation state shared by all workers of one run.
 *
 * <p>A run stops dispatching new cases once its deadline has passed or
 * {@link #abort(String)} has been called. Bodies already running are never
 * interrupted; strategies consult the guard only between cases.</p>
 */
public final class RunGuard
{
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final MonotonicClock clock;
    private final long deadlineNanos;
    private final Duration timeout;
    private final AtomicReference<String> abortReason = new AtomicReference<>();

    private RunGuard(MonotonicClock clock, long deadlineNanos, Duration timeout)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadlineNanos = deadlineNanos;
        this.timeout = timeout;
    }

    /** A guard with no deadline; it stops only when aborted. */
    public static RunGuard unbounded(MonotonicClock clock)
    {
        return new RunGuard(clock, NO_DEADLINE, null);
    }

    /** A guard whose deadline is {@code timeout} from now. */
    public static RunGuard withTimeout(MonotonicClock clock, Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        long now = clock.nowNanos();
        long nanos = timeout.toNanos();
        long deadline = now + nanos < now ? NO_DEADLINE : now + nanos;
        return new RunGuard(clock, deadline, timeout);
    }

    /**
     * Requests that no further cases be started. The first reason wins.
     */
    public void abort(String reason)
    {
        abortReason.compareAndSet(null, Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Why dispatching must stop, or empty while the run may continue.
     */
    public Optional<String> stopReason()
    {
        String reason = abortReason.get();
        if (reason != null) {
            return Optional.of(reason);
        }
        if (deadlineNanos != NO_DEADLINE && clock.nowNanos() >= deadlineNanos) {
            return Optional.of("timeout of " + timeout.toMillis() + " ms exceeded");
        }
        return Optional.empty();
    }

    public boolean shouldStop()
    {
        return stopReason().isPresent();
    }

    /** Time left before the deadline; empty when there is no deadline. */
    public Optional<Duration> remaining()
    {
        if (deadlineNanos == NO_DEADLINE) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - clock.nowNanos())));
    }
}
