package com.questrail.testtree.exec;

import com.questrail.testtree.core.Throwables;
import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.observability.CaseFinishedEvent;
import com.questrail.testtree.observability.CaseStartedEvent;
import com.questrail.testtree.observability.RunObservabilitySink;
import com.questrail.testtree.record.OutcomeRecorder;
import com.questrail.testtree.time.MonotonicClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * CaseRunner
 * =============================================================================
 * Runs one case body at a case boundary.
 *
 * <h2>Isolation</h2>
 * <p>Nothing escapes a case boundary. An exception thrown by the body appends an
 * {@link AssertionOutcome.Errored} to the outcomes produced so far and ends the
 * body; later assertions in that body are never evaluated.</p>
 *
 * <h2>Cancellation</h2>
 * <p>{@link #dispatch} consults the {@link RunGuard} before starting a body. A
 * case that is not started because the run was aborted or timed out is recorded
 * as {@link CaseStatus#ABORTED}, distinguishable from assertion failures.</p>
 *
 * <p>Shared by every worker of a strategy; it holds no per-case state.</p>
 */
public final class CaseRunner
{
    private final RunObservabilitySink sink;
    private final MonotonicClock clock;
    private final RunGuard guard;

    public CaseRunner(RunObservabilitySink sink, MonotonicClock clock, RunGuard guard)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    /**
     * Runs the case unless the run is stopping, then records its result.
     *
     * @param worker name of the thread or process doing the work, for observability
     */
    public void dispatch(ScheduledCase sc, OutcomeRecorder recorder, String worker)
    {
        CaseResult result = runOrAbort(sc, worker);
        recorder.record(sc.id(), result);
        sink.onCaseFinished(new CaseFinishedEvent(Instant.now(), sc.id(), result));
    }

    /**
     * Runs the case unless the run is stopping; does not record anything.
     * Used by distributed workers, which ship the result to their coordinator.
     */
    public CaseResult runOrAbort(ScheduledCase sc, String worker)
    {
        Optional<String> stop = guard.stopReason();
        if (stop.isPresent()) {
            return aborted(stop.get());
        }
        return run(sc, worker);
    }

    /** Invokes the body unconditionally and captures its outcomes. */
    public CaseResult run(ScheduledCase sc, String worker)
    {
        sink.onCaseStarted(new CaseStartedEvent(Instant.now(), sc.id(), worker));

        BufferedCaseContext context = new BufferedCaseContext();
        long start = clock.nowNanos();
        try {
            sc.node().body().run(context);
        }
        catch (Throwable t) {
            Throwables.rethrowIfUnrecoverable(t);
            context.record(AssertionOutcome.Errored.of(t));
        }
        long elapsed = Math.max(0, clock.nowNanos() - start);
        return context.close(Duration.ofNanos(elapsed));
    }

    public static CaseResult aborted(String reason)
    {
        return CaseResult.unexecuted(CaseStatus.ABORTED, "aborted: " + reason);
    }
}
