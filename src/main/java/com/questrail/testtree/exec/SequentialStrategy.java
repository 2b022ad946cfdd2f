package com.questrail.testtree.exec;

import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.record.OutcomeRecorder;

import java.util.List;
import java.util.Objects;

/**
 * Runs cases one at a time, in the order given, on the calling thread.
 *
 * <p>The baseline for correctness: with discovery-ordered input it reproduces
 * plain single-threaded behavior exactly.</p>
 */
public class SequentialStrategy implements ExecutionStrategy
{
    private final CaseRunner runner;

    public SequentialStrategy(CaseRunner runner)
    {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public String name()
    {
        return "sequential";
    }

    @Override
    public void execute(List<ScheduledCase> pending, OutcomeRecorder recorder)
    {
        String worker = Thread.currentThread().getName();
        for (ScheduledCase sc : order(pending)) {
            runner.dispatch(sc, recorder, worker);
        }
    }

    /** Order in which {@code pending} is run; discovery order here. */
    protected List<ScheduledCase> order(List<ScheduledCase> pending)
    {
        return pending;
    }
}
