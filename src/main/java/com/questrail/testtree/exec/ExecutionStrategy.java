package com.questrail.testtree.exec;

import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.record.OutcomeRecorder;

import java.util.List;

/**
 * ExecutionStrategy
 * =============================================================================
 * Policy deciding when, and on which worker, each case body runs.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Each case in {@code pending} is dispatched exactly once: its body runs
 *       once, or it is recorded as aborted/crashed without running.</li>
 *   <li>Two different cases are never run as the same logical unit.</li>
 *   <li>Every outcome is routed to {@code recorder} under the case's id before
 *       {@link #execute} returns.</li>
 *   <li>{@link #execute} blocks until every dispatched body has finished.</li>
 * </ul>
 */
public interface ExecutionStrategy
{
    /** Name used in logs and reports, e.g. {@code parallel}. */
    String name();

    void execute(List<ScheduledCase> pending, OutcomeRecorder recorder);
}
