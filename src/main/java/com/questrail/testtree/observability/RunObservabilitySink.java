package com.questrail.testtree.observability;

/**
 * Main interface for receiving engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Case events are delivered from whichever thread runs the case, so
 * implementations must be safe for concurrent use.</p>
 */
public interface RunObservabilitySink {
    /**
     * Called when a suite's discovery body fails during the build pass.
     * @param event the failing suite and its error
     */
    void onBuildError(BuildErrorEvent event);

    /**
     * Called just before a case body is invoked.
     * @param event the case and the worker running it
     */
    void onCaseStarted(CaseStartedEvent event);

    /**
     * Called once a case's result has been handed to the recorder.
     * @param event the case and its result
     */
    void onCaseFinished(CaseFinishedEvent event);

    /**
     * Called after aggregates are finalized.
     * @param event strategy name, root counts and elapsed time
     */
    void onRunFinished(RunFinishedEvent event);

    /**
     * Called when an error occurs in the engine itself (not in a case body).
     * @param event the error event
     */
    void onError(RunErrorEvent event);
}
