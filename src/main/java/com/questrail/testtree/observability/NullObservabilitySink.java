package com.questrail.testtree.observability;

/**
 * No-op implementation of RunObservabilitySink.
 */
public final class NullObservabilitySink implements RunObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onBuildError(BuildErrorEvent event) {}

    @Override
    public void onCaseStarted(CaseStartedEvent event) {}

    @Override
    public void onCaseFinished(CaseFinishedEvent event) {}

    @Override
    public void onRunFinished(RunFinishedEvent event) {}

    @Override
    public void onError(RunErrorEvent event) {}
}
