package com.questrail.testtree.observability;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RunObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRunObservabilitySink implements RunObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRunObservabilitySink.class);

    @Override
    public void onBuildError(BuildErrorEvent event) {
        log.warn("Discovery of suite {} failed: {} ({})",
            event.suite(),
            event.error().description(),
            event.error().originatingLocation().orElse("unknown location"));
    }

    @Override
    public void onCaseStarted(CaseStartedEvent event) {
        log.debug("Case {} started on {}", event.caseId(), event.worker());
    }

    @Override
    public void onCaseFinished(CaseFinishedEvent event) {
        CaseResult result = event.result();
        if (result.status() != CaseStatus.EXECUTED) {
            log.warn("Case {} {}: {}", event.caseId(), result.status(),
                result.outcomes().isEmpty() ? "" : describe(result.outcomes().get(0)));
            return;
        }
        if (result.counts().isFailing()) {
            log.info("Case {} FAILED [{}] in {} ms", event.caseId(), result.counts(), result.duration().toMillis());
        } else {
            log.debug("Case {} passed [{}] in {} ms", event.caseId(), result.counts(), result.duration().toMillis());
        }
    }

    @Override
    public void onRunFinished(RunFinishedEvent event) {
        log.info("Run finished ({}): {} in {} ms", event.strategy(), event.totals(), event.elapsed().toMillis());
    }

    @Override
    public void onError(RunErrorEvent event) {
        log.error("Engine error: {}", event.message(), event.cause());
    }

    private static String describe(AssertionOutcome outcome) {
        if (outcome instanceof AssertionOutcome.Errored) {
            return ((AssertionOutcome.Errored) outcome).description();
        }
        return outcome.toString();
    }
}
