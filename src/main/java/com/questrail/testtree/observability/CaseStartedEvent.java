package com.questrail.testtree.observability;

import com.questrail.testtree.model.TestPath;

import java.time.Instant;

/**
 * Record emitted when a case body is about to run.
 *
 * @param worker name of the thread or worker process running the case
 */
public record CaseStartedEvent(
    Instant timestamp,
    TestPath caseId,
    String worker
) {
}
