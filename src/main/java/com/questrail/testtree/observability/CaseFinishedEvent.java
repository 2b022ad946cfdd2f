package com.questrail.testtree.observability;

import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.TestPath;

import java.time.Instant;

/**
 * Record emitted when a case has produced its result.
 */
public record CaseFinishedEvent(
    Instant timestamp,
    TestPath caseId,
    CaseResult result
) {
}
