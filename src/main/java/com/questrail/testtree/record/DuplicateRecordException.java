package com.questrail.testtree.record;

import com.questrail.testtree.model.TestPath;

/**
 * Thrown when a second result is recorded for the same case.
 *
 * <p>This always indicates a defect in an execution strategy: every case is
 * owned by exactly one worker and reported exactly once.</p>
 */
public final class DuplicateRecordException extends RuntimeException
{
    public DuplicateRecordException(TestPath caseId) {
        super("outcomes for " + caseId + " were already recorded");
    }
}
