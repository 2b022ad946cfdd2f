package com.questrail.testtree.model;

/**
 * How a case's recorded result came to be.
 */
public enum CaseStatus {
    /** The body ran (to completion or until it threw). */
    EXECUTED,
    /** The run was aborted or timed out before the body was started. */
    ABORTED,
    /** The worker process assigned to the case was lost before reporting it. */
    CRASHED,
    /** The case was selected but no strategy ever reported it. */
    NOT_RUN
}
