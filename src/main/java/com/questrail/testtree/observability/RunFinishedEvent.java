package com.questrail.testtree.observability;

import com.questrail.testtree.model.Counts;

import java.time.Duration;
import java.time.Instant;

/**
 * Record emitted once the aggregates of a run have been finalized.
 */
public record RunFinishedEvent(
    Instant timestamp,
    String strategy,
    Counts totals,
    Duration elapsed
) {
}
