package com.questrail.testtree.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the engine itself.
 */
public record RunErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
