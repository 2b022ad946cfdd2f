package com.questrail.testtree.observability;

import com.questrail.testtree.model.BuildError;
import com.questrail.testtree.model.TestPath;

import java.time.Instant;

/**
 * Record describing a suite whose discovery body failed.
 */
public record BuildErrorEvent(
    Instant timestamp,
    TestPath suite,
    BuildError error
) {
}
