package com.questrail.testtree.model;

import java.util.Objects;

/**
 * Unit of work handed to an execution strategy.
 *
 * @param index discovery index of the case in the full tree; identical in every
 *              process that builds the same plan
 * @param path  resolved ancestor path of the case
 * @param node  the case itself
 */
public record ScheduledCase(int index, TestPath path, CaseNode node) {
    public ScheduledCase {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative");
        }
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(node, "node");
        if (!path.equals(node.path())) {
            throw new IllegalArgumentException("path " + path + " does not match case " + node.id());
        }
    }

    /** Full path of the case, used as its key in the outcome recorder. */
    public TestPath id() {
        return node.id();
    }
}
