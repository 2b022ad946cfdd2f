package com.questrail.testtree.model;

/**
 * TestNode
 * -----------------------------------------------------------------------------
 * A node of the test tree: either a {@link SuiteNode} or a {@link CaseNode}.
 *
 * <h2>Shape</h2>
 * The set of nodes and their parent/child edges is fixed by the build pass.
 * After that the only writes are each case's result and each suite's aggregate,
 * each made exactly once by a single owner.
 */
public sealed interface TestNode permits SuiteNode, CaseNode {

    String name();

    /** Names of the enclosing suites, root first. Empty for the root suite. */
    TestPath path();

    /** Full path of this node: {@link #path()} followed by {@link #name()}. */
    default TestPath id() {
        return path().child(name());
    }

    /** Counts of this node. For suites only valid once aggregates are finalized. */
    Counts counts();
}
