package com.questrail.testtree.runtime;

import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.TestTree;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one run.
 *
 * @param tree      the finalized tree
 * @param success   no failed or errored assertion anywhere and no build error
 * @param summary   rendered summary table
 * @param xmlReport the written JUnit XML file; {@code null} when none was
 *                  requested or writing it failed
 */
public record RunResult(TestTree tree, boolean success, String summary, Path xmlReport) {
    public RunResult {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(summary, "summary");
    }

    public Counts totals() {
        return tree.root().counts();
    }

    public Optional<Path> xmlReportPath() {
        return Optional.ofNullable(xmlReport);
    }
}
