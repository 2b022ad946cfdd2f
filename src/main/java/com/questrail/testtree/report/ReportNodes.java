package com.questrail.testtree.report;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestNode;
import com.questrail.testtree.model.TestTree;

import java.time.Duration;
import java.util.Optional;

/**
 * Tree queries shared by the reporters.
 *
 * <p>A case is reported when it has a result, i.e. it was selected for the run.
 * A suite is reported when its subtree contains a reported case or a build
 * error; the root is always reported.</p>
 */
final class ReportNodes
{
    private ReportNodes() {}

    static void requireFinalized(TestTree tree)
    {
        if (!tree.isFinalized()) {
            throw new IllegalStateException("tree " + tree.root().id() + " has not been run yet");
        }
    }

    static boolean isReported(TestNode node)
    {
        if (node instanceof CaseNode) {
            return ((CaseNode) node).result().isPresent();
        }
        SuiteNode suite = (SuiteNode) node;
        if (suite.buildError().isPresent()) {
            return true;
        }
        for (TestNode child : suite.children()) {
            if (isReported(child)) {
                return true;
            }
        }
        return false;
    }

    /** Number of reported cases below {@code node} (1 for a reported case). */
    static int reportedCases(TestNode node)
    {
        if (node instanceof CaseNode) {
            return ((CaseNode) node).result().isPresent() ? 1 : 0;
        }
        int n = 0;
        for (TestNode child : ((SuiteNode) node).children()) {
            n += reportedCases(child);
        }
        return n;
    }

    static int buildErrors(TestNode node)
    {
        if (node instanceof CaseNode) {
            return 0;
        }
        SuiteNode suite = (SuiteNode) node;
        int n = suite.buildError().isPresent() ? 1 : 0;
        for (TestNode child : suite.children()) {
            n += buildErrors(child);
        }
        return n;
    }

    static Duration duration(TestNode node)
    {
        if (node instanceof CaseNode) {
            return ((CaseNode) node).result().map(CaseResult::duration).orElse(Duration.ZERO);
        }
        Duration sum = Duration.ZERO;
        for (TestNode child : ((SuiteNode) node).children()) {
            sum = sum.plus(duration(child));
        }
        return sum;
    }

    /** The first {@code Failed} or {@code Errored} outcome of a case, in evaluation order. */
    static Optional<AssertionOutcome> firstFailing(CaseResult result)
    {
        for (AssertionOutcome o : result.outcomes()) {
            if (o.isFailing()) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
