package com.questrail.testtree.report;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.BuildError;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.SectionResult;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestNode;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SummaryReporter
 * =============================================================================
 * Renders a finalized tree as a plain-text table.
 *
 * <pre>
 *   Calculator                               pass=4 fail=1 error=1 broken=0
 *     math                                   pass=2 fail=1 error=0 broken=0
 *       mul                                  pass=0 fail=1 error=0 broken=0
 *   ...
 *   Totals: pass=4 fail=1 error=1 broken=0 (6 cases, 0 build errors)
 *
 *   Failures:
 *     Calculator/math/mul
 *       2*2 == 5
 *       evaluated: 4 == 5
 * </pre>
 *
 * <p>Rows are in pre-order, indented two spaces per depth. Section rows follow
 * their case, marked {@code (section)}. Cases that did not execute normally carry
 * their status. The output is a pure function of the tree.</p>
 */
public final class SummaryReporter
{
    private static final int NAME_COLUMN = 48;
    private static final String NL = System.lineSeparator();

    public String render(TestTree tree)
    {
        Objects.requireNonNull(tree, "tree");
        ReportNodes.requireFinalized(tree);

        StringBuilder out = new StringBuilder();
        List<String> failures = new ArrayList<>();
        List<String> buildErrors = new ArrayList<>();
        row(out, tree.root(), 0, failures, buildErrors);

        out.append(String.format(Locale.ROOT, "Totals: %s (%d cases, %d build errors)",
                tree.root().counts(),
                ReportNodes.reportedCases(tree.root()),
                ReportNodes.buildErrors(tree.root()))).append(NL);

        if (!failures.isEmpty()) {
            out.append(NL).append("Failures:").append(NL);
            failures.forEach(out::append);
        }
        if (!buildErrors.isEmpty()) {
            out.append(NL).append("Build errors:").append(NL);
            buildErrors.forEach(out::append);
        }
        return out.toString();
    }

    private void row(StringBuilder out, TestNode node, int depth, List<String> failures, List<String> buildErrors)
    {
        if (depth > 0 && !ReportNodes.isReported(node)) {
            return;
        }
        String indent = "  ".repeat(depth);

        if (node instanceof SuiteNode) {
            SuiteNode suite = (SuiteNode) node;
            String label = suite.buildError().isPresent() ? suite.name() + " [BUILD ERROR]" : suite.name();
            line(out, indent + label, suite.counts().toString());
            suite.buildError().ifPresent(e -> buildErrors.add(describe(suite.id(), e)));
            for (TestNode child : suite.children()) {
                row(out, child, depth + 1, failures, buildErrors);
            }
            return;
        }

        CaseNode c = (CaseNode) node;
        CaseResult result = c.result().orElseThrow();
        String label = result.status() == CaseStatus.EXECUTED ? c.name() : c.name() + " [" + result.status() + "]";
        line(out, indent + label, result.counts().toString());
        for (SectionResult s : result.sections()) {
            line(out, indent + "  (section) " + s.name(), s.counts().toString());
        }
        ReportNodes.firstFailing(result).ifPresent(o -> failures.add(describe(c.id(), o)));
    }

    private static void line(StringBuilder out, String label, String counts)
    {
        out.append(String.format(Locale.ROOT, "%-" + NAME_COLUMN + "s %s", label, counts).stripTrailing()).append(NL);
    }

    private static String describe(TestPath id, AssertionOutcome outcome)
    {
        StringBuilder sb = new StringBuilder();
        sb.append("  ").append(id).append(NL);
        if (outcome instanceof AssertionOutcome.Failed) {
            AssertionOutcome.Failed f = (AssertionOutcome.Failed) outcome;
            sb.append("    ").append(f.expression()).append(NL);
            sb.append("    evaluated: ").append(f.evaluated()).append(NL);
        }
        else {
            AssertionOutcome.Errored e = (AssertionOutcome.Errored) outcome;
            sb.append("    ").append(e.description()).append(NL);
            e.originatingLocation().ifPresent(loc -> sb.append("    at ").append(loc).append(NL));
        }
        return sb.toString();
    }

    private static String describe(TestPath suite, BuildError error)
    {
        StringBuilder sb = new StringBuilder();
        sb.append("  ").append(suite).append(NL);
        sb.append("    ").append(error.description()).append(NL);
        error.originatingLocation().ifPresent(loc -> sb.append("    at ").append(loc).append(NL));
        return sb.toString();
    }
}
