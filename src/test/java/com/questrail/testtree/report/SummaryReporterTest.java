package com.questrail.testtree.report;

import com.questrail.testtree.core.CaseFilter;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.fixtures.CalculatorPlan;
import com.questrail.testtree.fixtures.ScenarioPlan;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.NullObservabilitySink;
import com.questrail.testtree.time.SystemMonotonicClock;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

final class SummaryReporterTest
{
    private final SummaryReporter reporter = new SummaryReporter();

    private static String row(String label, String counts)
    {
        return String.format(Locale.ROOT, "%-48s %s", label, counts);
    }

    private static List<String> lines(String text)
    {
        return List.of(text.split(System.lineSeparator(), -1));
    }

    @Test
    void scenarioSummary()
    {
        String summary = reporter.render(ReportFixtures.run(new ScenarioPlan()));

        assertEquals(List.of(
                row("Scenario", "pass=4 fail=1 error=1 broken=0"),
                row("  arithmetic", "pass=3 fail=0 error=0 broken=0"),
                row("  mixed", "pass=1 fail=1 error=1 broken=0"),
                "Totals: pass=4 fail=1 error=1 broken=0 (2 cases, 0 build errors)",
                "",
                "Failures:",
                "  Scenario/mixed",
                "    2*2 == 5",
                "    evaluated: expected <5> but was <4>",
                ""), lines(summary));
    }

    @Test
    void sectionsStatusesAndBuildErrorsAreShown()
    {
        List<String> lines = lines(reporter.render(ReportFixtures.run(new CalculatorPlan())));

        assertTrue(lines.contains(row("      (section) positive", "pass=1 fail=0 error=0 broken=0")));
        assertTrue(lines.contains(row("      (section) zero", "pass=0 fail=0 error=0 broken=1")));
        assertTrue(lines.contains(row("  flaky [BUILD ERROR]", "pass=1 fail=0 error=0 broken=0")));
        assertTrue(lines.contains("Totals: pass=8 fail=1 error=0 broken=1 (7 cases, 1 build errors)"));

        int buildErrors = lines.indexOf("Build errors:");
        assertTrue(buildErrors > 0);
        assertEquals("  Calculator/flaky", lines.get(buildErrors + 1));
        assertEquals("    java.lang.IllegalStateException: fixture unavailable", lines.get(buildErrors + 2));
        assertTrue(lines.get(buildErrors + 3).startsWith("    at "));
    }

    @Test
    void rowsFollowPreOrder()
    {
        List<String> labels = lines(reporter.render(ReportFixtures.run(new CalculatorPlan()))).stream()
                .takeWhile(l -> !l.startsWith("Totals:"))
                .map(l -> l.substring(0, Math.min(48, l.length())).stripTrailing())
                .filter(l -> !l.contains("(section)"))
                .collect(java.util.stream.Collectors.toList());

        assertEquals(List.of(
                "Calculator",
                "  math", "    add", "    mul", "    div",
                "  text", "    concat", "    nested", "      upper",
                "  flaky [BUILD ERROR]", "    first",
                "  last"), labels);
    }

    @Test
    void filteredOutCasesAndEmptySuitesAreOmitted()
    {
        TestTree tree = ReportFixtures.run(new CalculatorPlan(), CaseFilter.parse("math/add"));

        String summary = reporter.render(tree);

        assertTrue(summary.contains("    add"));
        assertFalse(summary.contains("mul"));
        assertFalse(summary.contains("text"));
        assertFalse(summary.contains("last"));
        assertTrue(summary.contains("flaky [BUILD ERROR]"), "build errors are always reported");
        assertFalse(summary.contains("first"));
        assertTrue(summary.contains("(1 cases, 1 build errors)"));
    }

    @Test
    void unrunTreeIsRejected()
    {
        TestTree built = new Scheduler(NullObservabilitySink.INSTANCE, SystemMonotonicClock.INSTANCE)
                .build(new ScenarioPlan());

        assertThrows(IllegalStateException.class, () -> reporter.render(built));
    }
}
