package com.questrail.testtree.exec;

import com.questrail.testtree.api.CaseContext;
import com.questrail.testtree.api.SectionBody;
import com.questrail.testtree.core.Throwables;
import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.SectionResult;
import com.questrail.testtree.model.TestPath;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Case-local outcome buffer.
 *
 * <p>Collects outcomes in evaluation order and tallies them per innermost
 * section. Once {@link #close} has produced the case result, further outcomes
 * are rejected.</p>
 */
final class BufferedCaseContext implements CaseContext
{
    private final List<AssertionOutcome> outcomes = new ArrayList<>();
    private final Deque<String> sections = new ArrayDeque<>();
    private final Map<String, Counts> sectionCounts = new LinkedHashMap<>();
    private boolean closed;

    @Override
    public synchronized void record(AssertionOutcome outcome)
    {
        Objects.requireNonNull(outcome, "outcome");
        if (closed) {
            throw new IllegalStateException("case body has already returned; outcome " + outcome + " is discarded");
        }
        outcomes.add(outcome);
        if (!sections.isEmpty()) {
            sectionCounts.merge(currentSection(), Counts.ZERO.plus(outcome), Counts::plus);
        }
    }

    @Override
    public boolean check(String expression, BooleanSupplier condition)
    {
        Objects.requireNonNull(condition, "condition");
        boolean value;
        try {
            value = condition.getAsBoolean();
        }
        catch (Throwable t) {
            Throwables.rethrowIfUnrecoverable(t);
            AssertionOutcome.Errored e = AssertionOutcome.Errored.of(t);
            record(new AssertionOutcome.Errored("exception evaluating " + expression + ": " + e.description(), e.location()));
            return false;
        }
        return check(expression, value);
    }

    @Override
    public void section(String name, SectionBody body) throws Exception
    {
        Objects.requireNonNull(body, "body");
        synchronized (this) {
            sections.push(TestPath.of(name).lastSegment());
            sectionCounts.putIfAbsent(currentSection(), Counts.ZERO);
        }
        try {
            body.run(this);
        }
        finally {
            synchronized (this) {
                sections.pop();
            }
        }
    }

    synchronized CaseResult close(Duration duration)
    {
        closed = true;
        List<SectionResult> sectionResults = new ArrayList<>(sectionCounts.size());
        for (Map.Entry<String, Counts> e : sectionCounts.entrySet()) {
            sectionResults.add(new SectionResult(e.getKey(), e.getValue()));
        }
        return new CaseResult(CaseStatus.EXECUTED, outcomes, sectionResults, duration);
    }

    private String currentSection()
    {
        List<String> names = new ArrayList<>(sections);
        StringBuilder sb = new StringBuilder();
        for (int i = names.size() - 1; i >= 0; i--) {
            if (sb.length() > 0) {
                sb.append(TestPath.SEPARATOR);
            }
            sb.append(names.get(i));
        }
        return sb.toString();
    }
}
