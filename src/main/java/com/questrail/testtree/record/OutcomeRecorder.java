package com.questrail.testtree.record;

import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestNode;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OutcomeRecorder
 * =============================================================================
 * The only shared mutation point of a run.
 *
 * <h2>Per-case ownership</h2>
 * <p>One slot is allocated per selected case when the recorder is created. The
 * slot map itself is never modified afterwards, so lookups need no locking;
 * each slot is written with a single compare-and-set. Concurrent writers for
 * distinct cases never contend, and a second write for the same case is
 * rejected with {@link DuplicateRecordException}.</p>
 *
 * <h2>Finalize</h2>
 * <p>{@link #finalizeAggregates()} writes every recorded result into its
 * {@link CaseNode} and computes each suite's aggregate bottom-up. It is the
 * single point after which aggregates may be read. Selected cases that were
 * never recorded are finalized as {@link CaseStatus#NOT_RUN} errors, so the
 * report stays complete.</p>
 *
 * <p>Finalizing seals each empty slot with that {@code NOT_RUN} result by the
 * same compare-and-set a write uses. A write racing with finalization either
 * lands first and is reported, or fails with {@link IllegalStateException};
 * it is never dropped.</p>
 */
public final class OutcomeRecorder
{
    private final TestTree tree;
    private final Map<TestPath, AtomicReference<CaseResult>> slots;
    private final AtomicBoolean finalized = new AtomicBoolean();

    public OutcomeRecorder(TestTree tree)
    {
        this.tree = Objects.requireNonNull(tree, "tree");
        Map<TestPath, AtomicReference<CaseResult>> m = new HashMap<>();
        for (ScheduledCase sc : tree.pending()) {
            m.put(sc.id(), new AtomicReference<>());
        }
        this.slots = Collections.unmodifiableMap(m);
    }

    /**
     * Records the outcomes of one case body, in evaluation order.
     */
    public void record(TestPath caseId, List<AssertionOutcome> outcomes)
    {
        record(caseId, CaseResult.executed(outcomes));
    }

    /**
     * Records the full result of one case.
     *
     * @throws IllegalArgumentException if the case was not selected for this run
     * @throws DuplicateRecordException if the case was already recorded
     * @throws IllegalStateException    if aggregates were already finalized
     */
    public void record(TestPath caseId, CaseResult result)
    {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(result, "result");
        if (finalized.get()) {
            throw new IllegalStateException("recorder already finalized; cannot record " + caseId);
        }
        AtomicReference<CaseResult> slot = slots.get(caseId);
        if (slot == null) {
            throw new IllegalArgumentException("case " + caseId + " is not selected in this run");
        }
        if (!slot.compareAndSet(null, result)) {
            if (finalized.get()) {
                // Lost the slot to finalizeAggregates sealing it.
                throw new IllegalStateException("recorder already finalized; cannot record " + caseId);
            }
            throw new DuplicateRecordException(caseId);
        }
    }

    public boolean isRecorded(TestPath caseId)
    {
        AtomicReference<CaseResult> slot = slots.get(caseId);
        return slot != null && slot.get() != null;
    }

    /** Selected cases that have not been recorded yet, in discovery order. */
    public List<ScheduledCase> unrecorded()
    {
        List<ScheduledCase> out = new ArrayList<>();
        for (ScheduledCase sc : tree.pending()) {
            if (slots.get(sc.id()).get() == null) {
                out.add(sc);
            }
        }
        return out;
    }

    /**
     * Writes results into the tree and computes every suite aggregate.
     * Must be called once, after the strategy has returned.
     *
     * @return the root aggregate
     */
    public Counts finalizeAggregates()
    {
        if (!finalized.compareAndSet(false, true)) {
            throw new IllegalStateException("aggregates already finalized");
        }
        for (ScheduledCase sc : tree.pending()) {
            AtomicReference<CaseResult> slot = slots.get(sc.id());
            slot.compareAndSet(null,
                    CaseResult.unexecuted(CaseStatus.NOT_RUN, "not run: no outcome was recorded for this case"));
            sc.node().complete(slot.get());
        }
        return aggregate(tree.root());
    }

    public boolean isFinalized()
    {
        return finalized.get();
    }

    private static Counts aggregate(SuiteNode suite)
    {
        Counts sum = Counts.ZERO;
        for (TestNode child : suite.children()) {
            if (child instanceof SuiteNode) {
                sum = sum.plus(aggregate((SuiteNode) child));
            } else {
                sum = sum.plus(child.counts());
            }
        }
        suite.publishAggregate(sum);
        return sum;
    }
}
