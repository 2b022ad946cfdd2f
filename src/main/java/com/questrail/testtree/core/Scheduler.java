package com.questrail.testtree.core;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.exec.ExecutionStrategy;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.RunErrorEvent;
import com.questrail.testtree.observability.RunFinishedEvent;
import com.questrail.testtree.observability.RunObservabilitySink;
import com.questrail.testtree.record.OutcomeRecorder;
import com.questrail.testtree.time.MonotonicClock;

import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scheduler
 * =============================================================================
 * Walks a test plan through its three phases.
 *
 * <pre>
 *   build(plan)            suites run inline, cases deferred into pending
 *     → select(filter)     pending pruned, shape kept for reporting
 *       → run(strategy)    strategy runs pending; one bottom-up aggregation
 * </pre>
 *
 * <h2>Build errors</h2>
 * <p>A suite whose discovery body throws keeps the children it declared before
 * the failure and carries a {@link com.questrail.testtree.model.BuildError}.
 * Discovery continues with its siblings.</p>
 *
 * <h2>Run</h2>
 * <p>The tree's nodes are written exactly once, so a built tree can be run only
 * once. If the strategy itself fails the failure is reported to the sink and the
 * run is still finalized: cases without a recorded result report as errors.</p>
 */
public final class Scheduler
{
    private final RunObservabilitySink sink;
    private final MonotonicClock clock;

    public Scheduler(RunObservabilitySink sink, MonotonicClock clock)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the plan's discovery callbacks and freezes the resulting tree.
     */
    public TestTree build(TestPlan plan)
    {
        Objects.requireNonNull(plan, "plan");
        SuiteNode root = new SuiteNode(plan.name(), TestPath.root());
        DiscoveringTreeBuilder builder = new DiscoveringTreeBuilder(sink);
        builder.discover(root, plan::declare);
        List<ScheduledCase> pending = builder.close();
        root.freeze();
        return new TestTree(root, pending, rebuildableClass(plan));
    }

    /**
     * Keeps only the pending cases matched by {@code filter}. The returned tree
     * shares its nodes with {@code tree}; pruned cases report as absent.
     */
    public TestTree select(TestTree tree, CaseFilter filter)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(filter, "filter");
        List<ScheduledCase> selected = new ArrayList<>();
        for (ScheduledCase sc : tree.pending()) {
            if (filter.matches(sc.id())) {
                selected.add(sc);
            }
        }
        return tree.withPending(selected);
    }

    /**
     * Hands the pending cases to {@code strategy}, waits for it, and finalizes
     * every aggregate.
     *
     * @throws IllegalStateException if the tree was already run
     */
    public TestTree run(TestTree tree, ExecutionStrategy strategy)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(strategy, "strategy");
        if (tree.isFinalized()) {
            throw new IllegalStateException("tree " + tree.root().id() + " has already been run");
        }

        OutcomeRecorder recorder = new OutcomeRecorder(tree);
        long start = clock.nowNanos();
        try {
            strategy.execute(tree.pending(), recorder);
        }
        catch (RuntimeException | Error e) {
            sink.onError(new RunErrorEvent(Instant.now(),
                    "strategy " + strategy.name() + " failed; unreported cases will be marked as not run", e));
        }

        Counts totals = recorder.finalizeAggregates();
        Duration elapsed = Duration.ofNanos(Math.max(0, clock.nowNanos() - start));
        sink.onRunFinished(new RunFinishedEvent(Instant.now(), strategy.name(), totals, elapsed));
        return tree;
    }

    /**
     * The plan's class if a worker process could instantiate it by name:
     * a public, top-level or static nested class with a public no-arg constructor.
     */
    static Class<? extends TestPlan> rebuildableClass(TestPlan plan)
    {
        Class<? extends TestPlan> type = plan.getClass();
        if (type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic() || type.isHidden()) {
            return null;
        }
        if (!Modifier.isPublic(type.getModifiers())) {
            return null;
        }
        if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            return null;
        }
        try {
            return Modifier.isPublic(type.getConstructor().getModifiers()) ? type : null;
        }
        catch (NoSuchMethodException e) {
            return null;
        }
    }
}
