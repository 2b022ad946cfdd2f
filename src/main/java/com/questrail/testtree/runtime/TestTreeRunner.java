package com.questrail.testtree.runtime;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.config.RunOptions;
import com.questrail.testtree.config.StrategyName;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.exec.CaseRunner;
import com.questrail.testtree.exec.ExecutionStrategy;
import com.questrail.testtree.exec.ParallelStrategy;
import com.questrail.testtree.exec.RunGuard;
import com.questrail.testtree.exec.SequentialStrategy;
import com.questrail.testtree.exec.ShuffledStrategy;
import com.questrail.testtree.exec.distributed.DistributedStrategy;
import com.questrail.testtree.exec.distributed.ProcessWorkerLauncher;
import com.questrail.testtree.exec.distributed.WorkerLauncher;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.model.TestNode;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.RunErrorEvent;
import com.questrail.testtree.observability.RunObservabilitySink;
import com.questrail.testtree.observability.Slf4jRunObservabilitySink;
import com.questrail.testtree.report.JUnitXmlReporter;
import com.questrail.testtree.report.ReportException;
import com.questrail.testtree.report.SummaryReporter;
import com.questrail.testtree.time.MonotonicClock;
import com.questrail.testtree.time.SystemMonotonicClock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * TestTreeRunner
 * =============================================================================
 * Composition root: builds, selects, runs and reports in one call.
 *
 * <pre>
 *   TestPlan ─build─▶ TestTree ─select(filter)─▶ run(strategy) ─▶ summary (+ XML)
 * </pre>
 *
 * <h2>Wiring responsibilities</h2>
 * <ul>
 *   <li>Creates the {@link RunGuard} from {@link RunOptions#timeout()}</li>
 *   <li>Instantiates the strategy named by {@link StrategyName}</li>
 *   <li>Renders the summary and, if configured, writes the JUnit XML file</li>
 * </ul>
 *
 * <p>Once the strategy has started, nothing escapes this class: body failures
 * are outcomes, strategy defects and report I/O failures go to the
 * observability sink. Misuse (an already-run tree, a distributed run of a plan
 * that cannot be rebuilt by name) is rejected before anything runs.</p>
 */
public final class TestTreeRunner
{
    private final RunObservabilitySink sink;
    private final MonotonicClock clock;
    private final WorkerLauncher launcher;
    private final Scheduler scheduler;
    private final SummaryReporter summaryReporter = new SummaryReporter();
    private final JUnitXmlReporter xmlReporter = new JUnitXmlReporter();

    /** Production wiring: SLF4J sink, system clock, forked worker JVMs. */
    public TestTreeRunner()
    {
        this(new Slf4jRunObservabilitySink(), SystemMonotonicClock.INSTANCE, new ProcessWorkerLauncher());
    }

    public TestTreeRunner(RunObservabilitySink sink, MonotonicClock clock, WorkerLauncher launcher)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.scheduler = new Scheduler(sink, clock);
    }

    public TestTree build(TestPlan plan)
    {
        return scheduler.build(plan);
    }

    public RunResult run(TestPlan plan, StrategyName strategy, RunOptions options)
    {
        return run(build(plan), strategy, options);
    }

    public RunResult run(TestTree tree, StrategyName strategy, RunOptions options)
    {
        Objects.requireNonNull(options, "options");
        RunGuard guard = options.timeoutIfSet()
                .map(t -> RunGuard.withTimeout(clock, t))
                .orElseGet(() -> RunGuard.unbounded(clock));
        return run(tree, strategy, options, guard);
    }

    /**
     * Runs with a caller-owned guard, which can abort the run from another
     * thread. {@link RunOptions#timeout()} is ignored in favor of the guard's.
     */
    public RunResult run(TestTree tree, StrategyName strategy, RunOptions options, RunGuard guard)
    {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(guard, "guard");
        if (tree.isFinalized()) {
            throw new IllegalStateException("tree " + tree.root().id() + " has already been run");
        }

        ExecutionStrategy executor = strategy(strategy, options, guard, tree);
        TestTree selected = scheduler.select(tree, options.filter());
        scheduler.run(selected, executor);

        String summary = summaryReporter.render(selected);
        Path xml = options.xmlOutput().flatMap(path -> writeXml(selected, path)).orElse(null);
        return new RunResult(selected, isSuccess(selected), summary, xml);
    }

    ExecutionStrategy strategy(StrategyName name, RunOptions options, RunGuard guard, TestTree tree)
    {
        CaseRunner runner = new CaseRunner(sink, clock, guard);
        switch (name) {
            case SEQUENTIAL:
                return new SequentialStrategy(runner);
            case SHUFFLED:
                return new ShuffledStrategy(runner, options.seed());
            case PARALLEL:
                return new ParallelStrategy(runner, options.workerCount());
            case DISTRIBUTED:
                return new DistributedStrategy(
                        tree.planClass().orElseThrow(() -> new IllegalArgumentException(
                                "the distributed strategy rebuilds the plan in each worker; plan "
                                        + tree.root().name() + " must be a public class with a public no-arg constructor")),
                        options.workerCount(), launcher, guard, sink, clock);
            default:
                throw new IllegalArgumentException("unsupported strategy " + name);
        }
    }

    private Optional<Path> writeXml(TestTree tree, Path path)
    {
        try {
            xmlReporter.write(tree, path);
            return Optional.of(path);
        }
        catch (ReportException e) {
            sink.onError(new RunErrorEvent(Instant.now(), e.getMessage(), e));
            return Optional.empty();
        }
    }

    /** Failure if any assertion failed or errored, or any suite has a build error. */
    static boolean isSuccess(TestTree tree)
    {
        return !tree.root().counts().isFailing() && !hasBuildError(tree.root());
    }

    private static boolean hasBuildError(SuiteNode suite)
    {
        if (suite.buildError().isPresent()) {
            return true;
        }
        for (TestNode child : suite.children()) {
            if (child instanceof SuiteNode && hasBuildError((SuiteNode) child)) {
                return true;
            }
        }
        return false;
    }
}
