package com.questrail.testtree.exec.distributed;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.core.CaseFilter;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.exec.CaseRunner;
import com.questrail.testtree.exec.ExecutionStrategy;
import com.questrail.testtree.exec.RunGuard;
import com.questrail.testtree.exec.SequentialStrategy;
import com.questrail.testtree.exec.distributed.codec.BatchFrame;
import com.questrail.testtree.exec.distributed.codec.BatchFrameEncoder;
import com.questrail.testtree.exec.distributed.transport.netty.NettyBatchClient;
import com.questrail.testtree.exec.distributed.transport.netty.NettyBatchServer;
import com.questrail.testtree.fixtures.CalculatorPlan;
import com.questrail.testtree.fixtures.HaltingPlan;
import com.questrail.testtree.fixtures.ManyCasesPlan;
import com.questrail.testtree.fixtures.PassingPlan;
import com.questrail.testtree.fixtures.RecursingPlan;
import com.questrail.testtree.fixtures.ScenarioPlan;
import com.questrail.testtree.fixtures.SlowPlan;
import com.questrail.testtree.model.AssertionOutcome;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseResult;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.NullObservabilitySink;
import com.questrail.testtree.time.SystemMonotonicClock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
final class DistributedStrategyTest
{
    private final Scheduler scheduler = new Scheduler(NullObservabilitySink.INSTANCE, SystemMonotonicClock.INSTANCE);

    private static DistributedStrategy distributed(Class<? extends TestPlan> plan,
                                                   int workers,
                                                   WorkerLauncher launcher,
                                                   RunGuard guard)
    {
        return new DistributedStrategy(plan, workers, launcher, guard,
                NullObservabilitySink.INSTANCE, SystemMonotonicClock.INSTANCE);
    }

    private static RunGuard unbounded()
    {
        return RunGuard.unbounded(SystemMonotonicClock.INSTANCE);
    }

    private static Map<TestPath, Counts> countsByNode(TestTree tree)
    {
        Map<TestPath, Counts> out = new HashMap<>();
        tree.traverse((id, node) -> out.put(id, node.counts()));
        return out;
    }

    private static CaseResult resultOf(TestTree tree, String path)
    {
        CaseNode node = (CaseNode) tree.find(TestPath.parse(path)).orElseThrow();
        return node.result().orElseThrow();
    }

    private static String description(CaseResult result)
    {
        return ((AssertionOutcome.Errored) result.outcomes().get(0)).description();
    }

    // -------------------------------------------------------------------------
    // Equivalence with in-process execution
    // -------------------------------------------------------------------------

    @Test
    void calculatorAggregatesMatchSequentialRun()
    {
        ExecutionStrategy sequential = new SequentialStrategy(new CaseRunner(
                NullObservabilitySink.INSTANCE, SystemMonotonicClock.INSTANCE, unbounded()));
        Map<TestPath, Counts> reference = countsByNode(
                scheduler.run(scheduler.build(new CalculatorPlan()), sequential));

        for (int workers : new int[] { 1, 3 }) {
            TestTree tree = scheduler.run(scheduler.build(new CalculatorPlan()),
                    distributed(CalculatorPlan.class, workers, new InProcessWorkerLauncher(), unbounded()));

            assertEquals(reference, countsByNode(tree), "workers=" + workers);
            assertEquals(new Counts(8, 1, 0, 1), tree.root().counts());
        }
    }

    @Test
    void scenarioOutcomesSurviveTheProcessBoundary()
    {
        TestTree tree = scheduler.run(scheduler.build(new ScenarioPlan()),
                distributed(ScenarioPlan.class, 2, new InProcessWorkerLauncher(), unbounded()));

        assertEquals(new Counts(4, 1, 1, 0), tree.root().counts());

        CaseResult mixed = resultOf(tree, "Scenario/mixed");
        assertEquals(CaseStatus.EXECUTED, mixed.status());
        AssertionOutcome.Failed failed = mixed.firstFailure().orElseThrow();
        assertEquals("2*2 == 5", failed.expression());
        AssertionOutcome.Errored errored = (AssertionOutcome.Errored) mixed.outcomes().get(2);
        assertEquals("java.lang.IllegalStateException: boom", errored.description());
        assertTrue(errored.originatingLocation().isPresent());
    }

    @Test
    void stackOverflowInWorkerIsRecordedAsErrorNotCrash()
    {
        TestTree tree = scheduler.run(scheduler.build(new RecursingPlan()),
                distributed(RecursingPlan.class, 2, new InProcessWorkerLauncher(), unbounded()));

        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "RecursingPlan/recurses").status());
        assertEquals(new Counts(2, 0, 2, 0), tree.root().counts());
    }

    @Test
    void moreWorkersThanCasesLaunchesOnlyAsManyAsNeeded()
    {
        InProcessWorkerLauncher launcher = new InProcessWorkerLauncher();

        TestTree tree = scheduler.run(scheduler.build(new ScenarioPlan()),
                distributed(ScenarioPlan.class, 8, launcher, unbounded()));

        assertEquals(2, launcher.launched.size());
        assertEquals(new Counts(4, 1, 1, 0), tree.root().counts());
    }

    @Test
    void filteredRunSendsOnlySelectedIndices()
    {
        InProcessWorkerLauncher launcher = new InProcessWorkerLauncher();
        TestTree selected = scheduler.select(scheduler.build(new PassingPlan()),
                CaseFilter.parse("PassingPlan/group-1"));

        TestTree tree = scheduler.run(selected, distributed(PassingPlan.class, 2, launcher, unbounded()));

        assertEquals(List.of(4, 6), launcher.launched.get(0).caseIndices());
        assertEquals(List.of(5, 7), launcher.launched.get(1).caseIndices());
        assertEquals(new Counts(2 + 3 + 1 + 2, 0, 0, 0), tree.root().counts());
        assertTrue(((CaseNode) tree.find(TestPath.parse("PassingPlan/group-0/case-0")).orElseThrow()).result().isEmpty());
    }

    @Test
    void assignmentIsRoundRobinByPosition()
    {
        TestTree tree = scheduler.build(new PassingPlan());

        List<DistributedStrategy.WorkerSlot> slots = DistributedStrategy.assign(tree.pending(), 5);

        assertEquals(5, slots.size());
        assertEquals(List.of(0, 5, 10), slots.get(0).indices());
        assertEquals(List.of(1, 6, 11), slots.get(1).indices());
        assertEquals(List.of(4, 9), slots.get(4).indices());
    }

    // -------------------------------------------------------------------------
    // Lost workers
    // -------------------------------------------------------------------------

    /**
     * A launcher whose workers speak the protocol by hand: Hello, then whatever
     * {@code reports} returns for the assigned cases, then exit with {@code exitCode}.
     */
    private static WorkerLauncher scripted(TestTree tree,
                                           BiFunction<WorkerAssignment, List<ScheduledCase>, List<BatchFrame>> reports,
                                           int exitCode)
    {
        BatchFrameEncoder encoder = new BatchFrameEncoder();
        return assignment -> ThreadWorkerProcess.start(assignment.workerId(), () -> {
            List<ScheduledCase> assigned = assignment.caseIndices().stream()
                    .map(i -> tree.discovered().get(i))
                    .collect(Collectors.toList());
            try (NettyBatchClient client = new NettyBatchClient()) {
                client.connect(new InetSocketAddress(assignment.coordinatorHost(), assignment.coordinatorPort()),
                        frame -> {});
                client.send(encoder.encode(new BatchFrame.Hello(assignment.workerId())));
                for (BatchFrame frame : reports.apply(assignment, assigned)) {
                    client.send(encoder.encode(frame));
                }
            }
            return exitCode;
        });
    }

    @Test
    void workerExitingEarlyCrashesOnlyItsUnreportedCases()
    {
        TestTree built = scheduler.build(new PassingPlan());
        WorkerLauncher launcher = scripted(built, (a, cases) -> List.of(new BatchFrame.CaseReport(
                a.workerId(), cases.get(0).index(), cases.get(0).id(),
                CaseResult.executed(List.of(AssertionOutcome.pass())))), 9);

        TestTree tree = scheduler.run(built, distributed(PassingPlan.class, 2, launcher, unbounded()));

        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "PassingPlan/group-0/case-0").status());
        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "PassingPlan/group-0/case-1").status());
        CaseResult lost = resultOf(tree, "PassingPlan/group-0/case-2");
        assertEquals(CaseStatus.CRASHED, lost.status());
        assertEquals("worker process 0 exited with code 9 before reporting this case", description(lost));
        assertEquals(new Counts(2, 0, 10, 0), tree.root().counts());
    }

    @Test
    void reportForADifferentCaseIsRecordedAsCrash()
    {
        TestTree built = scheduler.build(new PassingPlan());
        WorkerLauncher launcher = scripted(built, (a, cases) -> {
            List<BatchFrame> frames = new ArrayList<>();
            for (ScheduledCase sc : cases) {
                frames.add(new BatchFrame.CaseReport(a.workerId(), sc.index(), TestPath.of("root", "elsewhere"),
                        CaseResult.executed(List.of(AssertionOutcome.pass()))));
            }
            frames.add(new BatchFrame.Done(a.workerId()));
            return frames;
        }, 0);

        TestTree tree = scheduler.run(built, distributed(PassingPlan.class, 1, launcher, unbounded()));

        CaseResult result = resultOf(tree, "PassingPlan/group-2/case-11");
        assertEquals(CaseStatus.CRASHED, result.status());
        assertTrue(description(result).contains("rebuilt a different plan"));
        assertEquals(new Counts(0, 0, PassingPlan.CASES, 0), tree.root().counts());
    }

    @Test
    void duplicateReportKeepsTheFirst()
    {
        TestTree built = scheduler.build(new PassingPlan());
        WorkerLauncher launcher = scripted(built, (a, cases) -> {
            List<BatchFrame> frames = new ArrayList<>();
            for (ScheduledCase sc : cases) {
                frames.add(new BatchFrame.CaseReport(a.workerId(), sc.index(), sc.id(),
                        CaseResult.executed(List.of(AssertionOutcome.pass()))));
            }
            ScheduledCase first = cases.get(0);
            frames.add(new BatchFrame.CaseReport(a.workerId(), first.index(), first.id(),
                    CaseResult.executed(List.of(AssertionOutcome.fail("again", "again")))));
            frames.add(new BatchFrame.Done(a.workerId()));
            return frames;
        }, 0);

        TestTree tree = scheduler.run(built, distributed(PassingPlan.class, 3, launcher, unbounded()));

        assertEquals(new Counts(PassingPlan.CASES, 0, 0, 0), tree.root().counts());
    }

    @Test
    void workerThatCannotStartCrashesItsCases()
    {
        InProcessWorkerLauncher inProcess = new InProcessWorkerLauncher();
        WorkerLauncher launcher = assignment -> {
            if (assignment.workerId() == 1) {
                throw new IOException("no java executable");
            }
            return inProcess.launch(assignment);
        };

        TestTree tree = scheduler.run(scheduler.build(new PassingPlan()),
                distributed(PassingPlan.class, 2, launcher, unbounded()));

        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "PassingPlan/group-0/case-0").status());
        CaseResult lost = resultOf(tree, "PassingPlan/group-0/case-1");
        assertEquals(CaseStatus.CRASHED, lost.status());
        assertTrue(description(lost).startsWith("worker process 1 could not be started"));
    }

    @Test
    @Timeout(120)
    void haltedWorkerProcessIsReportedAsCrash()
    {
        TestTree tree = scheduler.run(scheduler.build(new HaltingPlan()),
                distributed(HaltingPlan.class, 2, new ProcessWorkerLauncher(), unbounded()));

        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "HaltingPlan/a").status());
        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "HaltingPlan/b").status());
        for (String lost : List.of("HaltingPlan/halt", "HaltingPlan/c")) {
            CaseResult result = resultOf(tree, lost);
            assertEquals(CaseStatus.CRASHED, result.status(), lost);
            assertEquals("worker process 1 exited with code " + HaltingPlan.HALT_CODE
                    + " before reporting this case", description(result));
        }
        assertEquals(new Counts(2, 0, 2, 0), tree.root().counts());
    }

    @Test
    @Timeout(180)
    void forkedWorkerReceivesALargeAssignmentOverTheLink()
    {
        TestTree tree = scheduler.run(scheduler.build(new ManyCasesPlan()),
                distributed(ManyCasesPlan.class, 1, new ProcessWorkerLauncher(), unbounded()));

        assertEquals(CaseStatus.EXECUTED, resultOf(tree, "ManyCasesPlan/case-29999").status());
        assertEquals(new Counts(ManyCasesPlan.CASES, 0, 0, 0), tree.root().counts());
    }

    // -------------------------------------------------------------------------
    // Abort
    // -------------------------------------------------------------------------

    @Test
    void stoppedGuardLaunchesNothing()
    {
        RunGuard guard = unbounded();
        guard.abort("user request");
        InProcessWorkerLauncher launcher = new InProcessWorkerLauncher();

        TestTree tree = scheduler.run(scheduler.build(new PassingPlan()),
                distributed(PassingPlan.class, 3, launcher, guard));

        assertTrue(launcher.launched.isEmpty());
        CaseResult result = resultOf(tree, "PassingPlan/group-1/case-5");
        assertEquals(CaseStatus.ABORTED, result.status());
        assertEquals("aborted: user request", description(result));
    }

    @Test
    void abortReachesRunningWorkers() throws Exception
    {
        RunGuard guard = unbounded();
        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(SlowPlan.CASE_MILLIS * 3);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            guard.abort("stop requested");
        });
        stopper.start();

        TestTree tree = scheduler.run(scheduler.build(new SlowPlan()),
                distributed(SlowPlan.class, 1, new InProcessWorkerLauncher(), guard));
        stopper.join();

        int executed = 0;
        int aborted = 0;
        for (ScheduledCase sc : tree.discovered()) {
            CaseResult result = sc.node().result().orElseThrow();
            if (result.status() == CaseStatus.EXECUTED) {
                executed++;
            }
            else {
                assertEquals(CaseStatus.ABORTED, result.status(), sc.id().toString());
                assertEquals("aborted: stop requested", description(result));
                aborted++;
            }
        }
        assertTrue(executed >= 1, "first case starts before the abort");
        assertTrue(aborted >= 1, "remaining cases are not started");
        assertEquals(SlowPlan.CASES, executed + aborted);
    }

    @Test
    void hungWorkerIsTerminatedAfterGrace()
    {
        RunGuard guard = unbounded();
        WorkerLauncher hanging = assignment -> {
            WorkerProcess p = ThreadWorkerProcess.start(assignment.workerId(), () -> {
                try {
                    Thread.sleep(60_000);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 0;
            });
            guard.abort("timeout of 1 ms exceeded");
            return p;
        };
        DistributedStrategy strategy = new DistributedStrategy(PassingPlan.class, 1, hanging, guard,
                NullObservabilitySink.INSTANCE, SystemMonotonicClock.INSTANCE,
                NettyBatchServer::loopback, Duration.ofMillis(200), Duration.ofMillis(100));

        TestTree tree = scheduler.run(scheduler.build(new PassingPlan()), strategy);

        CaseResult result = resultOf(tree, "PassingPlan/group-0/case-0");
        assertEquals(CaseStatus.ABORTED, result.status());
        assertEquals("aborted: timeout of 1 ms exceeded; worker process 0 was terminated", description(result));
    }
}
