package com.questrail.testtree.exec;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.CaseStatus;
import com.questrail.testtree.model.Counts;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.NullObservabilitySink;
import com.questrail.testtree.time.ManualMonotonicClock;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTest
{
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final Scheduler scheduler = new Scheduler(NullObservabilitySink.INSTANCE, clock);

    @Test
    void timeoutStopsDispatchButLetsRunningBodyFinish()
    {
        RunGuard guard = RunGuard.withTimeout(clock, Duration.ofMillis(100));
        AtomicInteger started = new AtomicInteger();
        TestPlan plan = tests -> {
            tests.test("slow", c -> {
                started.incrementAndGet();
                clock.advanceMillis(150);
                c.check("finished", true);
            });
            tests.test("next", c -> started.incrementAndGet());
            tests.test("last", c -> started.incrementAndGet());
        };

        TestTree tree = scheduler.run(scheduler.build(plan),
                new SequentialStrategy(new CaseRunner(NullObservabilitySink.INSTANCE, clock, guard)));

        assertEquals(1, started.get());
        CaseNode slow = (CaseNode) tree.find(TestPath.of("root", "slow")).orElseThrow();
        CaseNode next = (CaseNode) tree.find(TestPath.of("root", "next")).orElseThrow();
        assertEquals(new Counts(1, 0, 0, 0), slow.counts());
        assertEquals(CaseStatus.ABORTED, next.result().orElseThrow().status());
        assertEquals(new Counts(1, 0, 2, 0), tree.root().counts());
    }

    @Test
    void abortFromInsideARunStopsParallelWorkers()
    {
        RunGuard guard = RunGuard.unbounded(clock);
        TestPlan plan = tests -> {
            tests.test("trigger", c -> guard.abort("trigger pulled"));
            for (int i = 0; i < 5; i++) {
                tests.test("after-" + i, c -> c.check("ran", true));
            }
        };

        TestTree tree = scheduler.run(scheduler.build(plan),
                new ParallelStrategy(new CaseRunner(NullObservabilitySink.INSTANCE, clock, guard), 1));

        for (int i = 0; i < 5; i++) {
            CaseNode after = (CaseNode) tree.find(TestPath.of("root", "after-" + i)).orElseThrow();
            assertEquals(CaseStatus.ABORTED, after.result().orElseThrow().status());
        }
        assertEquals(new Counts(0, 0, 5, 0), tree.root().counts());
    }
}
