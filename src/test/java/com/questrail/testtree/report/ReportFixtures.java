package com.questrail.testtree.report;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.core.CaseFilter;
import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.exec.CaseRunner;
import com.questrail.testtree.exec.RunGuard;
import com.questrail.testtree.exec.SequentialStrategy;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.NullObservabilitySink;
import com.questrail.testtree.time.ManualMonotonicClock;

/**
 * Runs plans sequentially against a clock that never moves, so every reported
 * duration is zero.
 */
final class ReportFixtures
{
    private ReportFixtures() {}

    static TestTree run(TestPlan plan)
    {
        return run(plan, CaseFilter.all());
    }

    static TestTree run(TestPlan plan, CaseFilter filter)
    {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        Scheduler scheduler = new Scheduler(NullObservabilitySink.INSTANCE, clock);
        CaseRunner runner = new CaseRunner(NullObservabilitySink.INSTANCE, clock, RunGuard.unbounded(clock));
        return scheduler.run(scheduler.select(scheduler.build(plan), filter), new SequentialStrategy(runner));
    }
}
