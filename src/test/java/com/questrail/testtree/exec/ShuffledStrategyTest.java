package com.questrail.testtree.exec;

import com.questrail.testtree.core.Scheduler;
import com.questrail.testtree.fixtures.PassingPlan;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.TestPath;
import com.questrail.testtree.model.TestTree;
import com.questrail.testtree.observability.NullObservabilitySink;
import com.questrail.testtree.observability.RecordingObservabilitySink;
import com.questrail.testtree.observability.CaseStartedEvent;
import com.questrail.testtree.time.ManualMonotonicClock;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class ShuffledStrategyTest
{
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final Scheduler scheduler = new Scheduler(NullObservabilitySink.INSTANCE, clock);

    @Test
    void permutationIsReproducibleFromSeed()
    {
        List<ScheduledCase> pending = scheduler.build(new PassingPlan()).pending();

        assertEquals(ShuffledStrategy.permute(pending, 7L), ShuffledStrategy.permute(pending, 7L));
        assertNotEquals(pending, ShuffledStrategy.permute(pending, 7L));
    }

    @Test
    void permutationKeepsEveryCaseOnce()
    {
        List<ScheduledCase> pending = scheduler.build(new PassingPlan()).pending();
        List<ScheduledCase> shuffled = ShuffledStrategy.permute(pending, 123L);

        assertEquals(pending.size(), shuffled.size());
        assertEquals(new HashSet<>(pending), new HashSet<>(shuffled));
    }

    @Test
    void casesRunInPermutedOrder()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        TestTree tree = scheduler.build(new PassingPlan());
        ShuffledStrategy strategy = new ShuffledStrategy(new CaseRunner(sink, clock, RunGuard.unbounded(clock)), 99L);

        scheduler.run(tree, strategy);

        List<TestPath> started = sink.eventsOfType(CaseStartedEvent.class).stream()
                .map(CaseStartedEvent::caseId)
                .collect(Collectors.toList());
        List<TestPath> expected = ShuffledStrategy.permute(tree.pending(), 99L).stream()
                .map(ScheduledCase::id)
                .collect(Collectors.toList());
        assertEquals(expected, started);
        assertEquals("shuffled(seed=99)", strategy.name());
    }
}
