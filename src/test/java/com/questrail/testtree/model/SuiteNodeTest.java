package com.questrail.testtree.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SuiteNodeTest
{
    @Test
    void rejectsDuplicateSiblingNames()
    {
        SuiteNode root = new SuiteNode("root", TestPath.root());
        root.attach(new CaseNode("a", root.id(), c -> {}));

        DuplicateNodeException e = assertThrows(DuplicateNodeException.class,
                () -> root.attach(new SuiteNode("a", root.id())));
        assertTrue(e.getMessage().contains("root/a"));
    }

    @Test
    void rejectsChildWithForeignPath()
    {
        SuiteNode root = new SuiteNode("root", TestPath.root());
        assertThrows(IllegalArgumentException.class,
                () -> root.attach(new CaseNode("a", TestPath.of("elsewhere"), c -> {})));
    }

    @Test
    void frozenSuiteRejectsAttach()
    {
        SuiteNode root = new SuiteNode("root", TestPath.root());
        SuiteNode child = new SuiteNode("child", root.id());
        root.attach(child);
        root.freeze();

        assertTrue(child.isFrozen());
        assertThrows(IllegalStateException.class, () -> child.attach(new CaseNode("late", child.id(), c -> {})));
    }

    @Test
    void aggregateIsReadableOnlyOncePublished()
    {
        SuiteNode root = new SuiteNode("root", TestPath.root());
        assertThrows(IllegalStateException.class, root::counts);

        root.publishAggregate(new Counts(1, 0, 0, 0));
        assertEquals(new Counts(1, 0, 0, 0), root.counts());
        assertThrows(IllegalStateException.class, () -> root.publishAggregate(Counts.ZERO));
    }

    @Test
    void caseResultIsWrittenOnce()
    {
        CaseNode c = new CaseNode("a", TestPath.of("root"), ctx -> {});
        assertEquals(Counts.ZERO, c.counts());
        assertTrue(c.result().isEmpty());

        c.complete(CaseResult.executed(List.of(AssertionOutcome.pass())));
        assertEquals(new Counts(1, 0, 0, 0), c.counts());
        assertThrows(IllegalStateException.class,
                () -> c.complete(CaseResult.executed(List.of())));
    }
}
