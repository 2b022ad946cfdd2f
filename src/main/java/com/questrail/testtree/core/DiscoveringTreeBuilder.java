package com.questrail.testtree.core;

import com.questrail.testtree.api.CaseBody;
import com.questrail.testtree.api.SuiteBody;
import com.questrail.testtree.api.TreeBuilder;
import com.questrail.testtree.model.BuildError;
import com.questrail.testtree.model.CaseNode;
import com.questrail.testtree.model.ScheduledCase;
import com.questrail.testtree.model.SuiteNode;
import com.questrail.testtree.observability.BuildErrorEvent;
import com.questrail.testtree.observability.RunObservabilitySink;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * DiscoveringTreeBuilder
 * -----------------------------------------------------------------------------
 * {@link TreeBuilder} used during the build pass.
 *
 * <p>Suites are entered and their bodies run inline; the builder keeps a stack of
 * open suites so nested declarations attach to the innermost one. Cases are
 * attached and appended to the pending list in discovery order. The builder is
 * single-threaded and is closed once the build pass ends.</p>
 */
final class DiscoveringTreeBuilder implements TreeBuilder
{
    private final RunObservabilitySink sink;
    private final Deque<SuiteNode> open = new ArrayDeque<>();
    private final List<ScheduledCase> pending = new ArrayList<>();
    private boolean closed;

    DiscoveringTreeBuilder(RunObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public TreeBuilder suite(String name, SuiteBody body)
    {
        Objects.requireNonNull(body, "body");
        SuiteNode parent = current();
        SuiteNode suite = new SuiteNode(name, parent.id());
        parent.attach(suite);
        discover(suite, body);
        return this;
    }

    @Override
    public TreeBuilder test(String name, CaseBody body)
    {
        SuiteNode parent = current();
        CaseNode node = new CaseNode(name, parent.id(), body);
        parent.attach(node);
        pending.add(new ScheduledCase(pending.size(), parent.id(), node));
        return this;
    }

    /**
     * Runs a suite's discovery body with the suite as the innermost open suite.
     * A failure is recorded against that suite and does not propagate.
     */
    void discover(SuiteNode suite, SuiteBody body)
    {
        requireOpen();
        open.push(suite);
        try {
            body.declare(this);
        }
        catch (Throwable t) {
            Throwables.rethrowIfUnrecoverable(t);
            BuildError error = BuildError.of(t);
            suite.markBuildError(error);
            sink.onBuildError(new BuildErrorEvent(Instant.now(), suite.id(), error));
        }
        finally {
            open.pop();
        }
    }

    List<ScheduledCase> close()
    {
        closed = true;
        return Collections.unmodifiableList(pending);
    }

    private SuiteNode current()
    {
        requireOpen();
        SuiteNode s = open.peek();
        if (s == null) {
            throw new IllegalStateException("no suite is being discovered");
        }
        return s;
    }

    private void requireOpen()
    {
        if (closed) {
            throw new IllegalStateException("build pass is over; the tree shape is frozen");
        }
    }
}
