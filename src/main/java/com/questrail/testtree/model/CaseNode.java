package com.questrail.testtree.model;

import com.questrail.testtree.api.CaseBody;

import java.util.Objects;
import java.util.Optional;

/**
 * Leaf node whose body is deferred until the run phase.
 *
 * <p>The result is written once, by the finalize step. A case that was pruned by
 * a filter never gets a result and reports as absent with zero Counts.</p>
 */
public final class CaseNode implements TestNode
{
    private final String name;
    private final TestPath path;
    private final CaseBody body;

    private volatile CaseResult result;

    public CaseNode(String name, TestPath path, CaseBody body)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String name()
    {
        return name;
    }

    @Override
    public TestPath path()
    {
        return path;
    }

    public CaseBody body()
    {
        return body;
    }

    public synchronized void complete(CaseResult result)
    {
        Objects.requireNonNull(result, "result");
        if (this.result != null) {
            throw new IllegalStateException("result of " + id() + " already written");
        }
        this.result = result;
    }

    public Optional<CaseResult> result()
    {
        return Optional.ofNullable(result);
    }

    @Override
    public Counts counts()
    {
        CaseResult r = result;
        return r == null ? Counts.ZERO : r.counts();
    }

    @Override
    public String toString()
    {
        return "Case[" + id() + "]";
    }
}
