package com.questrail.testtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Grouping node whose children are discovered by running its body at build time.
 *
 * <p>Children may only be attached before {@link #freeze()}. The aggregate is
 * published exactly once by the outcome recorder's finalize step; reading it
 * earlier is a programming error.</p>
 */
public final class SuiteNode implements TestNode
{
    private final String name;
    private final TestPath path;
    private final List<TestNode> children = new ArrayList<>();
    private final List<TestNode> childrenView = Collections.unmodifiableList(children);

    private BuildError buildError;
    private boolean frozen;
    private volatile Counts aggregate;

    public SuiteNode(String name, TestPath path)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
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

    public List<TestNode> children()
    {
        return childrenView;
    }

    public Optional<TestNode> child(String childName)
    {
        for (TestNode c : children) {
            if (c.name().equals(childName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public void attach(TestNode child)
    {
        Objects.requireNonNull(child, "child");
        requireMutable();
        if (!child.path().equals(id())) {
            throw new IllegalArgumentException("child " + child.id() + " does not belong under " + id());
        }
        if (child(child.name()).isPresent()) {
            throw new DuplicateNodeException(child.id());
        }
        children.add(child);
    }

    public void markBuildError(BuildError error)
    {
        requireMutable();
        this.buildError = Objects.requireNonNull(error, "error");
    }

    public Optional<BuildError> buildError()
    {
        return Optional.ofNullable(buildError);
    }

    /** Ends the build pass for this suite and all suites below it. */
    public void freeze()
    {
        frozen = true;
        for (TestNode c : children) {
            if (c instanceof SuiteNode) {
                ((SuiteNode) c).freeze();
            }
        }
    }

    public boolean isFrozen()
    {
        return frozen;
    }

    /**
     * Publishes the aggregate. Called once, by the finalize step, after every
     * case below this suite has been recorded.
     */
    public void publishAggregate(Counts counts)
    {
        Objects.requireNonNull(counts, "counts");
        if (aggregate != null) {
            throw new IllegalStateException("aggregate of " + id() + " already published");
        }
        aggregate = counts;
    }

    public boolean isAggregated()
    {
        return aggregate != null;
    }

    @Override
    public Counts counts()
    {
        Counts c = aggregate;
        if (c == null) {
            throw new IllegalStateException("aggregate of " + id() + " read before finalize");
        }
        return c;
    }

    private void requireMutable()
    {
        if (frozen) {
            throw new IllegalStateException("tree shape is frozen; cannot modify " + id());
        }
    }

    @Override
    public String toString()
    {
        return "Suite[" + id() + "]";
    }
}
