package com.questrail.testtree.model;

import com.questrail.testtree.api.TestPlan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * TestTree
 * =============================================================================
 * A built test tree plus its work list.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link #root()}: the frozen suite hierarchy, used for reporting.</li>
 *   <li>{@link #discovered()}: every case in discovery order.</li>
 *   <li>{@link #pending()}: the cases selected to run, a subsequence of
 *       {@link #discovered()}.</li>
 * </ul>
 *
 * <p>Selecting cases produces a new {@code TestTree} that shares the same nodes:
 * the shape used for reporting never changes, only the work list does.</p>
 */
public final class TestTree
{
    private final SuiteNode root;
    private final List<ScheduledCase> discovered;
    private final List<ScheduledCase> pending;
    private final Class<? extends TestPlan> planClass;

    public TestTree(SuiteNode root, List<ScheduledCase> discovered, Class<? extends TestPlan> planClass)
    {
        this(root, discovered, discovered, planClass);
    }

    private TestTree(SuiteNode root,
                     List<ScheduledCase> discovered,
                     List<ScheduledCase> pending,
                     Class<? extends TestPlan> planClass)
    {
        this.root = Objects.requireNonNull(root, "root");
        this.discovered = List.copyOf(discovered);
        this.pending = List.copyOf(pending);
        this.planClass = planClass;
        if (!root.isFrozen()) {
            throw new IllegalArgumentException("tree must be frozen before it can be scheduled");
        }
    }

    public SuiteNode root()
    {
        return root;
    }

    public List<ScheduledCase> discovered()
    {
        return discovered;
    }

    public List<ScheduledCase> pending()
    {
        return pending;
    }

    /** Plan class the tree was built from, when it can be rebuilt by name. */
    public Optional<Class<? extends TestPlan>> planClass()
    {
        return Optional.ofNullable(planClass);
    }

    /**
     * Returns a tree with the same shape whose work list is {@code selected}.
     *
     * @throws IllegalArgumentException if {@code selected} contains a case that was
     *         not discovered in this tree
     */
    public TestTree withPending(List<ScheduledCase> selected)
    {
        for (ScheduledCase sc : selected) {
            if (sc.index() >= discovered.size() || discovered.get(sc.index()) != sc) {
                throw new IllegalArgumentException("case " + sc.id() + " is not part of this tree");
            }
        }
        return new TestTree(root, discovered, selected, planClass);
    }

    /**
     * Depth-first, pre-order traversal yielding {@code (id, node)} pairs, children
     * in discovery order.
     */
    public void traverse(BiConsumer<TestPath, TestNode> visitor)
    {
        Objects.requireNonNull(visitor, "visitor");
        traverse(root, visitor);
    }

    private static void traverse(TestNode node, BiConsumer<TestPath, TestNode> visitor)
    {
        visitor.accept(node.id(), node);
        if (node instanceof SuiteNode) {
            for (TestNode child : ((SuiteNode) node).children()) {
                traverse(child, visitor);
            }
        }
    }

    public Optional<TestNode> find(TestPath id)
    {
        Objects.requireNonNull(id, "id");
        if (!id.startsWith(root.id())) {
            return Optional.empty();
        }
        TestNode current = root;
        for (String segment : id.segments().subList(1, id.depth())) {
            if (!(current instanceof SuiteNode)) {
                return Optional.empty();
            }
            Optional<TestNode> next = ((SuiteNode) current).child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /** Whether every suite aggregate has been published. */
    public boolean isFinalized()
    {
        return root.isAggregated();
    }
}
