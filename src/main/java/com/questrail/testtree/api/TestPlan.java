package com.questrail.testtree.api;

/**
 * TestPlan
 * -----------------------------------------------------------------------------
 * Front-end entry point: declares the root suite's children.
 *
 * <p>A plan must be deterministic. Building the same plan twice has to yield the
 * same suites and cases in the same order, because distributed workers rebuild
 * the plan in their own process and address cases by discovery index.</p>
 *
 * <p>Plans run by the distributed strategy must be public classes with a public
 * no-argument constructor.</p>
 */
public interface TestPlan
{
    void declare(TreeBuilder tests) throws Exception;

    /** Name of the root suite; the simple class name, or {@code root} for lambdas and anonymous plans. */
    default String name()
    {
        Class<?> type = getClass();
        if (type.isAnonymousClass() || type.isSynthetic() || type.isHidden()) {
            return "root";
        }
        return type.getSimpleName();
    }
}
