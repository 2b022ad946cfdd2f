package com.questrail.testtree.api;

/**
 * Declarative call sequence used by the front-end to describe the test tree.
 *
 * <p>Valid only during the build pass. Once the pass has finished the shape of
 * the tree is frozen and every method throws {@link IllegalStateException}.</p>
 */
public interface TreeBuilder
{
    /**
     * Declares a suite and runs its discovery body immediately.
     *
     * <p>If the body throws, the failure is recorded against this suite and the
     * suite's remaining children are not discovered. Siblings are unaffected.</p>
     */
    TreeBuilder suite(String name, SuiteBody body);

    /**
     * Declares a case. The body is deferred until the run phase.
     */
    TreeBuilder test(String name, CaseBody body);
}
