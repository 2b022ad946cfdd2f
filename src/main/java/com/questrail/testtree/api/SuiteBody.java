package com.questrail.testtree.api;

/**
 * Discovery callback of a suite.
 *
 * <p>Invoked synchronously while the tree is being built. It declares children
 * and must not make assertions: anything it evaluates runs unconditionally at
 * build time, before any strategy is chosen.</p>
 */
@FunctionalInterface
public interface SuiteBody
{
    void declare(TreeBuilder tests) throws Exception;
}
