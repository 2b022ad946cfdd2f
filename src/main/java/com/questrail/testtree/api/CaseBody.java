package com.questrail.testtree.api;

/**
 * Deferred body of a test case.
 *
 * <p>The body is invoked exactly once per run, possibly on a different thread or
 * in a different process than the one that declared it. Assertions are made
 * through the supplied {@link CaseContext}; an exception thrown out of the body
 * terminates it and is recorded as an error of this case only.</p>
 */
@FunctionalInterface
public interface CaseBody
{
    void run(CaseContext context) throws Exception;
}
