package com.questrail.testtree.fixtures;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.api.TreeBuilder;

/**
 * {@value #CASES} cases that each sleep {@value #CASE_MILLIS} ms before passing.
 */
public final class SlowPlan implements TestPlan
{
    public static final int CASES = 10;
    public static final long CASE_MILLIS = 100;

    @Override
    public void declare(TreeBuilder tests)
    {
        for (int i = 0; i < CASES; i++) {
            tests.test("slow-" + i, c -> {
                Thread.sleep(CASE_MILLIS);
                c.check("woke up", true);
            });
        }
    }
}
