package com.questrail.testtree.fixtures;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.api.TreeBuilder;

/**
 * {@code recurses} overflows the stack, once directly and once from inside a
 * section; {@code sibling} passes.
 */
public final class RecursingPlan implements TestPlan
{
    @Override
    public void declare(TreeBuilder tests)
    {
        tests.test("recurses", c -> {
            c.check("before", true);
            recurse(0);
            c.check("never evaluated", true);
        });
        tests.test("recurses-in-section", c -> c.section("deep", s -> recurse(0)));
        tests.test("sibling", c -> c.check("sibling", true));
    }

    private static int recurse(int depth)
    {
        return recurse(depth + 1) + 1;
    }
}
