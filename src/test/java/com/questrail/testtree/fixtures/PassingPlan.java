package com.questrail.testtree.fixtures;

import com.questrail.testtree.api.TestPlan;
import com.questrail.testtree.api.TreeBuilder;

/**
 * Twelve independent, always-passing cases spread over three suites. Case
 * {@code i} makes {@code i % 3 + 1} assertions.
 */
public final class PassingPlan implements TestPlan
{
    public static final int CASES = 12;
    public static final int ASSERTIONS = 24;

    @Override
    public void declare(TreeBuilder tests)
    {
        for (int s = 0; s < 3; s++) {
            final int suite = s;
            tests.suite("group-" + suite, group -> {
                for (int k = 0; k < 4; k++) {
                    final int i = suite * 4 + k;
                    group.test("case-" + i, c -> {
                        for (int a = 0; a < i % 3 + 1; a++) {
                            c.check("assertion " + a + " of case " + i, true);
                        }
                    });
                }
            });
        }
    }
}
