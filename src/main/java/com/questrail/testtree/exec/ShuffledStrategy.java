package com.questrail.testtree.exec;

import com.questrail.testtree.model.ScheduledCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * ShuffledStrategy
 * -----------------------------------------------------------------------------
 * Runs cases sequentially in a seeded random permutation.
 *
 * <p>The permutation is a pure function of the seed and the input order, so a
 * failing order can be reproduced by re-running with the same seed. Final
 * aggregates are identical to {@link SequentialStrategy}'s for the same tree;
 * only the order in which bodies observe shared state changes.</p>
 */
public final class ShuffledStrategy extends SequentialStrategy
{
    private final long seed;

    public ShuffledStrategy(CaseRunner runner, long seed)
    {
        super(runner);
        this.seed = seed;
    }

    @Override
    public String name()
    {
        return "shuffled(seed=" + seed + ")";
    }

    public long seed()
    {
        return seed;
    }

    @Override
    protected List<ScheduledCase> order(List<ScheduledCase> pending)
    {
        return permute(pending, seed);
    }

    static List<ScheduledCase> permute(List<ScheduledCase> pending, long seed)
    {
        List<ScheduledCase> copy = new ArrayList<>(pending);
        Collections.shuffle(copy, new Random(seed));
        return Collections.unmodifiableList(copy);
    }
}
