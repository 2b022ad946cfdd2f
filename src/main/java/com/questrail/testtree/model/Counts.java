package com.questrail.testtree.model;

/**
 * Per-kind tally of assertion outcomes.
 *
 * <p>For a case this is the tally of its own outcomes. For a suite it is the
 * element-wise sum of its children's Counts, computed once after every case in
 * the run has reported.</p>
 */
public record Counts(int pass, int fail, int error, int broken) {

    public static final Counts ZERO = new Counts(0, 0, 0, 0);

    public Counts {
        if (pass < 0 || fail < 0 || error < 0 || broken < 0) {
            throw new IllegalArgumentException("counts must be non-negative: "
                    + pass + "/" + fail + "/" + error + "/" + broken);
        }
    }

    public static Counts of(Iterable<? extends AssertionOutcome> outcomes) {
        Counts c = ZERO;
        for (AssertionOutcome o : outcomes) {
            c = c.plus(o);
        }
        return c;
    }

    public Counts plus(Counts other) {
        return new Counts(
                pass + other.pass,
                fail + other.fail,
                error + other.error,
                broken + other.broken);
    }

    public Counts plus(AssertionOutcome outcome) {
        if (outcome instanceof AssertionOutcome.Passed) {
            return new Counts(pass + 1, fail, error, broken);
        }
        if (outcome instanceof AssertionOutcome.Failed) {
            return new Counts(pass, fail + 1, error, broken);
        }
        if (outcome instanceof AssertionOutcome.Errored) {
            return new Counts(pass, fail, error + 1, broken);
        }
        return new Counts(pass, fail, error, broken + 1);
    }

    public int total() {
        return pass + fail + error + broken;
    }

    /** Broken outcomes never make a tally failing. */
    public boolean isFailing() {
        return fail + error > 0;
    }

    @Override
    public String toString() {
        return "pass=" + pass + " fail=" + fail + " error=" + error + " broken=" + broken;
    }
}
