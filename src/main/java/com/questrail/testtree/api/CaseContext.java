package com.questrail.testtree.api;

import com.questrail.testtree.model.AssertionOutcome;

import java.util.function.BooleanSupplier;

/**
 * CaseContext
 * -----------------------------------------------------------------------------
 * Case-local outcome buffer handed to a running {@link CaseBody}.
 *
 * <p>Every assertion produces exactly one {@link AssertionOutcome}, kept in
 * evaluation order. The buffer is flushed to the outcome recorder once, when the
 * body returns or throws. A context belongs to a single case and must not be
 * shared with other threads.</p>
 */
public interface CaseContext
{
    /** Appends an outcome produced by an external assertion layer. */
    void record(AssertionOutcome outcome);

    /**
     * Records {@code Passed} if {@code condition} holds, {@code Failed} otherwise.
     *
     * @param expression source text of the assertion, used in reports
     */
    default boolean check(String expression, boolean condition)
    {
        record(condition
                ? AssertionOutcome.pass()
                : AssertionOutcome.fail(expression, "false"));
        return condition;
    }

    /**
     * Evaluates {@code condition} in assertion context. An exception thrown by
     * the condition is recorded as {@code Errored} and the body continues.
     */
    boolean check(String expression, BooleanSupplier condition);

    /**
     * Records {@code Passed} if {@code expected} equals {@code actual}; otherwise
     * {@code Failed} with the evaluated operands.
     */
    default boolean checkEquals(String expression, Object expected, Object actual)
    {
        boolean equal = expected == null ? actual == null : expected.equals(actual);
        record(equal
                ? AssertionOutcome.pass()
                : AssertionOutcome.fail(expression, "expected <" + expected + "> but was <" + actual + ">"));
        return equal;
    }

    /** Records a known failure that does not fail the run. */
    default void broken(String reason)
    {
        record(AssertionOutcome.broken(reason));
    }

    /**
     * Runs a named sub-section of this case. Sections are reported under the
     * case but are not scheduled independently. An exception thrown by the
     * section propagates and terminates the case body.
     */
    void section(String name, SectionBody body) throws Exception;
}
