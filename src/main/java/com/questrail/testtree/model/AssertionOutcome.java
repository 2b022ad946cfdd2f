package com.questrail.testtree.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating one assertion inside a case body.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Passed}: the assertion held.</li>
 *   <li>{@link Failed}: the assertion evaluated false. Recoverable; the body
 *       continues with its next assertion.</li>
 *   <li>{@link Errored}: an exception escaped evaluation, the body itself threw,
 *       or the worker running the case was lost. Isolated to the case.</li>
 *   <li>{@link Broken}: a known, expected failure. Reported but never counted
 *       toward overall failure.</li>
 * </ul>
 *
 * <p>Outcomes are immutable and carry only text, so they can cross a process
 * boundary without the classes that produced them.</p>
 */
public sealed interface AssertionOutcome
        permits AssertionOutcome.Passed,
                AssertionOutcome.Failed,
                AssertionOutcome.Errored,
                AssertionOutcome.Broken {

    /** Whether this outcome counts toward the overall failure status. */
    default boolean isFailing() {
        return this instanceof Failed || this instanceof Errored;
    }

    static Passed pass() {
        return Passed.INSTANCE;
    }

    static Failed fail(String expression, String evaluated) {
        return new Failed(expression, evaluated);
    }

    static Errored error(String description, String location) {
        return new Errored(description, location);
    }

    static Broken broken(String reason) {
        return new Broken(reason);
    }

    record Passed() implements AssertionOutcome {
        static final Passed INSTANCE = new Passed();
    }

    /**
     * @param expression the assertion source text, e.g. {@code 2*2 == 5}
     * @param evaluated  description of the evaluated operands, e.g. {@code 4 == 5}
     */
    record Failed(String expression, String evaluated) implements AssertionOutcome {
        public Failed {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(evaluated, "evaluated");
        }
    }

    /**
     * @param description exception type and message, or the process-failure reason
     * @param location    originating source location; {@code null} when unknown
     */
    record Errored(String description, String location) implements AssertionOutcome {
        public Errored {
            Objects.requireNonNull(description, "description");
        }

        public Optional<String> originatingLocation() {
            return Optional.ofNullable(location);
        }

        /** Describes a throwable using its type, message and first stack frame. */
        public static Errored of(Throwable t) {
            Objects.requireNonNull(t, "t");
            String message = t.getMessage();
            String description = message == null
                    ? t.getClass().getName()
                    : t.getClass().getName() + ": " + message;
            StackTraceElement[] trace = t.getStackTrace();
            String location = trace.length > 0 ? trace[0].toString() : null;
            return new Errored(description, location);
        }
    }

    record Broken(String reason) implements AssertionOutcome {
        public Broken {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
