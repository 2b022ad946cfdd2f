package com.questrail.testtree.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything recorded for one case: its outcomes in evaluation order, the
 * section breakdown, the wall time of the body and how the result came about.
 */
public record CaseResult(
        CaseStatus status,
        List<AssertionOutcome> outcomes,
        List<SectionResult> sections,
        Duration duration
) {
    public CaseResult {
        Objects.requireNonNull(status, "status");
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative");
        }
    }

    public static CaseResult executed(List<AssertionOutcome> outcomes) {
        return new CaseResult(CaseStatus.EXECUTED, outcomes, List.of(), Duration.ZERO);
    }

    /** A result holding a single {@link AssertionOutcome.Errored} and no body timing. */
    public static CaseResult unexecuted(CaseStatus status, String reason) {
        return new CaseResult(status, List.of(new AssertionOutcome.Errored(reason, null)), List.of(), Duration.ZERO);
    }

    public Counts counts() {
        return Counts.of(outcomes);
    }

    public Optional<AssertionOutcome.Failed> firstFailure() {
        for (AssertionOutcome o : outcomes) {
            if (o instanceof AssertionOutcome.Failed) {
                return Optional.of((AssertionOutcome.Failed) o);
            }
        }
        return Optional.empty();
    }
}
