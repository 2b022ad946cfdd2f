package com.questrail.testtree.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Failure of a suite's discovery body during the build pass.
 *
 * @param description exception type and message
 * @param location    first stack frame of the failure; {@code null} when unknown
 */
public record BuildError(String description, String location) {
    public BuildError {
        Objects.requireNonNull(description, "description");
    }

    public static BuildError of(Throwable t) {
        AssertionOutcome.Errored e = AssertionOutcome.Errored.of(t);
        return new BuildError(e.description(), e.location());
    }

    public Optional<String> originatingLocation() {
        return Optional.ofNullable(location);
    }
}
