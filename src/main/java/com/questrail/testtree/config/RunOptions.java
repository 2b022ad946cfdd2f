package com.questrail.testtree.config;

import com.questrail.testtree.core.CaseFilter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Options of one run. An explicit value handed to the runner; nothing is read
 * from global state.
 *
 * @param seed          permutation seed of the shuffled strategy
 * @param workerCount   threads (parallel) or processes (distributed)
 * @param filter        selects the cases to run
 * @param timeout       run deadline; {@code null} for none
 * @param xmlOutputPath where to write the JUnit XML report; {@code null} for none
 */
public record RunOptions(
    long seed,
    int workerCount,
    CaseFilter filter,
    Duration timeout,
    Path xmlOutputPath
) {
    public RunOptions {
        Objects.requireNonNull(filter, "filter");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public Optional<Duration> timeoutIfSet() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Path> xmlOutput() {
        return Optional.ofNullable(xmlOutputPath);
    }

    /** Seed 0, one worker per available processor, every case, no deadline, no XML. */
    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long seed = 0L;
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private CaseFilter filter = CaseFilter.all();
        private Duration timeout;
        private Path xmlOutputPath;

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder withWorkerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder withFilter(CaseFilter filter) {
            this.filter = filter;
            return this;
        }

        /** Parses a filter expression; see {@link CaseFilter#parse(String)}. */
        public Builder withFilter(String expression) {
            this.filter = CaseFilter.parse(expression);
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withXmlOutputPath(Path xmlOutputPath) {
            this.xmlOutputPath = xmlOutputPath;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(seed, workerCount, filter, timeout, xmlOutputPath);
        }
    }
}
