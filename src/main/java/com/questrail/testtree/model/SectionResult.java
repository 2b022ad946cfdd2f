package com.questrail.testtree.model;

import java.util.Objects;

/**
 * Tally of the outcomes produced inside a named section of a case body.
 *
 * <p>Sections are reporting-only sub-nodes of a case: they never get their own
 * scheduling slot and their Counts are already included in the case's Counts.</p>
 *
 * @param name  section name, nested sections joined with {@code '/'}
 * @param counts outcomes produced while the section was innermost
 */
public record SectionResult(String name, Counts counts) {
    public SectionResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(counts, "counts");
    }
}
