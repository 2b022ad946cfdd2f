package com.questrail.testtree.config;

import java.util.Locale;

/**
 * The execution strategies a run can be configured with.
 */
public enum StrategyName {
    SEQUENTIAL,
    SHUFFLED,
    PARALLEL,
    DISTRIBUTED;

    /** Lower-case form used on the command line. */
    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static StrategyName parse(String text) {
        String normalized = text == null ? "" : text.trim().toUpperCase(Locale.ROOT);
        for (StrategyName s : values()) {
            if (s.name().equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown strategy '" + text
                + "'; expected one of sequential, shuffled, parallel, distributed");
    }
}
