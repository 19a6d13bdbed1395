package com.ashscreener.model;

/**
 * Result of one per-entity check. INDETERMINATE means the upstream data was not available.
 */
public enum FilterOutcome {
    PASS,
    FAIL,
    INDETERMINATE;

    public static FilterOutcome of(boolean passed) {
        return passed ? PASS : FAIL;
    }
}
