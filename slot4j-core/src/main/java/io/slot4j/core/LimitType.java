package io.slot4j.core;

public enum LimitType {
    /**
     * Load measured in hours of merged busy time.
     */
    HOURS,
    /**
     * Load measured in number of busy intervals.
     */
    COUNT
}
