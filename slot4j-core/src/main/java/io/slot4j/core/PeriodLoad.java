package io.slot4j.core;

/**
 * Load over one period (day or week) including a proposed window.
 *
 * @param current hours or count, depending on the limit type
 * @param density {@code current / max}
 */
public record PeriodLoad(double current, double max, double density) {

    public static PeriodLoad of(double current, double max) {
        return new PeriodLoad(current, max, current / max);
    }
}
