package io.slot4j.core;

import java.util.Objects;

public record LoadLimit(LimitType type, double max) {

    public LoadLimit {
        Objects.requireNonNull(type, "type must not be null");
        if (max <= 0) {
            throw new IllegalArgumentException("LoadLimit max must be positive: " + max);
        }
    }

    public static LoadLimit hours(double max) {
        return new LoadLimit(LimitType.HOURS, max);
    }

    public static LoadLimit count(int max) {
        return new LoadLimit(LimitType.COUNT, max);
    }
}
