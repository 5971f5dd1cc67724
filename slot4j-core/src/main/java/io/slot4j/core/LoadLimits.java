package io.slot4j.core;

import java.util.Objects;

public record LoadLimits(LoadLimit daily, LoadLimit weekly) {

    public LoadLimits {
        Objects.requireNonNull(daily, "daily limit must not be null");
        Objects.requireNonNull(weekly, "weekly limit must not be null");
    }

    public static LoadLimits of(LoadLimit daily, LoadLimit weekly) {
        return new LoadLimits(daily, weekly);
    }
}
