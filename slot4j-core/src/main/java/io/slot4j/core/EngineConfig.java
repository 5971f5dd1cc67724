package io.slot4j.core;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Engine-wide settings, fixed at construction.
 *
 * @param zone                zone in which {@code dayStartTime} is anchored on each searched date
 * @param dayStartTime        start of the first session of a day
 * @param dayThresholdMinutes a break at least this long starts a new round on a later date
 * @param parallelism         worker threads for per-date fan-out; 1 searches on the calling thread
 * @param defaultOptions      options used when a request carries none
 */
public record EngineConfig(
        ZoneId zone,
        LocalTime dayStartTime,
        int dayThresholdMinutes,
        int parallelism,
        SearchOptions defaultOptions
) {

    public static final int MINUTES_IN_DAY = 1440;
    public static final LocalTime DEFAULT_DAY_START = LocalTime.of(9, 0);

    public EngineConfig {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(dayStartTime, "dayStartTime must not be null");
        Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
        if (dayThresholdMinutes <= 0) {
            throw new IllegalArgumentException("dayThresholdMinutes must be positive: " + dayThresholdMinutes);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
    }

    /**
     * UTC, 09:00 day start, one-day threshold, single-threaded.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(ZoneOffset.UTC, DEFAULT_DAY_START, MINUTES_IN_DAY, 1, SearchOptions.defaults());
    }

    public EngineConfig withParallelism(int threads) {
        return new EngineConfig(zone, dayStartTime, dayThresholdMinutes, threads, defaultOptions);
    }

    public EngineConfig withDefaultOptions(SearchOptions options) {
        return new EngineConfig(zone, dayStartTime, dayThresholdMinutes, parallelism, options);
    }
}
