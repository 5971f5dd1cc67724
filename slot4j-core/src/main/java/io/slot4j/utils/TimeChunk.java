package io.slot4j.utils;

import java.time.Instant;

/**
 * Half-open interval {@code [start, end)} of normalized minute values.
 *
 * <p>Both bounds must come from the same axis: minutes from midnight for clock times, or
 * minutes on the UTC epoch axis for timestamps (see {@link IntervalMath#normalize(String)}).
 */
public record TimeChunk(long start, long end) {

    public TimeChunk {
        if (end < start) {
            throw new IllegalArgumentException("TimeChunk end must not be before start: " + start + " > " + end);
        }
    }

    public static TimeChunk of(long start, long end) {
        return new TimeChunk(start, end);
    }

    /**
     * Parse two values of the same format (clock, timestamp or minutes).
     */
    public static TimeChunk parse(String start, String end) {
        return new TimeChunk(IntervalMath.normalize(start), IntervalMath.normalize(end));
    }

    public static TimeChunk of(Instant start, Instant end) {
        return new TimeChunk(IntervalMath.normalize(start), IntervalMath.normalize(end));
    }

    public long minutes() {
        return end - start;
    }
}
