package io.slot4j.core;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Clock-of-day range, used for work hours and candidate availability.
 */
public record TimeRange(LocalTime start, LocalTime end) {

    public TimeRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("TimeRange end must not be before start: " + start + " - " + end);
        }
    }

    /**
     * Parse "HH:mm" (or "HH:mm:ss") bounds.
     */
    public static TimeRange of(String start, String end) {
        return new TimeRange(LocalTime.parse(start), LocalTime.parse(end));
    }

    public int startMinute() {
        return start.getHour() * 60 + start.getMinute();
    }

    public int endMinute() {
        return end.getHour() * 60 + end.getMinute();
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
