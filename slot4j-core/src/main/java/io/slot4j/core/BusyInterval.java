package io.slot4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An external commitment of one participant, taken from a pre-fetched snapshot.
 */
public record BusyInterval(
        String id,
        String label,
        Instant start,
        Instant end
) {

    public BusyInterval {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("BusyInterval end must not be before start: " + id);
        }
    }

    public static BusyInterval of(String label, Instant start, Instant end) {
        return new BusyInterval(null, label, start, end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && start.isBefore(otherEnd);
    }

    public long minutes() {
        return Duration.between(start, end).toMinutes();
    }
}
