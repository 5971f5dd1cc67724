package io.slot4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A range the participant keeps free of sessions (e.g. a recruiting block).
 */
public record BlockedRange(Instant start, Instant end) {

    public BlockedRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("BlockedRange end must not be before start");
        }
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && start.isBefore(otherEnd);
    }
}
