package io.slot4j.core;

import java.util.List;

public record AvailabilityResult(boolean available, List<Conflict> conflicts) {

    public AvailabilityResult {
        conflicts = List.copyOf(conflicts);
    }

    public static AvailabilityResult of(List<Conflict> conflicts) {
        return new AvailabilityResult(conflicts.isEmpty(), conflicts);
    }
}
