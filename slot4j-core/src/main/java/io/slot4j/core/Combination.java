package io.slot4j.core;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every session of a day placed conflict-free, slots in ascending session order.
 *
 * @param totalMinutes span from the first start to the last end, breaks included
 * @param loadDensity  fast per-participant density (assigned slots over a typical capacity)
 */
public record Combination(
        String id,
        LocalDate date,
        List<PlacedSlot> slots,
        Instant start,
        Instant end,
        long totalMinutes,
        Map<String, Double> loadDensity
) {

    public Combination {
        slots = List.copyOf(slots);
        loadDensity = loadDensity == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(loadDensity));
    }

    /**
     * Participant ids in first-seen order.
     */
    public Set<String> participantIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (PlacedSlot slot : slots) {
            for (ParticipantAssignment assignment : slot.assignments()) {
                ids.add(assignment.participantId());
            }
        }
        return ids;
    }

    public double meanDensity() {
        if (loadDensity.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double value : loadDensity.values()) {
            sum += value;
        }
        return sum / loadDensity.size();
    }
}
