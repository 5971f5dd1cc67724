package io.slot4j.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Frozen busy intervals per participant id, taken before a search starts.
 *
 * <p>A participant without an entry has no known busy time.
 */
public final class BusySnapshot {

    private static final BusySnapshot EMPTY = new BusySnapshot(Map.of());

    private final Map<String, List<BusyInterval>> byParticipant;

    private BusySnapshot(Map<String, List<BusyInterval>> byParticipant) {
        this.byParticipant = byParticipant;
    }

    public static BusySnapshot empty() {
        return EMPTY;
    }

    /**
     * Copy the given mapping; each list is sorted by start.
     */
    public static BusySnapshot of(Map<String, ? extends List<BusyInterval>> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<BusyInterval>> copy = new LinkedHashMap<>();
        intervals.forEach((participantId, list) -> {
            Objects.requireNonNull(participantId, "participant id must not be null");
            if (list == null || list.isEmpty()) {
                return;
            }
            List<BusyInterval> sorted = new ArrayList<>(list);
            sorted.sort(Comparator.comparing(BusyInterval::start).thenComparing(BusyInterval::end));
            copy.put(participantId, Collections.unmodifiableList(sorted));
        });
        return new BusySnapshot(Collections.unmodifiableMap(copy));
    }

    public List<BusyInterval> forParticipant(String participantId) {
        return byParticipant.getOrDefault(participantId, List.of());
    }

    /**
     * Busy intervals of the participant that overlap {@code [start, end)}.
     */
    public List<BusyInterval> overlapping(String participantId, Instant start, Instant end) {
        List<BusyInterval> hits = new ArrayList<>();
        for (BusyInterval interval : forParticipant(participantId)) {
            if (!interval.start().isBefore(end)) {
                break;
            }
            if (interval.overlaps(start, end)) {
                hits.add(interval);
            }
        }
        return hits;
    }

    public Set<String> participantIds() {
        return byParticipant.keySet();
    }

    public Map<String, List<BusyInterval>> asMap() {
        return byParticipant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BusySnapshot other)) return false;
        return byParticipant.equals(other.byParticipant);
    }

    @Override
    public int hashCode() {
        return byParticipant.hashCode();
    }

    @Override
    public String toString() {
        return "BusySnapshot" + byParticipant;
    }
}
