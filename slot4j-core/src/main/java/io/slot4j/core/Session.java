package io.slot4j.core;

import java.util.List;
import java.util.Objects;

/**
 * One schedulable stage of a loop.
 *
 * <p>{@code breakAfterMinutes} is the gap before the next session (by {@link #order()}) may start.
 * A gap of at least one day-length threshold splits the loop into rounds on separate dates.
 *
 * @param candidatePool    participant ids eligible for this session; {@code null} means everyone
 * @param allowTrainees    {@code Boolean.FALSE} opts this session out of trainee augmentation
 */
public record Session(
        String id,
        String name,
        int durationMinutes,
        int breakAfterMinutes,
        int requiredCount,
        int order,
        List<String> candidatePool,
        Boolean allowTrainees
) {

    public Session {
        Objects.requireNonNull(id, "session id must not be null");
        candidatePool = candidatePool == null ? null : List.copyOf(candidatePool);
    }

    public static Session of(String id, int durationMinutes, int breakAfterMinutes, int requiredCount, int order) {
        return new Session(id, id, durationMinutes, breakAfterMinutes, requiredCount, order, null, null);
    }

    public Session withCandidatePool(List<String> participantIds) {
        return new Session(id, name, durationMinutes, breakAfterMinutes, requiredCount, order, participantIds, allowTrainees);
    }

    public Session withName(String newName) {
        return new Session(id, newName, durationMinutes, breakAfterMinutes, requiredCount, order, candidatePool, allowTrainees);
    }

    public Session withAllowTrainees(Boolean allow) {
        return new Session(id, name, durationMinutes, breakAfterMinutes, requiredCount, order, candidatePool, allow);
    }

    public boolean acceptsTrainees() {
        return allowTrainees == null || allowTrainees;
    }
}
