package io.slot4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A session placed at a concrete time with its assigned participants.
 */
public record PlacedSlot(
        String sessionId,
        String sessionName,
        Instant start,
        Instant end,
        List<ParticipantAssignment> assignments
) {

    public PlacedSlot {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return otherStart.isBefore(end) && start.isBefore(otherEnd);
    }

    public boolean involves(String participantId) {
        for (ParticipantAssignment assignment : assignments) {
            if (assignment.participantId().equals(participantId)) {
                return true;
            }
        }
        return false;
    }

    public long minutes() {
        return Duration.between(start, end).toMinutes();
    }
}
