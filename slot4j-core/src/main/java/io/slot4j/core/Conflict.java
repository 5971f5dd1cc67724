package io.slot4j.core;

import java.util.Objects;

/**
 * Why a participant cannot take a window. A normal outcome of constraint evaluation, never an error.
 *
 * @param busyInterval the conflicting commitment, only for {@link ConflictKind#CALENDAR_EVENT}
 */
public record Conflict(
        ConflictKind kind,
        String participantId,
        BusyInterval busyInterval,
        String message
) {

    public Conflict {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static Conflict of(ConflictKind kind, String participantId, String message) {
        return new Conflict(kind, participantId, null, message);
    }
}
