package io.slot4j.core;

import java.util.List;

/**
 * Sessions intended for the same calendar date.
 */
public record Round(int index, List<Session> sessions) {

    public Round {
        sessions = List.copyOf(sessions);
        if (sessions.isEmpty()) {
            throw new IllegalArgumentException("Round must contain at least one session");
        }
    }

    /**
     * The last session, whose break decides the gap before the next round.
     */
    public Session boundarySession() {
        return sessions.get(sessions.size() - 1);
    }
}
