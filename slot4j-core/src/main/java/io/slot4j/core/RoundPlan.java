package io.slot4j.core;

import java.time.LocalDate;
import java.util.List;

public record RoundPlan(
        int roundNumber,
        LocalDate date,
        Combination combination,
        List<Session> sessions
) {

    public RoundPlan {
        sessions = List.copyOf(sessions);
    }
}
