package io.slot4j.internal;

import io.slot4j.core.Round;
import io.slot4j.core.Session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a loop into rounds: a session whose break reaches the threshold closes its round.
 */
public final class RoundGrouper {
    private RoundGrouper() {
    }

    public static List<Round> group(List<Session> sessions, int thresholdMinutes) {
        List<Session> sorted = new ArrayList<>(sessions);
        sorted.sort(Comparator.comparingInt(Session::order));

        List<Round> rounds = new ArrayList<>();
        List<Session> current = new ArrayList<>();
        for (Session session : sorted) {
            current.add(session);
            if (session.breakAfterMinutes() >= thresholdMinutes) {
                rounds.add(new Round(rounds.size(), current));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            rounds.add(new Round(rounds.size(), current));
        }
        return rounds;
    }

    /**
     * Whether any session's break starts a new round.
     */
    public static boolean spansDays(List<Session> sessions, int thresholdMinutes) {
        for (Session session : sessions) {
            if (session.breakAfterMinutes() >= thresholdMinutes) {
                return true;
            }
        }
        return false;
    }
}
