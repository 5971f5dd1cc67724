package io.slot4j.core;

import java.time.Instant;
import java.util.List;

/**
 * One placement of every round, dates strictly increasing.
 */
public record MultiDayPlan(
        String id,
        List<RoundPlan> rounds,
        int totalRounds,
        List<String> participantIds
) {

    public MultiDayPlan {
        rounds = List.copyOf(rounds);
        participantIds = List.copyOf(participantIds);
    }

    public Instant start() {
        return rounds.get(0).combination().start();
    }

    /**
     * Mean of every density value across all rounds.
     */
    public double meanDensity() {
        double sum = 0;
        int count = 0;
        for (RoundPlan round : rounds) {
            for (double value : round.combination().loadDensity().values()) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? 0 : sum / count;
    }
}
