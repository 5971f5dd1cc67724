package io.slot4j.internal;

import io.slot4j.core.Combination;
import io.slot4j.core.MultiDayPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering shared by both searches: earliest start first, then lowest mean load density.
 * Sorting is stable, so ties keep exploration order.
 */
public final class ResultRanker {
    private ResultRanker() {
    }

    public static Comparator<Combination> combinations(boolean balanceLoad) {
        Comparator<Combination> byStart = Comparator.comparing(Combination::start);
        return balanceLoad ? byStart.thenComparingDouble(Combination::meanDensity) : byStart;
    }

    public static Comparator<MultiDayPlan> plans(boolean balanceLoad) {
        Comparator<MultiDayPlan> byStart = Comparator.comparing(MultiDayPlan::start);
        return balanceLoad ? byStart.thenComparingDouble(MultiDayPlan::meanDensity) : byStart;
    }

    public static List<Combination> rankCombinations(List<Combination> results, boolean balanceLoad) {
        List<Combination> ranked = new ArrayList<>(results);
        ranked.sort(combinations(balanceLoad));
        return ranked;
    }

    public static List<MultiDayPlan> rankPlans(List<MultiDayPlan> results, boolean balanceLoad) {
        List<MultiDayPlan> ranked = new ArrayList<>(results);
        ranked.sort(plans(balanceLoad));
        return ranked;
    }
}
