package io.slot4j.core;

import java.util.List;

/**
 * Result of {@code findSlots}: single-day combinations, or multi-day plans when the loop spans rounds.
 */
public record ScheduleResult(
        boolean multiDay,
        List<Combination> combinations,
        List<MultiDayPlan> plans,
        boolean truncated
) {

    public ScheduleResult {
        combinations = List.copyOf(combinations);
        plans = List.copyOf(plans);
    }

    public static ScheduleResult singleDay(SearchOutcome<Combination> outcome) {
        return new ScheduleResult(false, outcome.results(), List.of(), outcome.truncated());
    }

    public static ScheduleResult multiDay(SearchOutcome<MultiDayPlan> outcome) {
        return new ScheduleResult(true, List.of(), outcome.results(), outcome.truncated());
    }

    public int size() {
        return multiDay ? plans.size() : combinations.size();
    }
}
