package io.slot4j.core;

import java.util.List;

/**
 * Ranked results of one search.
 *
 * @param truncated {@code true} when the time or step budget ran out before the search finished;
 *                  the results are then a partial list
 */
public record SearchOutcome<T>(List<T> results, boolean truncated) {

    public SearchOutcome {
        results = List.copyOf(results);
    }

    public static <T> SearchOutcome<T> complete(List<T> results) {
        return new SearchOutcome<>(results, false);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }
}
