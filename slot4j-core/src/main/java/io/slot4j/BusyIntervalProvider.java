package io.slot4j;

import io.slot4j.core.BusyInterval;
import io.slot4j.core.DateRange;
import io.slot4j.core.Participant;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Source of participants' external commitments (calendars and the like).
 *
 * <p>The engine calls this once per search, before searching, and freezes the answer.
 * A missing participant id in the returned map means "no known busy time".
 */
@FunctionalInterface
public interface BusyIntervalProvider {

    Map<String, List<BusyInterval>> fetch(Collection<Participant> participants, DateRange range);

    /**
     * Provider that knows of no busy time.
     */
    static BusyIntervalProvider none() {
        return (participants, range) -> Map.of();
    }
}
