package io.slot4j.internal;

import io.slot4j.core.BusyInterval;
import io.slot4j.core.Participant;
import io.slot4j.core.TimeRange;

import java.time.Instant;
import java.time.LocalDate;

final class Fixtures {
    // a Monday
    static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);

    private Fixtures() {
    }

    static Participant worker(String id) {
        return Participant.builder(id).everyDay(TimeRange.of("09:00", "17:00")).build();
    }

    static Instant at(String isoInstant) {
        return Instant.parse(isoInstant);
    }

    static BusyInterval busy(String start, String end) {
        return BusyInterval.of("meeting", Instant.parse(start), Instant.parse(end));
    }
}
