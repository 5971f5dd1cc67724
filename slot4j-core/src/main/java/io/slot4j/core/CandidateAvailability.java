package io.slot4j.core;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Time ranges a candidate offered, per date, in the candidate's own zone.
 */
public record CandidateAvailability(ZoneId zone, List<Day> days) {

    public CandidateAvailability {
        Objects.requireNonNull(zone, "zone must not be null");
        days = days == null
                ? List.of()
                : days.stream().sorted(Comparator.comparing(Day::date)).toList();
    }

    public record Day(LocalDate date, List<TimeRange> ranges) {
        public Day {
            Objects.requireNonNull(date, "date must not be null");
            ranges = ranges == null ? List.of() : List.copyOf(ranges);
        }
    }
}
