package io.slot4j.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of calendar dates.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange of(String start, String end) {
        return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    public static DateRange single(LocalDate date) {
        return new DateRange(date, date);
    }

    public boolean isValid() {
        return start != null && end != null && !end.isBefore(start);
    }

    /**
     * Dates from start to end inclusive, one per day.
     */
    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }
}
