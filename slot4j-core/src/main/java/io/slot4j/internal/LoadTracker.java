package io.slot4j.internal;

import io.slot4j.core.BusyInterval;
import io.slot4j.core.LimitType;
import io.slot4j.core.LoadCategory;
import io.slot4j.core.LoadInfo;
import io.slot4j.core.LoadLimit;
import io.slot4j.core.Participant;
import io.slot4j.core.PeriodLoad;
import io.slot4j.core.SearchOptions;
import io.slot4j.utils.IntervalMath;
import io.slot4j.utils.TimeChunk;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Exact daily and weekly load of a participant, including a proposed window.
 * <p>
 * Daily load counts busy intervals that start on the window's local date; weekly load uses the
 * Sunday-aligned local week. HOURS limits sum merged busy time, COUNT limits count intervals.
 */
public final class LoadTracker {
    /**
     * Weekly densities are compared in bands of {@code 1 / WEEKLY_BAND_WIDTH}.
     */
    private static final int WEEKLY_BAND_WIDTH = 10;

    private LoadTracker() {
    }

    public static LoadInfo calculate(Participant participant, Instant start, Instant end, List<BusyInterval> busy) {
        ZoneId zone = participant.timezone();
        LocalDate date = start.atZone(zone).toLocalDate();
        long proposedMinutes = Duration.between(start, end).toMinutes();

        LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        LocalDate weekEnd = weekStart.plusDays(7);

        List<BusyInterval> day = new ArrayList<>();
        List<BusyInterval> week = new ArrayList<>();
        for (BusyInterval interval : busy) {
            LocalDate eventDate = interval.start().atZone(zone).toLocalDate();
            if (eventDate.equals(date)) {
                day.add(interval);
            }
            if (!eventDate.isBefore(weekStart) && eventDate.isBefore(weekEnd)) {
                week.add(interval);
            }
        }

        return new LoadInfo(
                periodLoad(participant.limits().daily(), day, proposedMinutes),
                periodLoad(participant.limits().weekly(), week, proposedMinutes)
        );
    }

    /**
     * Whether the load breaks a limit the options enforce. A density of exactly 1.0 is still allowed.
     */
    public static boolean wouldExceedLimits(LoadInfo loadInfo, SearchOptions options) {
        if (options.respectDailyLimits() && loadInfo.daily().density() > 1.0) {
            return true;
        }
        return options.respectWeeklyLimits() && loadInfo.weekly().density() > 1.0;
    }

    public static LoadCategory category(double density) {
        return LoadCategory.of(density);
    }

    /**
     * Participants by ascending load: weekly density in 0.1-wide bands first, daily density within
     * a band. Participants without load info go last in their input order.
     */
    public static List<Participant> sortByLoad(List<Participant> participants, Map<String, LoadInfo> loads) {
        List<Participant> sorted = new ArrayList<>(participants);
        sorted.sort(byLoad(loads));
        return sorted;
    }

    private static Comparator<Participant> byLoad(Map<String, LoadInfo> loads) {
        // List.sort is stable, so equal keys keep their input order
        return Comparator.<Participant>comparingInt(p -> loads.containsKey(p.id()) ? 0 : 1)
                .thenComparingLong(p -> weeklyBand(loads.get(p.id())))
                .thenComparingDouble(p -> dailyDensity(loads.get(p.id())));
    }

    /* ================= helper ================= */

    private static long weeklyBand(LoadInfo load) {
        return load == null ? 0 : (long) Math.floor(load.weekly().density() * WEEKLY_BAND_WIDTH);
    }

    private static double dailyDensity(LoadInfo load) {
        return load == null ? 0 : load.daily().density();
    }

    private static PeriodLoad periodLoad(LoadLimit limit, List<BusyInterval> intervals, long proposedMinutes) {
        double current;
        if (limit.type() == LimitType.HOURS) {
            List<TimeChunk> chunks = new ArrayList<>(intervals.size());
            for (BusyInterval interval : intervals) {
                chunks.add(TimeChunk.of(interval.start(), interval.end()));
            }
            current = (IntervalMath.totalMinutes(chunks) + proposedMinutes) / 60.0;
        } else {
            current = intervals.size() + 1;
        }
        return PeriodLoad.of(current, limit.max());
    }
}
