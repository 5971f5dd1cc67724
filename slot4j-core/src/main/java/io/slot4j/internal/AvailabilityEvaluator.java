package io.slot4j.internal;

import io.slot4j.core.AvailabilityResult;
import io.slot4j.core.BlockedRange;
import io.slot4j.core.Conflict;
import io.slot4j.core.ConflictKind;
import io.slot4j.core.Holiday;
import io.slot4j.core.Participant;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.TimeRange;
import io.slot4j.utils.IntervalMath;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a participant can take a window, reporting every reason when not.
 *
 * <p>Work hours, holidays and day-offs are evaluated in the participant's timezone.
 */
public final class AvailabilityEvaluator {
    private AvailabilityEvaluator() {
    }

    public static AvailabilityResult evaluate(Participant participant, Instant start, Instant end, SearchOptions options) {
        List<Conflict> conflicts = new ArrayList<>();
        LocalDate date = start.atZone(participant.timezone()).toLocalDate();

        if (options.respectWorkHours()) {
            Conflict c = checkWorkHours(participant, start, end);
            if (c != null) conflicts.add(c);
        }
        if (options.respectHolidays()) {
            Conflict c = checkHolidays(participant, date);
            if (c != null) conflicts.add(c);
        }
        if (options.respectDayOffs()) {
            Conflict c = checkDayOffs(participant, date);
            if (c != null) conflicts.add(c);
        }
        if (options.excludeBlockedTimes()) {
            Conflict c = checkBlockedTimes(participant, start, end);
            if (c != null) conflicts.add(c);
        }

        return AvailabilityResult.of(conflicts);
    }

    static Conflict checkWorkHours(Participant participant, Instant start, Instant end) {
        DayOfWeek day = start.atZone(participant.timezone()).getDayOfWeek();
        TimeRange range = participant.workHours().get(day);
        String dayName = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);

        if (range == null) {
            return Conflict.of(ConflictKind.WORK_HOURS, participant.id(),
                    participant.name() + " does not work on " + dayName);
        }

        // end minute is measured from the start's midnight so windows past midnight fall outside
        long startMinute = IntervalMath.minuteOfDay(start, participant.timezone());
        long endMinute = startMinute + Duration.between(start, end).toMinutes();

        if (startMinute < range.startMinute() || endMinute > range.endMinute()) {
            return Conflict.of(ConflictKind.WORK_HOURS, participant.id(),
                    "Outside work hours (" + range + ") on " + dayName);
        }
        return null;
    }

    static Conflict checkHolidays(Participant participant, LocalDate date) {
        for (Holiday holiday : participant.holidays()) {
            if (holiday.date().equals(date)) {
                return Conflict.of(ConflictKind.HOLIDAY, participant.id(), "Holiday: " + holiday.name());
            }
        }
        return null;
    }

    static Conflict checkDayOffs(Participant participant, LocalDate date) {
        if (participant.dayOffs().contains(date)) {
            return Conflict.of(ConflictKind.DAY_OFF, participant.id(), "Day off for " + participant.name());
        }
        return null;
    }

    static Conflict checkBlockedTimes(Participant participant, Instant start, Instant end) {
        for (BlockedRange blocked : participant.blockedTimes()) {
            if (blocked.overlaps(start, end)) {
                return Conflict.of(ConflictKind.RECRUITING_BLOCK, participant.id(),
                        "Overlaps with blocked time (" + blocked.start() + " - " + blocked.end() + ")");
            }
        }
        return null;
    }
}
