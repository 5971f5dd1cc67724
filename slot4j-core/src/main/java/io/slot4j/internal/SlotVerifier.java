package io.slot4j.internal;

import io.slot4j.core.AvailabilityResult;
import io.slot4j.core.BusyInterval;
import io.slot4j.core.BusySnapshot;
import io.slot4j.core.Conflict;
import io.slot4j.core.ConflictKind;
import io.slot4j.core.LoadInfo;
import io.slot4j.core.Participant;
import io.slot4j.core.ParticipantAssignment;
import io.slot4j.core.PeriodLoad;
import io.slot4j.core.PlacedSlot;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.VerificationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Re-checks placed slots and reports every conflict instead of pruning.
 *
 * <p>Load info holds, per participant, the load of the last slot checked for them.
 */
public final class SlotVerifier {
    private SlotVerifier() {
    }

    public static VerificationResult verify(List<PlacedSlot> slots,
                                            Map<String, Participant> participants,
                                            BusySnapshot busy,
                                            SearchOptions options) {
        List<Conflict> conflicts = new ArrayList<>();
        Map<String, LoadInfo> loadInfo = new LinkedHashMap<>();

        for (int i = 0; i < slots.size(); i++) {
            PlacedSlot slot = slots.get(i);
            if (slot.assignments().isEmpty()) {
                conflicts.add(Conflict.of(ConflictKind.NO_PARTICIPANTS_AVAILABLE, null,
                        "No participants assigned to " + slot.sessionName()));
                continue;
            }

            for (ParticipantAssignment assignment : slot.assignments()) {
                String pid = assignment.participantId();
                Participant participant = participants.get(pid);
                if (participant == null) {
                    conflicts.add(Conflict.of(ConflictKind.NO_PARTICIPANTS_AVAILABLE, pid,
                            "Unknown participant " + pid + " in " + slot.sessionName()));
                    continue;
                }

                AvailabilityResult availability = AvailabilityEvaluator.evaluate(participant, slot.start(), slot.end(), options);
                conflicts.addAll(availability.conflicts());

                if (options.checkBusyIntervals()) {
                    for (BusyInterval interval : busy.overlapping(pid, slot.start(), slot.end())) {
                        conflicts.add(new Conflict(ConflictKind.CALENDAR_EVENT, pid, interval,
                                "Conflicts with " + describe(interval)));
                    }
                }

                for (int j = 0; j < i; j++) {
                    PlacedSlot earlier = slots.get(j);
                    if (earlier.involves(pid) && earlier.overlaps(slot.start(), slot.end())) {
                        conflicts.add(Conflict.of(ConflictKind.TIME_OVERLAP, pid,
                                slot.sessionName() + " overlaps " + earlier.sessionName() + " for " + participant.name()));
                    }
                }

                LoadInfo load = LoadTracker.calculate(participant, slot.start(), slot.end(), busy.forParticipant(pid));
                loadInfo.put(pid, load);
                if (options.respectDailyLimits() && load.daily().density() > 1.0) {
                    conflicts.add(Conflict.of(ConflictKind.DAILY_LIMIT, pid, "Daily limit exceeded " + format(load.daily())));
                }
                if (options.respectWeeklyLimits() && load.weekly().density() > 1.0) {
                    conflicts.add(Conflict.of(ConflictKind.WEEKLY_LIMIT, pid, "Weekly limit exceeded " + format(load.weekly())));
                }
            }
        }

        return new VerificationResult(conflicts.isEmpty(), conflicts, loadInfo);
    }

    private static String describe(BusyInterval interval) {
        String label = interval.label() == null ? "busy time" : interval.label();
        return label + " (" + interval.start() + " - " + interval.end() + ")";
    }

    private static String format(PeriodLoad load) {
        return String.format(Locale.ROOT, "(%.2f/%.2f)", load.current(), load.max());
    }
}
