package io.slot4j.internal;

import io.slot4j.core.BusySnapshot;
import io.slot4j.core.Combination;
import io.slot4j.core.LoadInfo;
import io.slot4j.core.Participant;
import io.slot4j.core.ParticipantAssignment;
import io.slot4j.core.PlacedSlot;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import io.slot4j.core.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first placement of every session on one date.
 *
 * <p>Session {@code i} starts at the day start for {@code i == 0}, otherwise at the end of slot
 * {@code i - 1} plus the break of session {@code i - 1}. Participant subsets are tried in
 * generation order; a slot is kept only when every assigned participant passes availability,
 * busy time and load checks.
 *
 * <p>Instances are immutable and may search several dates concurrently; all mutable state lives
 * on the stack of a single {@link #collect(LocalDate, int)} call.
 */
public final class SingleDaySearch {
    private static final Logger log = LoggerFactory.getLogger(SingleDaySearch.class);

    /**
     * Slots a participant is expected to take per day; the fast density divides by this.
     */
    static final int TYPICAL_SLOT_CAPACITY = 4;

    private final List<Session> sessions;
    private final List<List<List<Participant>>> subsetsBySession;
    private final BusySnapshot busy;
    private final SearchOptions options;
    private final ZoneId zone;
    private final LocalTime dayStart;
    private final SearchBudget budget;

    public SingleDaySearch(List<Session> sessions,
                           List<Participant> participants,
                           BusySnapshot busy,
                           SearchOptions options,
                           ZoneId zone,
                           LocalTime dayStart,
                           SearchBudget budget) {
        List<Session> sorted = new ArrayList<>(sessions);
        sorted.sort(Comparator.comparingInt(Session::order));
        this.sessions = List.copyOf(sorted);

        List<List<List<Participant>>> subsets = new ArrayList<>(sorted.size());
        for (Session session : sorted) {
            subsets.add(CombinationGenerator.forSession(session, participants, options));
        }
        this.subsetsBySession = subsets;
        this.busy = busy;
        this.options = options;
        this.zone = zone;
        this.dayStart = dayStart;
        this.budget = budget;
    }

    /**
     * Ranked combinations for the date, at most {@code maxResults}.
     */
    public SearchOutcome<Combination> search(LocalDate date) {
        List<Combination> found = collect(date, options.maxResults());
        List<Combination> ranked = ResultRanker.rankCombinations(found, options.balanceLoad());
        return new SearchOutcome<>(ranked, budget.isExhausted());
    }

    /**
     * Unranked combinations in exploration order, at most {@code limit}.
     */
    public List<Combination> collect(LocalDate date, int limit) {
        List<Combination> out = new ArrayList<>();
        if (sessions.isEmpty() || limit <= 0) {
            return out;
        }
        Instant first = date.atTime(dayStart).atZone(zone).toInstant();
        place(date, 0, first, new ArrayList<>(sessions.size()), out, limit);
        log.debug("Single-day search date={} sessions={} results={} exhausted={}",
                date, sessions.size(), out.size(), budget.isExhausted());
        return out;
    }

    /**
     * @return {@code false} once exploration must stop (result cap reached or budget exhausted)
     */
    private boolean place(LocalDate date, int index, Instant start, List<PlacedSlot> placed,
                          List<Combination> out, int limit) {
        if (index == sessions.size()) {
            out.add(toCombination(date, placed));
            return out.size() < limit;
        }

        Session session = sessions.get(index);
        Instant end = start.plus(Duration.ofMinutes(session.durationMinutes()));

        for (List<Participant> subset : subsetsBySession.get(index)) {
            if (!budget.tryStep()) {
                return false;
            }
            if (!accepts(subset, start, end, placed)) {
                continue;
            }

            placed.add(toSlot(session, start, end, subset));
            Instant next = end.plus(Duration.ofMinutes(session.breakAfterMinutes()));
            boolean keepGoing = place(date, index + 1, next, placed, out, limit);
            placed.remove(placed.size() - 1);

            if (!keepGoing) {
                return false;
            }
        }
        return true;
    }

    private boolean accepts(List<Participant> subset, Instant start, Instant end, List<PlacedSlot> placed) {
        for (Participant participant : subset) {
            if (!AvailabilityEvaluator.evaluate(participant, start, end, options).available()) {
                return false;
            }
            if (options.checkBusyIntervals() && !busy.overlapping(participant.id(), start, end).isEmpty()) {
                return false;
            }
            // a participant can never hold two overlapping slots of the same combination
            for (PlacedSlot slot : placed) {
                if (slot.involves(participant.id()) && slot.overlaps(start, end)) {
                    return false;
                }
            }
            if (options.enforcesLoadLimits()) {
                LoadInfo load = LoadTracker.calculate(participant, start, end, busy.forParticipant(participant.id()));
                if (LoadTracker.wouldExceedLimits(load, options)) {
                    return false;
                }
            }
        }
        return true;
    }

    /* ================= helper ================= */

    private static PlacedSlot toSlot(Session session, Instant start, Instant end, List<Participant> subset) {
        List<ParticipantAssignment> assignments = new ArrayList<>(subset.size());
        for (Participant participant : subset) {
            assignments.add(ParticipantAssignment.of(participant));
        }
        return new PlacedSlot(session.id(), session.name(), start, end, assignments);
    }

    static Combination toCombination(LocalDate date, List<PlacedSlot> placed) {
        List<PlacedSlot> slots = List.copyOf(placed);
        Instant start = slots.get(0).start();
        Instant end = slots.get(slots.size() - 1).end();
        return new Combination(
                combinationId(date, slots),
                date,
                slots,
                start,
                end,
                Duration.between(start, end).toMinutes(),
                fastDensity(slots)
        );
    }

    /**
     * Assigned slot count per participant over {@link #TYPICAL_SLOT_CAPACITY}.
     */
    static Map<String, Double> fastDensity(List<PlacedSlot> slots) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PlacedSlot slot : slots) {
            for (ParticipantAssignment assignment : slot.assignments()) {
                counts.merge(assignment.participantId(), 1, Integer::sum);
            }
        }
        Map<String, Double> density = new LinkedHashMap<>();
        counts.forEach((id, count) -> density.put(id, (double) count / TYPICAL_SLOT_CAPACITY));
        return density;
    }

    /**
     * e.g. {@code 2024-01-01:screen[p1+p2]|onsite[p3]}
     */
    static String combinationId(LocalDate date, List<PlacedSlot> slots) {
        StringBuilder id = new StringBuilder(date.toString()).append(':');
        for (int i = 0; i < slots.size(); i++) {
            PlacedSlot slot = slots.get(i);
            if (i > 0) {
                id.append('|');
            }
            id.append(slot.sessionId()).append('[');
            List<ParticipantAssignment> assignments = slot.assignments();
            for (int j = 0; j < assignments.size(); j++) {
                if (j > 0) {
                    id.append('+');
                }
                id.append(assignments.get(j).participantId());
            }
            id.append(']');
        }
        return id.toString();
    }
}
