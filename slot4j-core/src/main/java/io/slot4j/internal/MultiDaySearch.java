package io.slot4j.internal;

import io.slot4j.core.AlgorithmException;
import io.slot4j.core.BusySnapshot;
import io.slot4j.core.Combination;
import io.slot4j.core.DateRange;
import io.slot4j.core.MultiDayPlan;
import io.slot4j.core.Participant;
import io.slot4j.core.Round;
import io.slot4j.core.RoundPlan;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first placement of rounds on strictly increasing dates.
 *
 * <p>Round 0 may take any date of the range. Round {@code i > 0} may start no earlier than the
 * previous round's date plus {@code ceil(boundary.breakAfter / threshold)} days, where the boundary
 * session is the last session of round {@code i - 1}. A combination sharing any participant with an
 * earlier round is skipped.
 */
public final class MultiDaySearch {
    private static final Logger log = LoggerFactory.getLogger(MultiDaySearch.class);

    private final List<Round> rounds;
    private final List<SingleDaySearch> daySearches;
    private final int[] gapDays;
    private final SearchOptions options;
    private final SearchBudget budget;

    public MultiDaySearch(List<Round> rounds,
                          List<Participant> participants,
                          BusySnapshot busy,
                          SearchOptions options,
                          ZoneId zone,
                          LocalTime dayStart,
                          int thresholdMinutes,
                          SearchBudget budget) {
        if (rounds.isEmpty()) {
            throw new AlgorithmException("Multi-day search needs at least one round");
        }
        this.rounds = List.copyOf(rounds);
        this.options = options;
        this.budget = budget;

        this.daySearches = new ArrayList<>(rounds.size());
        this.gapDays = new int[rounds.size()];
        for (int i = 0; i < rounds.size(); i++) {
            Round round = rounds.get(i);
            daySearches.add(new SingleDaySearch(round.sessions(), participants, busy, options, zone, dayStart, budget));
            if (i > 0) {
                gapDays[i] = gapDays(rounds.get(i - 1), thresholdMinutes);
            }
        }
    }

    /**
     * Whole days between round {@code previous} and the round after it.
     *
     * @throws AlgorithmException when the next round could land on or before the previous date
     */
    static int gapDays(Round previous, int thresholdMinutes) {
        int breakAfter = previous.boundarySession().breakAfterMinutes();
        int days = (int) Math.ceil((double) breakAfter / thresholdMinutes);
        if (days < 1) {
            throw new AlgorithmException("Round " + (previous.index() + 1)
                    + " would start before round " + previous.index() + " ends (break " + breakAfter + " min)");
        }
        return days;
    }

    /**
     * Ranked plans over the whole range, at most {@code maxResults}.
     */
    public SearchOutcome<MultiDayPlan> search(DateRange range) {
        List<MultiDayPlan> out = new ArrayList<>();
        plan(0, range.start(), range.end(), new ArrayList<>(rounds.size()), out, options.maxResults());
        List<MultiDayPlan> ranked = ResultRanker.rankPlans(out, options.balanceLoad());
        return new SearchOutcome<>(ranked, budget.isExhausted());
    }

    /**
     * Unranked plans whose first round is on {@code firstDate}, at most {@code limit}. Exploring
     * every date of the range this way and concatenating in date order reproduces the exploration
     * order of {@link #search(DateRange)}.
     */
    public List<MultiDayPlan> collectStartingOn(LocalDate firstDate, LocalDate rangeEnd, int limit) {
        List<MultiDayPlan> out = new ArrayList<>();
        if (budget.tryStep()) {
            placeRound(0, firstDate, rangeEnd, new ArrayList<>(rounds.size()), out, limit);
        }
        return out;
    }

    /**
     * @return {@code false} once exploration must stop
     */
    private boolean plan(int roundIndex, LocalDate from, LocalDate to, List<RoundPlan> placed,
                         List<MultiDayPlan> out, int limit) {
        if (roundIndex == rounds.size()) {
            out.add(toPlan(placed));
            return out.size() < limit;
        }

        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            if (!budget.tryStep()) {
                return false;
            }
            if (!placeRound(roundIndex, date, to, placed, out, limit)) {
                return false;
            }
        }
        return true;
    }

    private boolean placeRound(int roundIndex, LocalDate date, LocalDate to, List<RoundPlan> placed,
                               List<MultiDayPlan> out, int limit) {
        Round round = rounds.get(roundIndex);
        List<Combination> candidates = daySearches.get(roundIndex).search(date).results();
        log.debug("Round {} on {} candidates={}", roundIndex, date, candidates.size());

        Set<String> earlier = participantsOf(placed);
        for (Combination combination : candidates) {
            if (!budget.tryStep()) {
                return false;
            }
            if (sharesParticipant(combination, earlier)) {
                continue;
            }

            int next = roundIndex + 1;
            LocalDate nextFrom = next < rounds.size() ? date.plusDays(gapDays[next]) : date;

            placed.add(new RoundPlan(roundIndex, date, combination, round.sessions()));
            boolean keepGoing = plan(next, nextFrom, to, placed, out, limit);
            placed.remove(placed.size() - 1);

            if (!keepGoing || out.size() >= limit) {
                return false;
            }
        }
        return true;
    }

    /* ================= helper ================= */

    private static Set<String> participantsOf(List<RoundPlan> placed) {
        Set<String> ids = new HashSet<>();
        for (RoundPlan roundPlan : placed) {
            ids.addAll(roundPlan.combination().participantIds());
        }
        return ids;
    }

    private static boolean sharesParticipant(Combination combination, Set<String> earlier) {
        if (earlier.isEmpty()) {
            return false;
        }
        for (String id : combination.participantIds()) {
            if (earlier.contains(id)) {
                return true;
            }
        }
        return false;
    }

    private MultiDayPlan toPlan(List<RoundPlan> placed) {
        Set<String> participantIds = new LinkedHashSet<>();
        StringBuilder id = new StringBuilder("plan");
        for (RoundPlan roundPlan : placed) {
            participantIds.addAll(roundPlan.combination().participantIds());
            id.append(':').append(roundPlan.combination().id());
        }
        return new MultiDayPlan(id.toString(), placed, rounds.size(), new ArrayList<>(participantIds));
    }
}
