package io.slot4j;

import io.slot4j.core.CandidateAvailability;
import io.slot4j.core.Combination;
import io.slot4j.core.MultiDayPlan;
import io.slot4j.core.Participant;
import io.slot4j.core.ScheduleResult;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import io.slot4j.core.Session;
import io.slot4j.core.VerificationResult;

import java.time.LocalDate;
import java.util.List;

/**
 * Main slot search API.
 *
 * <p>Supports two search styles:
 * <ul>
 *   <li>Single-day: every session on one date, tried for each date of the range</li>
 *   <li>Multi-day: sessions split into rounds by long breaks, each round on its own date</li>
 * </ul>
 *
 * <p>Searches never throw for constraint violations; those only prune results. A
 * {@link io.slot4j.core.ValidationException} or {@link io.slot4j.core.AlgorithmException} is raised
 * before searching when the input itself is unusable.
 */
public interface SchedulingEngine extends AutoCloseable {

    /**
     * Search the request's date range, choosing multi-day planning when any session's break
     * reaches the day threshold.
     */
    ScheduleResult findSlots(SearchRequest request);

    /**
     * Single-day search on exactly one date. A {@code null} options value means the engine defaults.
     */
    SearchOutcome<Combination> findSlotsForDate(List<Session> sessions,
                                                List<Participant> participants,
                                                LocalDate date,
                                                SearchOptions options);

    /**
     * Multi-day search regardless of session breaks (a loop without long breaks is one round).
     */
    SearchOutcome<MultiDayPlan> findMultiDaySlots(SearchRequest request);

    /**
     * Re-check a combination against fresh busy data.
     */
    VerificationResult verify(Combination combination, List<Participant> participants, SearchOptions options);

    /**
     * Re-check every round of a plan against fresh busy data.
     */
    VerificationResult verify(MultiDayPlan plan, List<Participant> participants, SearchOptions options);

    /**
     * Single-day search limited to the dates and time ranges a candidate offered.
     */
    SearchOutcome<Combination> findSlotsWithinAvailability(CandidateAvailability availability,
                                                           List<Session> sessions,
                                                           List<Participant> participants,
                                                           SearchOptions options);

    /**
     * Release worker threads, if any. Idempotent.
     */
    @Override
    void close();
}
