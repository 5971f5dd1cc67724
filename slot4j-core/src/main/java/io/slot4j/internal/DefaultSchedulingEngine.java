package io.slot4j.internal;

import io.slot4j.BusyIntervalProvider;
import io.slot4j.SchedulingEngine;
import io.slot4j.SearchRequest;
import io.slot4j.core.AlgorithmException;
import io.slot4j.core.BusySnapshot;
import io.slot4j.core.CandidateAvailability;
import io.slot4j.core.Combination;
import io.slot4j.core.DateRange;
import io.slot4j.core.EngineConfig;
import io.slot4j.core.MultiDayPlan;
import io.slot4j.core.OverlapType;
import io.slot4j.core.Participant;
import io.slot4j.core.PlacedSlot;
import io.slot4j.core.Round;
import io.slot4j.core.RoundPlan;
import io.slot4j.core.ScheduleResult;
import io.slot4j.core.SchedulingException;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import io.slot4j.core.Session;
import io.slot4j.core.TimeRange;
import io.slot4j.core.ValidationException;
import io.slot4j.core.VerificationResult;
import io.slot4j.utils.IntervalMath;
import io.slot4j.utils.TimeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SchedulingEngine backed by in-memory depth-first search.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (SchedulingEngine engine = new DefaultSchedulingEngine(EngineConfig.defaults(), calendar)) {
 *     ScheduleResult result = engine.findSlots(SearchRequest.builder()
 *             .session(Session.of("screen", 45, 15, 1, 1))
 *             .session(Session.of("onsite", 60, 0, 2, 2))
 *             .participants(team)
 *             .dateRange(LocalDate.parse("2024-01-08"), LocalDate.parse("2024-01-12"))
 *             .build());
 * }
 * }</pre>
 *
 * <p>Busy intervals are fetched once per call, before searching. With {@code parallelism > 1} the
 * dates of a call are searched on a shared pool of daemon threads; results are identical to a
 * single-threaded run.
 */
public class DefaultSchedulingEngine implements SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultSchedulingEngine.class);

    private final EngineConfig config;
    private final BusyIntervalProvider busyIntervals;

    private final Object poolLock = new Object();
    private ExecutorService workerPool;
    private boolean closed;

    public DefaultSchedulingEngine(EngineConfig config, BusyIntervalProvider busyIntervals) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.busyIntervals = Objects.requireNonNull(busyIntervals, "busyIntervals must not be null");
    }

    public DefaultSchedulingEngine(BusyIntervalProvider busyIntervals) {
        this(EngineConfig.defaults(), busyIntervals);
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public ScheduleResult findSlots(SearchRequest request) {
        validate(request);
        SearchOptions options = resolve(request.options());
        boolean multiDay = RoundGrouper.spansDays(request.sessions(), config.dayThresholdMinutes());

        log.info("Finding slots sessions={} participants={} range={}..{} multiDay={}",
                request.sessions().size(), request.participants().size(),
                request.dateRange().start(), request.dateRange().end(), multiDay);

        try {
            BusySnapshot busy = snapshot(request, options);
            ScheduleResult result = multiDay
                    ? ScheduleResult.multiDay(searchMultiDay(request, options, busy))
                    : ScheduleResult.singleDay(searchSingleDay(request.sessions(), request.participants(),
                    request.dateRange().dates(), options, busy));
            log.info("Found slots count={} multiDay={} truncated={}", result.size(), multiDay, result.truncated());
            return result;
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to find slots: " + e.getMessage(), e);
        }
    }

    @Override
    public SearchOutcome<Combination> findSlotsForDate(List<Session> sessions,
                                                       List<Participant> participants,
                                                       LocalDate date,
                                                       SearchOptions options) {
        SearchRequest request = SearchRequest.builder()
                .sessions(sessions)
                .participants(participants)
                .dateRange(date == null ? null : DateRange.single(date))
                .options(options)
                .build();
        validate(request);
        SearchOptions resolved = resolve(options);

        try {
            BusySnapshot busy = snapshot(request, resolved);
            return searchSingleDay(request.sessions(), request.participants(), List.of(date), resolved, busy);
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to find slots: " + e.getMessage(), e);
        }
    }

    @Override
    public SearchOutcome<MultiDayPlan> findMultiDaySlots(SearchRequest request) {
        validate(request);
        SearchOptions options = resolve(request.options());

        log.info("Finding multi-day slots sessions={} participants={} range={}..{}",
                request.sessions().size(), request.participants().size(),
                request.dateRange().start(), request.dateRange().end());

        try {
            BusySnapshot busy = snapshot(request, options);
            SearchOutcome<MultiDayPlan> outcome = searchMultiDay(request, options, busy);
            log.info("Found multi-day plans count={} truncated={}", outcome.size(), outcome.truncated());
            return outcome;
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to find slots: " + e.getMessage(), e);
        }
    }

    @Override
    public VerificationResult verify(Combination combination, List<Participant> participants, SearchOptions options) {
        Objects.requireNonNull(combination, "combination must not be null");
        return verifySlots(combination.slots(), DateRange.single(combination.date()), participants, resolve(options));
    }

    @Override
    public VerificationResult verify(MultiDayPlan plan, List<Participant> participants, SearchOptions options) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (plan.rounds().isEmpty()) {
            throw new ValidationException("Plan has no rounds: " + plan.id());
        }
        List<PlacedSlot> slots = new ArrayList<>();
        for (RoundPlan round : plan.rounds()) {
            slots.addAll(round.combination().slots());
        }
        DateRange range = DateRange.of(plan.rounds().get(0).date(), plan.rounds().get(plan.rounds().size() - 1).date());
        return verifySlots(slots, range, participants, resolve(options));
    }

    @Override
    public SearchOutcome<Combination> findSlotsWithinAvailability(CandidateAvailability availability,
                                                                  List<Session> sessions,
                                                                  List<Participant> participants,
                                                                  SearchOptions options) {
        Objects.requireNonNull(availability, "availability must not be null");
        if (availability.days().isEmpty()) {
            return SearchOutcome.complete(List.of());
        }

        List<CandidateAvailability.Day> days = availability.days();
        SearchRequest request = SearchRequest.builder()
                .sessions(sessions)
                .participants(participants)
                .dateRange(days.get(0).date(), days.get(days.size() - 1).date())
                .options(options)
                .build();
        validate(request);
        SearchOptions resolved = resolve(options);

        Map<LocalDate, List<TimeRange>> rangesByDate = new LinkedHashMap<>();
        for (CandidateAvailability.Day day : days) {
            rangesByDate.computeIfAbsent(day.date(), d -> new ArrayList<>()).addAll(day.ranges());
        }

        try {
            BusySnapshot busy = snapshot(request, resolved);
            SearchBudget budget = SearchBudget.start(resolved, this::nowInstant);
            SingleDaySearch search = newSingleDaySearch(request.sessions(), request.participants(), resolved, busy, budget);

            List<Combination> found = DateFanOut.collect(
                    new ArrayList<>(rangesByDate.keySet()),
                    date -> withinRanges(search.search(date).results(), availability, rangesByDate.get(date)),
                    resolved.maxResults(),
                    workers());
            List<Combination> ranked = ResultRanker.rankCombinations(found, resolved.balanceLoad());
            log.info("Found slots within candidate availability count={} dates={}", ranked.size(), rangesByDate.size());
            return new SearchOutcome<>(ranked, budget.isExhausted());
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to find slots: " + e.getMessage(), e);
        }
    }

    /**
     * Stop the worker pool, if one was started. Idempotent.
     */
    @Override
    public void close() {
        ExecutorService pool;
        synchronized (poolLock) {
            if (closed) {
                return;
            }
            closed = true;
            pool = workerPool;
            workerPool = null;
        }
        if (pool == null) {
            return;
        }

        log.info("Scheduling engine stopping...");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
        log.info("Scheduling engine stopped.");
    }

    /**
     * Utility: current time source of search budgets (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /* ================= search ================= */

    private SearchOutcome<Combination> searchSingleDay(List<Session> sessions,
                                                       List<Participant> participants,
                                                       List<LocalDate> dates,
                                                       SearchOptions options,
                                                       BusySnapshot busy) {
        SearchBudget budget = SearchBudget.start(options, this::nowInstant);
        SingleDaySearch search = newSingleDaySearch(sessions, participants, options, busy, budget);

        List<Combination> found = DateFanOut.collect(dates, date -> search.search(date).results(),
                options.maxResults(), workers());
        List<Combination> ranked = ResultRanker.rankCombinations(found, options.balanceLoad());
        return new SearchOutcome<>(ranked, budget.isExhausted());
    }

    private SearchOutcome<MultiDayPlan> searchMultiDay(SearchRequest request, SearchOptions options, BusySnapshot busy) {
        List<Round> rounds = RoundGrouper.group(request.sessions(), config.dayThresholdMinutes());
        log.debug("Grouped sessions={} into rounds={}", request.sessions().size(), rounds.size());

        SearchBudget budget = SearchBudget.start(options, this::nowInstant);
        MultiDaySearch search = new MultiDaySearch(rounds, request.participants(), busy, options,
                config.zone(), config.dayStartTime(), config.dayThresholdMinutes(), budget);

        LocalDate rangeEnd = request.dateRange().end();
        List<MultiDayPlan> found = DateFanOut.collect(request.dateRange().dates(),
                date -> search.collectStartingOn(date, rangeEnd, options.maxResults()),
                options.maxResults(), workers());
        List<MultiDayPlan> ranked = ResultRanker.rankPlans(found, options.balanceLoad());
        return new SearchOutcome<>(ranked, budget.isExhausted());
    }

    private SingleDaySearch newSingleDaySearch(List<Session> sessions, List<Participant> participants,
                                               SearchOptions options, BusySnapshot busy, SearchBudget budget) {
        return new SingleDaySearch(sessions, participants, busy, options, config.zone(), config.dayStartTime(), budget);
    }

    private VerificationResult verifySlots(List<PlacedSlot> slots, DateRange range,
                                           List<Participant> participants, SearchOptions options) {
        Map<String, Participant> byId = new LinkedHashMap<>();
        if (participants != null) {
            for (Participant participant : participants) {
                byId.put(participant.id(), participant);
            }
        }
        try {
            BusySnapshot busy = BusySnapshot.of(busyIntervals.fetch(byId.values(), fetchRange(range, options)));
            VerificationResult result = SlotVerifier.verify(slots, byId, busy, options);
            log.debug("Verified slots={} available={} conflicts={}", slots.size(), result.available(), result.conflicts().size());
            return result;
        } catch (SchedulingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to verify slots: " + e.getMessage(), e);
        }
    }

    /**
     * Keep combinations whose every slot lies inside one of the candidate's ranges on that date.
     */
    private static List<Combination> withinRanges(List<Combination> combinations,
                                                  CandidateAvailability availability,
                                                  List<TimeRange> ranges) {
        List<Combination> kept = new ArrayList<>();
        for (Combination combination : combinations) {
            if (fitsCandidate(combination, availability, ranges)) {
                kept.add(combination);
            }
        }
        return kept;
    }

    private static boolean fitsCandidate(Combination combination, CandidateAvailability availability, List<TimeRange> ranges) {
        for (PlacedSlot slot : combination.slots()) {
            if (!slot.start().atZone(availability.zone()).toLocalDate().equals(combination.date())) {
                return false;
            }
            long start = IntervalMath.minuteOfDay(slot.start(), availability.zone());
            TimeChunk window = TimeChunk.of(start, start + slot.minutes());

            boolean inside = false;
            for (TimeRange range : ranges) {
                OverlapType type = IntervalMath.classify(window, TimeChunk.of(range.startMinute(), range.endMinute()));
                if (type == OverlapType.EXACT || type == OverlapType.ENCLOSED) {
                    inside = true;
                    break;
                }
            }
            if (!inside) {
                return false;
            }
        }
        return true;
    }

    /* ================= helper ================= */

    private SearchOptions resolve(SearchOptions options) {
        return options == null ? config.defaultOptions() : options;
    }

    private BusySnapshot snapshot(SearchRequest request, SearchOptions options) {
        if (request.busySnapshot() != null) {
            return request.busySnapshot();
        }
        if (!options.checkBusyIntervals() && !options.enforcesLoadLimits()) {
            return BusySnapshot.empty();
        }
        DateRange range = fetchRange(request.dateRange(), options);
        BusySnapshot busy = BusySnapshot.of(busyIntervals.fetch(request.participants(), range));
        log.debug("Busy snapshot participants={} range={}..{}", busy.participantIds().size(), range.start(), range.end());
        return busy;
    }

    /**
     * Weekly limits need the whole Sunday-aligned weeks around the searched dates.
     */
    private static DateRange fetchRange(DateRange range, SearchOptions options) {
        if (!options.respectWeeklyLimits()) {
            return range;
        }
        return DateRange.of(
                range.start().with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY)),
                range.end().with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY)));
    }

    private ExecutorService workers() {
        if (config.parallelism() <= 1) {
            return null;
        }
        synchronized (poolLock) {
            if (closed) {
                throw new IllegalStateException("Scheduling engine is closed");
            }
            if (workerPool == null) {
                AtomicInteger threadIndex = new AtomicInteger();
                workerPool = Executors.newFixedThreadPool(config.parallelism(), r -> {
                    Thread t = new Thread(r);
                    t.setName("slot4j.search-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
                log.info("Scheduling engine started worker pool parallelism={}", config.parallelism());
            }
            return workerPool;
        }
    }

    private static void validate(SearchRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.sessions().isEmpty()) {
            throw new ValidationException("At least one session is required");
        }
        if (request.participants().isEmpty()) {
            throw new ValidationException("At least one participant is required");
        }
        Set<String> participantIds = new HashSet<>();
        for (Participant participant : request.participants()) {
            if (!participantIds.add(participant.id())) {
                throw new ValidationException("Duplicate participant id: " + participant.id());
            }
        }
        DateRange range = request.dateRange();
        if (range == null || !range.isValid()) {
            throw new ValidationException("Invalid date range: " + range);
        }

        Set<String> ids = new HashSet<>();
        Set<Integer> orders = new HashSet<>();
        for (Session session : request.sessions()) {
            if (!ids.add(session.id())) {
                throw new ValidationException("Duplicate session id: " + session.id());
            }
            if (!orders.add(session.order())) {
                throw new ValidationException("Duplicate session order " + session.order() + " at session " + session.id());
            }
            if (session.durationMinutes() <= 0) {
                throw new AlgorithmException("Session " + session.id() + " must have a positive duration: " + session.durationMinutes());
            }
            if (session.breakAfterMinutes() < 0) {
                throw new AlgorithmException("Session " + session.id() + " has a negative break: " + session.breakAfterMinutes());
            }
            if (session.requiredCount() < 0) {
                throw new AlgorithmException("Session " + session.id() + " has a negative required count: " + session.requiredCount());
            }
        }
    }
}
