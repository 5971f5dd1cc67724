package io.slot4j.internal;

import io.slot4j.core.BusySnapshot;
import io.slot4j.core.Combination;
import io.slot4j.core.LoadLimit;
import io.slot4j.core.Participant;
import io.slot4j.core.ParticipantAssignment;
import io.slot4j.core.PlacedSlot;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import io.slot4j.core.Session;
import io.slot4j.core.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.slot4j.internal.Fixtures.MONDAY;
import static io.slot4j.internal.Fixtures.at;
import static io.slot4j.internal.Fixtures.busy;
import static io.slot4j.internal.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingleDaySearchTest {

    @Test
    void oneSessionOneFreeParticipantShouldStartAtDayStart() {
        SearchOutcome<Combination> outcome = search(
                List.of(Session.of("screen", 60, 0, 1, 1)),
                List.of(worker("alice")),
                BusySnapshot.empty(),
                SearchOptions.defaults());

        assertThat(outcome.results()).singleElement().satisfies(c -> {
            assertEquals(at("2024-01-01T09:00:00Z"), c.start());
            assertEquals(at("2024-01-01T10:00:00Z"), c.end());
            assertEquals(60, c.totalMinutes());
            assertEquals("2024-01-01:screen[alice]", c.id());
        });
        assertFalse(outcome.truncated());
    }

    @Test
    void unavailableMemberShouldEmptyTheWholePair() {
        Participant bob = Participant.builder("bob")
                .everyDay(TimeRange.of("09:00", "17:00"))
                .dayOff(MONDAY)
                .build();

        SearchOutcome<Combination> outcome = search(
                List.of(Session.of("panel", 60, 0, 2, 1)),
                List.of(worker("alice"), bob),
                BusySnapshot.empty(),
                SearchOptions.defaults());

        assertTrue(outcome.isEmpty());
    }

    @Test
    void nextSessionShouldStartAfterPreviousBreak() {
        SearchOutcome<Combination> outcome = search(
                List.of(Session.of("onsite", 60, 0, 1, 2), Session.of("screen", 45, 15, 1, 1)),
                List.of(worker("alice")),
                BusySnapshot.empty(),
                SearchOptions.defaults());

        Combination combination = outcome.results().get(0);
        PlacedSlot first = combination.slots().get(0);
        PlacedSlot second = combination.slots().get(1);

        assertEquals("screen", first.sessionId());
        assertEquals(first.end().plus(Duration.ofMinutes(15)), second.start());
        assertEquals(at("2024-01-01T10:00:00Z"), second.start());
        assertEquals(120, combination.totalMinutes());
    }

    @Test
    void dailyCountLimitShouldPruneOnlyWhenEnforced() {
        Participant alice = Participant.builder("alice")
                .everyDay(TimeRange.of("09:00", "17:00"))
                .limits(LoadLimit.count(1), LoadLimit.count(10))
                .build();
        BusySnapshot busy = BusySnapshot.of(Map.of("alice", List.of(busy("2024-01-01T07:00:00Z", "2024-01-01T07:30:00Z"))));
        List<Session> sessions = List.of(Session.of("screen", 60, 0, 1, 1));

        assertTrue(search(sessions, List.of(alice), busy, SearchOptions.defaults()).isEmpty());

        SearchOptions noDailyLimit = SearchOptions.builder().respectDailyLimits(false).build();
        assertEquals(1, search(sessions, List.of(alice), busy, noDailyLimit).size());
    }

    @Test
    void busyIntervalShouldPruneOverlappingWindow() {
        BusySnapshot busy = BusySnapshot.of(Map.of("alice", List.of(busy("2024-01-01T09:30:00Z", "2024-01-01T10:00:00Z"))));
        List<Session> sessions = List.of(Session.of("screen", 60, 0, 1, 1));

        assertTrue(search(sessions, List.of(worker("alice")), busy, SearchOptions.defaults()).isEmpty());

        SearchOptions ignoreCalendar = SearchOptions.builder().checkBusyIntervals(false).build();
        assertEquals(1, search(sessions, List.of(worker("alice")), busy, ignoreCalendar).size());
    }

    @Test
    void sharedParticipantSlotsShouldNeverOverlap() {
        List<Session> sessions = List.of(
                Session.of("s1", 60, 0, 1, 1),
                Session.of("s2", 30, 0, 2, 2),
                Session.of("s3", 45, 30, 1, 3)
        );

        SearchOutcome<Combination> outcome = search(sessions,
                List.of(worker("a"), worker("b"), worker("c")), BusySnapshot.empty(), SearchOptions.defaults());

        assertEquals(3 * 3 * 3, outcome.size());
        for (Combination combination : outcome.results()) {
            List<PlacedSlot> slots = combination.slots();
            for (int i = 0; i < slots.size(); i++) {
                for (int j = i + 1; j < slots.size(); j++) {
                    PlacedSlot x = slots.get(i);
                    PlacedSlot y = slots.get(j);
                    for (ParticipantAssignment assignment : x.assignments()) {
                        if (y.involves(assignment.participantId())) {
                            assertFalse(x.overlaps(y.start(), y.end()), combination.id());
                        }
                    }
                }
            }
        }
    }

    @Test
    void balancedRankingShouldPreferSpreadLoad() {
        List<Session> sessions = List.of(Session.of("s1", 60, 0, 1, 1), Session.of("s2", 60, 0, 1, 2));
        List<Participant> participants = List.of(worker("a"), worker("b"));

        SearchOutcome<Combination> balanced = search(sessions, participants, BusySnapshot.empty(), SearchOptions.defaults());
        assertThat(assignees(balanced)).containsExactly("a,b", "b,a", "a,a", "b,b");
        assertEquals(0.25, balanced.results().get(0).loadDensity().get("a"));
        assertEquals(0.5, balanced.results().get(2).loadDensity().get("a"));

        SearchOptions unbalanced = SearchOptions.builder().balanceLoad(false).build();
        assertThat(assignees(search(sessions, participants, BusySnapshot.empty(), unbalanced)))
                .containsExactly("a,a", "a,b", "b,a", "b,b");
    }

    @Test
    void shouldStopAtMaxResults() {
        List<Session> sessions = List.of(Session.of("s1", 60, 0, 1, 1), Session.of("s2", 60, 0, 1, 2));
        List<Participant> participants = List.of(worker("a"), worker("b"), worker("c"), worker("d"));

        SearchOutcome<Combination> outcome = search(sessions, participants, BusySnapshot.empty(),
                SearchOptions.builder().maxResults(5).build());

        assertEquals(5, outcome.size());
        assertFalse(outcome.truncated());
    }

    @Test
    void exhaustedStepBudgetShouldMarkOutcomeTruncated() {
        List<Session> sessions = List.of(Session.of("s1", 60, 0, 1, 1), Session.of("s2", 60, 0, 1, 2));
        List<Participant> participants = List.of(worker("a"), worker("b"), worker("c"), worker("d"));
        SearchOptions options = SearchOptions.builder().maxSteps(3).build();

        SingleDaySearch search = new SingleDaySearch(sessions, participants, BusySnapshot.empty(), options,
                ZoneOffset.UTC, LocalTime.of(9, 0), SearchBudget.start(options, Instant::now));
        SearchOutcome<Combination> outcome = search.search(MONDAY);

        assertTrue(outcome.truncated());
        assertEquals(2, outcome.size());
    }

    @Test
    void repeatedSearchShouldReturnIdenticalResults() {
        List<Session> sessions = List.of(Session.of("s1", 30, 10, 1, 1), Session.of("s2", 30, 0, 2, 2));
        List<Participant> participants = List.of(worker("a"), worker("b"), worker("c"));
        BusySnapshot busy = BusySnapshot.of(Map.of("b", List.of(busy("2024-01-01T09:40:00Z", "2024-01-01T09:50:00Z"))));

        SearchOutcome<Combination> first = search(sessions, participants, busy, SearchOptions.defaults());
        SearchOutcome<Combination> second = search(sessions, participants, busy, SearchOptions.defaults());

        assertEquals(first, second);
        assertFalse(first.isEmpty());
    }

    @Test
    void dayStartShouldBeAnchoredInEngineZone() {
        SingleDaySearch search = new SingleDaySearch(List.of(Session.of("screen", 60, 0, 1, 1)),
                List.of(Participant.builder("alice").timezone("Europe/Berlin").everyDay(TimeRange.of("08:00", "18:00")).build()),
                BusySnapshot.empty(), SearchOptions.defaults(),
                ZoneId.of("Europe/Berlin"), LocalTime.of(9, 0), SearchBudget.unlimited());

        assertEquals(at("2024-01-01T08:00:00Z"), search.search(MONDAY).results().get(0).start());
    }

    private static SearchOutcome<Combination> search(List<Session> sessions, List<Participant> participants,
                                                     BusySnapshot busy, SearchOptions options) {
        return new SingleDaySearch(sessions, participants, busy, options, ZoneOffset.UTC, LocalTime.of(9, 0),
                SearchBudget.unlimited()).search(MONDAY);
    }

    private static List<String> assignees(SearchOutcome<Combination> outcome) {
        return outcome.results().stream()
                .map(c -> c.slots().stream()
                        .map(s -> s.assignments().get(0).participantId())
                        .collect(Collectors.joining(",")))
                .toList();
    }
}
