package io.slot4j.internal;

import io.slot4j.core.AlgorithmException;
import io.slot4j.core.BusySnapshot;
import io.slot4j.core.DateRange;
import io.slot4j.core.MultiDayPlan;
import io.slot4j.core.Participant;
import io.slot4j.core.Round;
import io.slot4j.core.RoundPlan;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.SearchOutcome;
import io.slot4j.core.Session;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static io.slot4j.internal.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiDaySearchTest {

    private static final DateRange MON_TO_WED = DateRange.of("2024-01-01", "2024-01-03");

    @Test
    void secondRoundShouldNeverShareTheFirstRoundDate() {
        List<Session> sessions = List.of(Session.of("s1", 60, 1440, 1, 1), Session.of("s2", 60, 0, 1, 2));

        SearchOutcome<MultiDayPlan> outcome = search(sessions, List.of(worker("a"), worker("b")), MON_TO_WED);

        assertEquals(6, outcome.size());
        for (MultiDayPlan plan : outcome.results()) {
            assertEquals(2, plan.totalRounds());
            assertTrue(plan.rounds().get(1).date().isAfter(plan.rounds().get(0).date()), plan.id());
        }
        assertThat(outcome.results().get(0).participantIds()).containsExactly("a", "b");
        assertEquals(LocalDate.of(2024, 1, 2), outcome.results().get(0).rounds().get(1).date());
    }

    @Test
    void gapShouldCoverTheWholeBoundaryBreak() {
        List<Session> sessions = List.of(Session.of("s1", 60, 2880, 1, 1), Session.of("s2", 60, 0, 1, 2));

        SearchOutcome<MultiDayPlan> outcome = search(sessions, List.of(worker("a"), worker("b")),
                DateRange.of("2024-01-01", "2024-01-04"));

        assertThat(outcome.results()).isNotEmpty();
        for (MultiDayPlan plan : outcome.results()) {
            List<RoundPlan> rounds = plan.rounds();
            assertThat(ChronoUnit.DAYS.between(rounds.get(0).date(), rounds.get(1).date())).isGreaterThanOrEqualTo(2);
        }
    }

    @Test
    void gapShouldRoundPartialDaysUp() {
        // 36h break with a 24h threshold needs two calendar days
        Round first = new Round(0, List.of(Session.of("s1", 60, 2160, 1, 1)));
        assertEquals(2, MultiDaySearch.gapDays(first, 1440));
    }

    @Test
    void gapShorterThanADayShouldBeRejected() {
        Round first = new Round(0, List.of(Session.of("s1", 60, 0, 1, 1)));
        assertThatThrownBy(() -> MultiDaySearch.gapDays(first, 1440)).isInstanceOf(AlgorithmException.class);
    }

    @Test
    void participantShouldNotBeReusedAcrossRounds() {
        List<Session> sessions = List.of(Session.of("s1", 60, 1440, 1, 1), Session.of("s2", 60, 0, 1, 2));

        assertTrue(search(sessions, List.of(worker("a")), MON_TO_WED).isEmpty());
    }

    @Test
    void loopWithoutLongBreakShouldBeOneRoundPerPlan() {
        List<Session> sessions = List.of(Session.of("s1", 60, 15, 1, 1), Session.of("s2", 60, 0, 1, 2));

        SearchOutcome<MultiDayPlan> outcome = search(sessions, List.of(worker("a")), MON_TO_WED);

        assertEquals(3, outcome.size());
        assertThat(outcome.results()).allSatisfy(plan -> assertEquals(1, plan.rounds().size()));
    }

    @Test
    void collectingPerFirstDateShouldMatchWholeRangeSearch() {
        List<Session> sessions = List.of(Session.of("s1", 60, 1440, 1, 1), Session.of("s2", 60, 0, 2, 2));
        List<Participant> participants = List.of(worker("a"), worker("b"), worker("c"), worker("d"));
        List<Round> rounds = RoundGrouper.group(sessions, 1440);

        MultiDaySearch search = newSearch(rounds, participants, SearchOptions.defaults());
        List<MultiDayPlan> perDate = new ArrayList<>();
        for (LocalDate date : MON_TO_WED.dates()) {
            perDate.addAll(search.collectStartingOn(date, MON_TO_WED.end(), 100));
        }

        assertEquals(newSearch(rounds, participants, SearchOptions.defaults()).search(MON_TO_WED).results(),
                ResultRanker.rankPlans(perDate, true));
    }

    @Test
    void shouldStopAtMaxResults() {
        List<Session> sessions = List.of(Session.of("s1", 60, 1440, 1, 1), Session.of("s2", 60, 0, 1, 2));
        SearchOptions options = SearchOptions.builder().maxResults(2).build();

        MultiDaySearch search = newSearch(RoundGrouper.group(sessions, 1440),
                List.of(worker("a"), worker("b"), worker("c")), options);

        assertEquals(2, search.search(MON_TO_WED).size());
    }

    private static SearchOutcome<MultiDayPlan> search(List<Session> sessions, List<Participant> participants, DateRange range) {
        return newSearch(RoundGrouper.group(sessions, 1440), participants, SearchOptions.defaults()).search(range);
    }

    private static MultiDaySearch newSearch(List<Round> rounds, List<Participant> participants, SearchOptions options) {
        return new MultiDaySearch(rounds, participants, BusySnapshot.empty(), options,
                ZoneOffset.UTC, LocalTime.of(9, 0), 1440, SearchBudget.unlimited());
    }
}
