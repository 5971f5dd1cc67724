package io.slot4j.internal;

import io.slot4j.core.Round;
import io.slot4j.core.Session;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundGrouperTest {

    @Test
    void shortBreaksShouldKeepOneRoundInOrder() {
        List<Session> sessions = List.of(
                Session.of("c", 30, 0, 1, 3),
                Session.of("a", 30, 15, 1, 1),
                Session.of("b", 30, 60, 1, 2)
        );

        List<Round> rounds = RoundGrouper.group(sessions, 1440);

        assertEquals(1, rounds.size());
        assertThat(rounds.get(0).sessions()).extracting(Session::id).containsExactly("a", "b", "c");
        assertFalse(RoundGrouper.spansDays(sessions, 1440));
    }

    @Test
    void thresholdBreakShouldCloseTheRound() {
        List<Session> sessions = List.of(
                Session.of("s1", 60, 1440, 1, 1),
                Session.of("s2", 60, 30, 1, 2),
                Session.of("s3", 60, 2000, 1, 3),
                Session.of("s4", 60, 0, 1, 4)
        );

        List<Round> rounds = RoundGrouper.group(sessions, 1440);

        assertThat(rounds).extracting(Round::index).containsExactly(0, 1, 2);
        assertThat(rounds.get(0).sessions()).extracting(Session::id).containsExactly("s1");
        assertThat(rounds.get(1).sessions()).extracting(Session::id).containsExactly("s2", "s3");
        assertThat(rounds.get(2).sessions()).extracting(Session::id).containsExactly("s4");
        assertEquals("s3", rounds.get(1).boundarySession().id());
        assertTrue(RoundGrouper.spansDays(sessions, 1440));
    }

    @Test
    void trailingThresholdBreakShouldNotAddEmptyRound() {
        List<Round> rounds = RoundGrouper.group(List.of(
                Session.of("s1", 60, 0, 1, 1),
                Session.of("s2", 60, 1440, 1, 2)
        ), 1440);

        assertThat(rounds).hasSize(1);
    }
}
