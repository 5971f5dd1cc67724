package io.slot4j;

import io.slot4j.core.BusySnapshot;
import io.slot4j.core.DateRange;
import io.slot4j.core.Participant;
import io.slot4j.core.SearchOptions;
import io.slot4j.core.Session;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Input of one slot search.
 *
 * <p>When {@link #busySnapshot()} is present the engine uses it as is and does not consult its
 * {@link BusyIntervalProvider}; callers that cache calendar data pass it this way.
 * A {@code null} {@link #options()} means the engine defaults.
 */
public record SearchRequest(
        List<Session> sessions,
        List<Participant> participants,
        DateRange dateRange,
        SearchOptions options,
        BusySnapshot busySnapshot
) {

    public SearchRequest {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Session> sessions = new ArrayList<>();
        private final List<Participant> participants = new ArrayList<>();
        private DateRange dateRange;
        private SearchOptions options;
        private BusySnapshot busySnapshot;

        private Builder() {
        }

        public Builder session(Session session) {
            this.sessions.add(Objects.requireNonNull(session, "session must not be null"));
            return this;
        }

        public Builder sessions(List<Session> sessions) {
            this.sessions.clear();
            if (sessions != null) {
                this.sessions.addAll(sessions);
            }
            return this;
        }

        public Builder participant(Participant participant) {
            this.participants.add(Objects.requireNonNull(participant, "participant must not be null"));
            return this;
        }

        public Builder participants(List<Participant> participants) {
            this.participants.clear();
            if (participants != null) {
                this.participants.addAll(participants);
            }
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder dateRange(LocalDate start, LocalDate end) {
            return dateRange(DateRange.of(start, end));
        }

        public Builder date(LocalDate date) {
            return dateRange(DateRange.single(date));
        }

        public Builder options(SearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder busySnapshot(BusySnapshot busySnapshot) {
            this.busySnapshot = busySnapshot;
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(sessions, participants, dateRange, options, busySnapshot);
        }
    }
}
