package io.slot4j.core;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A person who can be assigned to sessions, with availability rules and load ceilings.
 *
 * <p>Work hours, holidays and day-offs are interpreted in {@link #timezone()}.
 */
public record Participant(
        String id,
        String name,
        String email,
        ZoneId timezone,
        Map<DayOfWeek, TimeRange> workHours,
        LoadLimits limits,
        List<Holiday> holidays,
        Set<LocalDate> dayOffs,
        List<BlockedRange> blockedTimes,
        boolean trainee
) {

    public Participant {
        Objects.requireNonNull(id, "participant id must not be null");
        Objects.requireNonNull(timezone, "timezone must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        workHours = (workHours == null || workHours.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(workHours));
        holidays = holidays == null ? List.of() : List.copyOf(holidays);
        dayOffs = dayOffs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dayOffs));
        blockedTimes = blockedTimes == null ? List.of() : List.copyOf(blockedTimes);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String email;
        private ZoneId timezone = ZoneOffset.UTC;
        private final Map<DayOfWeek, TimeRange> workHours = new EnumMap<>(DayOfWeek.class);
        private LoadLimits limits = LoadLimits.of(LoadLimit.count(Integer.MAX_VALUE), LoadLimit.count(Integer.MAX_VALUE));
        private final List<Holiday> holidays = new ArrayList<>();
        private final Set<LocalDate> dayOffs = new LinkedHashSet<>();
        private final List<BlockedRange> blockedTimes = new ArrayList<>();
        private boolean trainee;

        private Builder(String id) {
            Objects.requireNonNull(id, "id must not be null");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder timezone(ZoneId timezone) {
            this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
            return this;
        }

        public Builder timezone(String timezone) {
            return timezone(ZoneId.of(timezone));
        }

        public Builder workHours(DayOfWeek day, TimeRange range) {
            Objects.requireNonNull(day, "day must not be null");
            Objects.requireNonNull(range, "range must not be null");
            this.workHours.put(day, range);
            return this;
        }

        /**
         * Same range Monday to Friday.
         */
        public Builder weekdays(TimeRange range) {
            for (DayOfWeek day : DayOfWeek.values()) {
                if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                    workHours(day, range);
                }
            }
            return this;
        }

        public Builder everyDay(TimeRange range) {
            for (DayOfWeek day : DayOfWeek.values()) {
                workHours(day, range);
            }
            return this;
        }

        public Builder limits(LoadLimit daily, LoadLimit weekly) {
            this.limits = LoadLimits.of(daily, weekly);
            return this;
        }

        public Builder holiday(LocalDate date, String name) {
            this.holidays.add(new Holiday(date, name));
            return this;
        }

        public Builder dayOff(LocalDate date) {
            this.dayOffs.add(Objects.requireNonNull(date, "date must not be null"));
            return this;
        }

        public Builder blocked(BlockedRange range) {
            this.blockedTimes.add(Objects.requireNonNull(range, "range must not be null"));
            return this;
        }

        public Builder trainee(boolean trainee) {
            this.trainee = trainee;
            return this;
        }

        public Participant build() {
            return new Participant(id, name, email, timezone, workHours, limits, holidays, dayOffs, blockedTimes, trainee);
        }
    }
}
