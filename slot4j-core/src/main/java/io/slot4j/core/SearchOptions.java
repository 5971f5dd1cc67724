package io.slot4j.core;

import java.time.Duration;

/**
 * Per-call search toggles. Every constraint flag defaults to enforced.
 *
 * <ul>
 *   <li>balanceLoad: rank equal start times by mean load density; off keeps exploration order</li>
 *   <li>maxResults: stop exploring once this many results were collected</li>
 *   <li>includeTrainingParticipants: append trainee-mixed participant subsets to each session</li>
 *   <li>timeout / maxSteps: search budget; {@code null} / {@code 0} mean unbounded</li>
 * </ul>
 */
public record SearchOptions(
        boolean respectWorkHours,
        boolean respectHolidays,
        boolean respectDayOffs,
        boolean respectDailyLimits,
        boolean respectWeeklyLimits,
        boolean checkBusyIntervals,
        boolean excludeBlockedTimes,
        boolean balanceLoad,
        int maxResults,
        boolean includeTrainingParticipants,
        Duration timeout,
        long maxSteps
) {

    public static final int DEFAULT_MAX_RESULTS = 100;

    public SearchOptions {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative");
        }
    }

    public static SearchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .respectWorkHours(respectWorkHours)
                .respectHolidays(respectHolidays)
                .respectDayOffs(respectDayOffs)
                .respectDailyLimits(respectDailyLimits)
                .respectWeeklyLimits(respectWeeklyLimits)
                .checkBusyIntervals(checkBusyIntervals)
                .excludeBlockedTimes(excludeBlockedTimes)
                .balanceLoad(balanceLoad)
                .maxResults(maxResults)
                .includeTrainingParticipants(includeTrainingParticipants)
                .timeout(timeout)
                .maxSteps(maxSteps);
    }

    public boolean enforcesLoadLimits() {
        return respectDailyLimits || respectWeeklyLimits;
    }

    public static final class Builder {
        private boolean respectWorkHours = true;
        private boolean respectHolidays = true;
        private boolean respectDayOffs = true;
        private boolean respectDailyLimits = true;
        private boolean respectWeeklyLimits = true;
        private boolean checkBusyIntervals = true;
        private boolean excludeBlockedTimes = true;
        private boolean balanceLoad = true;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private boolean includeTrainingParticipants = false;
        private Duration timeout;
        private long maxSteps;

        private Builder() {
        }

        public Builder respectWorkHours(boolean value) {
            this.respectWorkHours = value;
            return this;
        }

        public Builder respectHolidays(boolean value) {
            this.respectHolidays = value;
            return this;
        }

        public Builder respectDayOffs(boolean value) {
            this.respectDayOffs = value;
            return this;
        }

        public Builder respectDailyLimits(boolean value) {
            this.respectDailyLimits = value;
            return this;
        }

        public Builder respectWeeklyLimits(boolean value) {
            this.respectWeeklyLimits = value;
            return this;
        }

        public Builder checkBusyIntervals(boolean value) {
            this.checkBusyIntervals = value;
            return this;
        }

        public Builder excludeBlockedTimes(boolean value) {
            this.excludeBlockedTimes = value;
            return this;
        }

        public Builder balanceLoad(boolean value) {
            this.balanceLoad = value;
            return this;
        }

        public Builder maxResults(int value) {
            this.maxResults = value;
            return this;
        }

        public Builder includeTrainingParticipants(boolean value) {
            this.includeTrainingParticipants = value;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public Builder maxSteps(long value) {
            this.maxSteps = value;
            return this;
        }

        /**
         * Turn off every constraint flag. Useful for verification of raw placements.
         */
        public Builder relaxAll() {
            this.respectWorkHours = false;
            this.respectHolidays = false;
            this.respectDayOffs = false;
            this.respectDailyLimits = false;
            this.respectWeeklyLimits = false;
            this.checkBusyIntervals = false;
            this.excludeBlockedTimes = false;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(
                    respectWorkHours,
                    respectHolidays,
                    respectDayOffs,
                    respectDailyLimits,
                    respectWeeklyLimits,
                    checkBusyIntervals,
                    excludeBlockedTimes,
                    balanceLoad,
                    maxResults,
                    includeTrainingParticipants,
                    timeout,
                    maxSteps
            );
        }
    }
}
