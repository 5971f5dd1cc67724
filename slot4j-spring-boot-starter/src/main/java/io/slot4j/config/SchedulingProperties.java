package io.slot4j.config;

import io.slot4j.core.EngineConfig;
import io.slot4j.core.SearchOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Runtime configuration for the scheduling engine.
 */
@ConfigurationProperties(prefix = "slot4j")
public class SchedulingProperties {
    private boolean enabled = true;
    private String zone = "UTC"; // anchors the day start time
    private String dayStartTime = "09:00";
    private int dayThreshold = EngineConfig.MINUTES_IN_DAY; // minutes
    private int parallelism = 1;
    private boolean cacheBusyIntervals = false;
    private final Defaults defaults = new Defaults();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getDayStartTime() {
        return dayStartTime;
    }

    public void setDayStartTime(String dayStartTime) {
        this.dayStartTime = dayStartTime;
    }

    public int getDayThreshold() {
        return dayThreshold;
    }

    public void setDayThreshold(int dayThreshold) {
        this.dayThreshold = dayThreshold;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isCacheBusyIntervals() {
        return cacheBusyIntervals;
    }

    public void setCacheBusyIntervals(boolean cacheBusyIntervals) {
        this.cacheBusyIntervals = cacheBusyIntervals;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public EngineConfig toEngineConfig() {
        return new EngineConfig(
                ZoneId.of(zone),
                LocalTime.parse(dayStartTime),
                dayThreshold,
                parallelism,
                defaults.toSearchOptions()
        );
    }

    /**
     * Search options used when a request carries none.
     */
    public static class Defaults {
        private boolean respectWorkHours = true;
        private boolean respectHolidays = true;
        private boolean respectDayOffs = true;
        private boolean respectDailyLimits = true;
        private boolean respectWeeklyLimits = true;
        private boolean checkBusyIntervals = true;
        private boolean excludeBlockedTimes = true;
        private boolean balanceLoad = true;
        private int maxResults = SearchOptions.DEFAULT_MAX_RESULTS;
        private boolean includeTrainingParticipants = false;
        private Duration timeout;
        private long maxSteps = 0; // unbounded

        public boolean isRespectWorkHours() {
            return respectWorkHours;
        }

        public void setRespectWorkHours(boolean respectWorkHours) {
            this.respectWorkHours = respectWorkHours;
        }

        public boolean isRespectHolidays() {
            return respectHolidays;
        }

        public void setRespectHolidays(boolean respectHolidays) {
            this.respectHolidays = respectHolidays;
        }

        public boolean isRespectDayOffs() {
            return respectDayOffs;
        }

        public void setRespectDayOffs(boolean respectDayOffs) {
            this.respectDayOffs = respectDayOffs;
        }

        public boolean isRespectDailyLimits() {
            return respectDailyLimits;
        }

        public void setRespectDailyLimits(boolean respectDailyLimits) {
            this.respectDailyLimits = respectDailyLimits;
        }

        public boolean isRespectWeeklyLimits() {
            return respectWeeklyLimits;
        }

        public void setRespectWeeklyLimits(boolean respectWeeklyLimits) {
            this.respectWeeklyLimits = respectWeeklyLimits;
        }

        public boolean isCheckBusyIntervals() {
            return checkBusyIntervals;
        }

        public void setCheckBusyIntervals(boolean checkBusyIntervals) {
            this.checkBusyIntervals = checkBusyIntervals;
        }

        public boolean isExcludeBlockedTimes() {
            return excludeBlockedTimes;
        }

        public void setExcludeBlockedTimes(boolean excludeBlockedTimes) {
            this.excludeBlockedTimes = excludeBlockedTimes;
        }

        public boolean isBalanceLoad() {
            return balanceLoad;
        }

        public void setBalanceLoad(boolean balanceLoad) {
            this.balanceLoad = balanceLoad;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public boolean isIncludeTrainingParticipants() {
            return includeTrainingParticipants;
        }

        public void setIncludeTrainingParticipants(boolean includeTrainingParticipants) {
            this.includeTrainingParticipants = includeTrainingParticipants;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public long getMaxSteps() {
            return maxSteps;
        }

        public void setMaxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
        }

        public SearchOptions toSearchOptions() {
            return SearchOptions.builder()
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
                    .maxSteps(maxSteps)
                    .build();
        }
    }
}
