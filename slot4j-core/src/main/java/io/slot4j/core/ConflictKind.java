package io.slot4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictKind {

    CALENDAR_EVENT("calendar_event"),
    WORK_HOURS("work_hours"),
    DAILY_LIMIT("daily_limit"),
    WEEKLY_LIMIT("weekly_limit"),
    HOLIDAY("holiday"),
    DAY_OFF("day_off"),
    RECRUITING_BLOCK("recruiting_block"),
    TIME_OVERLAP("time_overlap"),
    NO_PARTICIPANTS_AVAILABLE("no_participants_available");

    private final String code;

    ConflictKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
