package io.slot4j.core;

public record LoadInfo(PeriodLoad daily, PeriodLoad weekly) {
}
