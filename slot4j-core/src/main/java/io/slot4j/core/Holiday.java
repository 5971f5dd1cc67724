package io.slot4j.core;

import java.time.LocalDate;
import java.util.Objects;

public record Holiday(LocalDate date, String name) {

    public Holiday {
        Objects.requireNonNull(date, "date must not be null");
    }
}
