package io.slot4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a first interval relates to a second one.
 */
public enum OverlapType {
    NONE("none"),
    EXACT("exact"),
    /**
     * First starts earlier and ends inside the second.
     */
    LEFT("left"),
    /**
     * First starts inside the second and ends later.
     */
    RIGHT("right"),
    /**
     * First lies within the second.
     */
    ENCLOSED("enclosed"),
    /**
     * First contains the second.
     */
    ENCLOSES("encloses");

    private final String code;

    OverlapType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
