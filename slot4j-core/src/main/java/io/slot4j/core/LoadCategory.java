package io.slot4j.core;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LoadCategory {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    OVER_LIMIT("over_limit");

    private final String code;

    LoadCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * low &lt; 0.7, medium &lt; 0.9, high &lt; 1.0, otherwise over_limit.
     */
    public static LoadCategory of(double density) {
        if (density >= 1.0) return OVER_LIMIT;
        if (density >= 0.9) return HIGH;
        if (density >= 0.7) return MEDIUM;
        return LOW;
    }
}
