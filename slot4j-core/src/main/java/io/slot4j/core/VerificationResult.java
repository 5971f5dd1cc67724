package io.slot4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of re-checking a chosen combination or plan. "Not available" is a normal value.
 */
public record VerificationResult(
        boolean available,
        List<Conflict> conflicts,
        Map<String, LoadInfo> loadInfo
) {

    public VerificationResult {
        conflicts = List.copyOf(conflicts);
        loadInfo = Collections.unmodifiableMap(new LinkedHashMap<>(loadInfo));
    }
}
