package io.slot4j.internal;

import io.slot4j.BusyIntervalProvider;
import io.slot4j.core.BusyInterval;
import io.slot4j.core.DateRange;
import io.slot4j.core.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through cache in front of another provider, keyed by participant and date range.
 *
 * <p>Owned by the caller: entries live until {@link #invalidate(String)} or {@link #invalidateAll()}.
 */
public class CachingBusyIntervalProvider implements BusyIntervalProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingBusyIntervalProvider.class);

    private record Key(String participantId, DateRange range) {
    }

    private final BusyIntervalProvider delegate;
    private final ConcurrentHashMap<Key, List<BusyInterval>> cache = new ConcurrentHashMap<>();

    public CachingBusyIntervalProvider(BusyIntervalProvider delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public Map<String, List<BusyInterval>> fetch(Collection<Participant> participants, DateRange range) {
        Map<String, List<BusyInterval>> result = new LinkedHashMap<>();
        List<Participant> missing = new ArrayList<>();
        for (Participant participant : participants) {
            List<BusyInterval> cached = cache.get(new Key(participant.id(), range));
            if (cached == null) {
                missing.add(participant);
            } else if (!cached.isEmpty()) {
                result.put(participant.id(), cached);
            }
        }

        if (!missing.isEmpty()) {
            log.debug("Busy interval cache miss participants={} range={}", missing.size(), range);
            Map<String, List<BusyInterval>> fetched = delegate.fetch(missing, range);
            for (Participant participant : missing) {
                List<BusyInterval> intervals = fetched == null ? null : fetched.get(participant.id());
                List<BusyInterval> stored = intervals == null ? List.of() : List.copyOf(intervals);
                cache.put(new Key(participant.id(), range), stored);
                if (!stored.isEmpty()) {
                    result.put(participant.id(), stored);
                }
            }
        }
        return result;
    }

    public void invalidate(String participantId) {
        cache.keySet().removeIf(key -> key.participantId().equals(participantId));
    }

    public void invalidateAll() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }
}
