package io.slot4j.internal;

import io.slot4j.core.SearchOptions;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Time and step allowance of one search, shared by every worker of that search.
 * Once exhausted it stays exhausted.
 */
public final class SearchBudget {
    private final Supplier<Instant> clock;
    private final Instant deadline;
    private final long maxSteps;
    private final AtomicLong steps = new AtomicLong();
    private volatile boolean exhausted;

    private SearchBudget(Supplier<Instant> clock, Instant deadline, long maxSteps) {
        this.clock = clock;
        this.deadline = deadline;
        this.maxSteps = maxSteps;
    }

    public static SearchBudget unlimited() {
        return new SearchBudget(Instant::now, null, 0);
    }

    /**
     * Budget starting now; {@code null} timeout and zero steps mean unbounded.
     */
    public static SearchBudget start(SearchOptions options, Supplier<Instant> clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        Instant deadline = options.timeout() == null ? null : clock.get().plus(options.timeout());
        return new SearchBudget(clock, deadline, options.maxSteps());
    }

    /**
     * Account for one unit of work. Returns {@code false} when the budget ran out; the caller
     * must then stop exploring.
     */
    public boolean tryStep() {
        if (exhausted) {
            return false;
        }
        long n = steps.incrementAndGet();
        if (maxSteps > 0 && n > maxSteps) {
            exhausted = true;
            return false;
        }
        if (deadline != null && !clock.get().isBefore(deadline)) {
            exhausted = true;
            return false;
        }
        return true;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public long steps() {
        return steps.get();
    }
}
