package io.slot4j.internal;

import io.slot4j.core.SchedulingException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs independent per-date searches and joins their results in date order.
 *
 * <p>Results are concatenated by date, never by completion order, and the concatenation is cut at
 * {@code limit}. Sequential and pooled runs therefore return the same list.
 */
public final class DateFanOut {
    private DateFanOut() {
    }

    /**
     * @param pool {@code null} to run on the calling thread, stopping at the first date that fills
     *             the limit
     */
    public static <T> List<T> collect(List<LocalDate> dates,
                                      Function<LocalDate, List<T>> perDate,
                                      int limit,
                                      ExecutorService pool) {
        if (pool == null || dates.size() < 2) {
            return sequential(dates, perDate, limit);
        }

        List<Future<List<T>>> futures = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            futures.add(pool.submit(() -> perDate.apply(date)));
        }

        List<T> joined = new ArrayList<>();
        try {
            for (Future<List<T>> future : futures) {
                if (joined.size() >= limit) {
                    future.cancel(true);
                    continue;
                }
                appendUpTo(joined, await(future), limit);
            }
        } catch (RuntimeException e) {
            for (Future<List<T>> future : futures) {
                future.cancel(true);
            }
            throw e;
        }
        return joined;
    }

    private static <T> List<T> sequential(List<LocalDate> dates, Function<LocalDate, List<T>> perDate, int limit) {
        List<T> joined = new ArrayList<>();
        for (LocalDate date : dates) {
            if (joined.size() >= limit) {
                break;
            }
            appendUpTo(joined, perDate.apply(date), limit);
        }
        return joined;
    }

    private static <T> void appendUpTo(List<T> joined, List<T> batch, int limit) {
        for (T item : batch) {
            if (joined.size() >= limit) {
                return;
            }
            joined.add(item);
        }
    }

    private static <T> List<T> await(Future<List<T>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulingException("Interrupted while waiting for date search", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SchedulingException("Date search failed: " + cause.getMessage(), cause);
        }
    }
}
