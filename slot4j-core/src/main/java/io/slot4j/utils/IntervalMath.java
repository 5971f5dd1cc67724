package io.slot4j.utils;

import io.slot4j.core.OverlapType;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Interval arithmetic on minute values.
 * <p>
 * Supported time representations:
 * <ul>
 *   <li>Clock of day: "09:30" or "09:30:00" normalizes to minutes from midnight (570)</li>
 *   <li>Timestamps: "2024-02-05T09:30:00Z" normalizes to minutes on the UTC epoch axis, so the date is kept</li>
 *   <li>Numbers: already normalized, returned unchanged</li>
 * </ul>
 * <p>
 * Intervals are half-open: two windows that only touch do not overlap.
 */
public final class IntervalMath {
    private IntervalMath() {
    }

    /**
     * A pair of overlapping chunks found by {@link #findAllOverlaps(List)}.
     */
    public record Overlap(int first, int second, OverlapType type) {
    }

    /**
     * Normalize a clock string, a timestamp string or a numeric string to minutes.
     *
     * @throws IllegalArgumentException if the value is none of the supported formats
     */
    public static long normalize(String time) {
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        String s = time.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("time must not be empty");
        }

        if (s.matches("^-?\\d+$")) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("minute value out of range: " + time);
            }
        }

        if (isTimestamp(s)) {
            return normalize(parseTimestamp(s));
        }

        return parseClock(s);
    }

    public static long normalize(Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        return Math.floorDiv(instant.getEpochSecond(), 60L);
    }

    public static long normalize(long minutes) {
        return minutes;
    }

    /**
     * Convert minutes back to the format of {@code originalFormat}.
     * Timestamps come back as ISO instants (UTC), clock values as "HH:mm".
     */
    public static String denormalize(long minutes, String originalFormat) {
        Objects.requireNonNull(originalFormat, "originalFormat must not be null");
        String s = originalFormat.trim();
        if (s.matches("^-?\\d+$")) {
            return String.valueOf(minutes);
        }
        if (isTimestamp(s)) {
            return toInstant(minutes).toString();
        }
        long hours = Math.floorDiv(minutes, 60L);
        long mins = Math.floorMod(minutes, 60L);
        return String.format(Locale.ROOT, "%02d:%02d", hours, mins);
    }

    public static Instant toInstant(long epochMinutes) {
        return Instant.ofEpochSecond(epochMinutes * 60L);
    }

    /**
     * Minutes from local midnight of {@code instant} in {@code zone}.
     */
    public static int minuteOfDay(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        return local.getHour() * 60 + local.getMinute();
    }

    public static boolean overlaps(TimeChunk a, TimeChunk b) {
        return !(a.end() <= b.start() || a.start() >= b.end());
    }

    /**
     * Classify how {@code a} relates to {@code b}.
     */
    public static OverlapType classify(TimeChunk a, TimeChunk b) {
        if (!overlaps(a, b)) {
            return OverlapType.NONE;
        }
        if (isExactMatch(a, b)) {
            return OverlapType.EXACT;
        }
        if (isEncloses(a, b)) {
            return OverlapType.ENCLOSES;
        }
        if (isEnclosed(a, b)) {
            return OverlapType.ENCLOSED;
        }
        if (isLeftOverlap(a, b)) {
            return OverlapType.LEFT;
        }
        if (isRightOverlap(a, b)) {
            return OverlapType.RIGHT;
        }
        return OverlapType.NONE;
    }

    /**
     * <pre>
     * a: |-------|
     * b:     |-------|
     * </pre>
     */
    public static boolean isLeftOverlap(TimeChunk a, TimeChunk b) {
        return a.start() < b.start() && a.end() > b.start() && a.end() < b.end();
    }

    /**
     * <pre>
     * a:     |-------|
     * b: |-------|
     * </pre>
     */
    public static boolean isRightOverlap(TimeChunk a, TimeChunk b) {
        return a.start() > b.start() && a.start() < b.end() && a.end() > b.end();
    }

    public static boolean isEnclosed(TimeChunk a, TimeChunk b) {
        return a.start() >= b.start() && a.end() <= b.end();
    }

    public static boolean isEncloses(TimeChunk a, TimeChunk b) {
        return a.start() <= b.start() && a.end() >= b.end();
    }

    public static boolean isExactMatch(TimeChunk a, TimeChunk b) {
        return a.start() == b.start() && a.end() == b.end();
    }

    /**
     * Minutes shared by both chunks, 0 when they do not overlap.
     */
    public static long overlapMinutes(TimeChunk a, TimeChunk b) {
        if (!overlaps(a, b)) {
            return 0;
        }
        return Math.min(a.end(), b.end()) - Math.max(a.start(), b.start());
    }

    /**
     * {@code to - from} in minutes; negative when {@code to} is earlier.
     */
    public static long timeDifference(String from, String to) {
        return normalize(to) - normalize(from);
    }

    public static boolean isInRange(long minute, TimeChunk range) {
        return minute >= range.start() && minute < range.end();
    }

    /**
     * Every overlapping pair, in index order. O(n²).
     */
    public static List<Overlap> findAllOverlaps(List<TimeChunk> chunks) {
        List<Overlap> overlaps = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            for (int j = i + 1; j < chunks.size(); j++) {
                OverlapType type = classify(chunks.get(i), chunks.get(j));
                if (type != OverlapType.NONE) {
                    overlaps.add(new Overlap(i, j, type));
                }
            }
        }
        return overlaps;
    }

    /**
     * Merge overlapping or adjacent chunks. Result is sorted by start and non-overlapping.
     */
    public static List<TimeChunk> merge(List<TimeChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return new ArrayList<>();
        }

        List<TimeChunk> sorted = new ArrayList<>(chunks);
        sorted.sort(Comparator.comparingLong(TimeChunk::start));

        List<TimeChunk> merged = new ArrayList<>();
        long currentStart = sorted.get(0).start();
        long currentEnd = sorted.get(0).end();

        for (int i = 1; i < sorted.size(); i++) {
            TimeChunk next = sorted.get(i);
            if (next.start() <= currentEnd) {
                currentEnd = Math.max(currentEnd, next.end());
            } else {
                merged.add(new TimeChunk(currentStart, currentEnd));
                currentStart = next.start();
                currentEnd = next.end();
            }
        }
        merged.add(new TimeChunk(currentStart, currentEnd));
        return merged;
    }

    /**
     * Total minutes covered, counting overlapping time once.
     */
    public static long totalMinutes(List<TimeChunk> chunks) {
        long total = 0;
        for (TimeChunk chunk : merge(chunks)) {
            total += chunk.minutes();
        }
        return total;
    }

    /**
     * Free windows of {@code base} once every busy chunk is removed.
     */
    public static List<TimeChunk> subtract(TimeChunk base, List<TimeChunk> busy) {
        Objects.requireNonNull(base, "base must not be null");
        List<TimeChunk> free = new ArrayList<>();
        long cursor = base.start();

        for (TimeChunk chunk : merge(busy)) {
            if (chunk.end() <= base.start() || chunk.start() >= base.end()) {
                continue;
            }
            if (cursor < chunk.start()) {
                free.add(new TimeChunk(cursor, chunk.start()));
            }
            cursor = Math.max(cursor, chunk.end());
        }

        if (cursor < base.end()) {
            free.add(new TimeChunk(cursor, base.end()));
        }
        return free;
    }

    /* ================= helper ================= */

    private static boolean isTimestamp(String s) {
        return s.indexOf('T') >= 0 || s.indexOf('Z') >= 0 || s.length() > 8;
    }

    private static Instant parseTimestamp(String s) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid timestamp: " + s, ex);
        }
    }

    private static long parseClock(String s) {
        String[] parts = s.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid clock time. Expected HH:mm or HH:mm:ss: " + s);
        }
        try {
            int hours = Integer.parseInt(parts[0]);
            int minutes = Integer.parseInt(parts[1]);
            if (hours < 0 || hours > 24 || minutes < 0 || minutes > 59) {
                throw new IllegalArgumentException("Clock time out of range: " + s);
            }
            return hours * 60L + minutes;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid clock time. Expected HH:mm or HH:mm:ss: " + s);
        }
    }
}
