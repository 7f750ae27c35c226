package com.strata.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}.
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    /**
     * Everything strictly before {@code end}.
     */
    public static TimeRange before(Instant end) {
        return new TimeRange(Instant.EPOCH.isAfter(end) ? end : Instant.EPOCH, end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * Split into consecutive chunks of at most {@code chunk}, oldest first.
     * Chunk boundaries are aligned to multiples of {@code chunk} since the epoch
     * so repeated runs cut the same ranges.
     */
    public List<TimeRange> split(Duration chunk) {
        List<TimeRange> chunks = new ArrayList<>();
        if (isEmpty()) {
            return chunks;
        }
        long chunkMillis = chunk.toMillis();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            long aligned = Math.floorDiv(cursor.toEpochMilli(), chunkMillis) * chunkMillis + chunkMillis;
            Instant next = Instant.ofEpochMilli(aligned);
            if (next.isAfter(end)) {
                next = end;
            }
            chunks.add(new TimeRange(cursor, next));
            cursor = next;
        }
        return chunks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeRange)) {
            return false;
        }
        TimeRange other = (TimeRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
