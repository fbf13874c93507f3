package io.clustersearch.models;

import io.clustersearch.exceptions.InvalidTimeRangeException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} of absolute instants. Start never lies after end.
 */
@Getter
@EqualsAndHashCode
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    private TimeRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws InvalidTimeRangeException if {@code start} is after {@code end}
     */
    public static TimeRange of(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidTimeRangeException(start, end);
        }
        return new TimeRange(start, end);
    }

    public static TimeRange ofEpochSeconds(long start, long end) {
        return of(Instant.ofEpochSecond(start), Instant.ofEpochSecond(end));
    }

    /** True when no instant can fall inside the range. */
    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
