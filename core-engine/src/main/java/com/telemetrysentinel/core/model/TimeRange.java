package com.telemetrysentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time window {@code [start, end)}.
 *
 * @since 1.0.0
 */
public final class TimeRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final Instant end;

    /**
     * @throws IllegalArgumentException if {@code end} is not after {@code start}
     */
    public TimeRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException(
                    "Time range end must be after start, got: [" + start + ", " + end + ")");
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    /**
     * The window of the given length that ends where this one starts.
     *
     * @param length length of the preceding window; must be positive
     * @return the preceding window
     */
    public TimeRange preceding(Duration length) {
        Objects.requireNonNull(length, "length must not be null");
        return new TimeRange(start.minus(length), start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
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
