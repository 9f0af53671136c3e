package com.telemetrysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One time bucket of a metric series (counter or gauge).
 *
 * <p>
 * {@code value} is {@code null} when the bucket held no data; such samples are
 * dropped before analysis.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final Double value;

    public MetricSample(Instant timestamp, Double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public static MetricSample of(Instant timestamp, double value) {
        return new MetricSample(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the bucket value, or {@code null} if the bucket was empty
     */
    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return timestamp.equals(that.timestamp) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "MetricSample{" + timestamp + '=' + value + '}';
    }
}
