package com.telemetrysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Duration of one span, as fetched from the trace store.
 *
 * <p>
 * The duration unit is whatever the source stores (nanoseconds for OTEL spans);
 * the detector never converts it. A {@code null} duration marks a span without
 * timing data.
 * </p>
 *
 * @since 1.0.0
 */
public final class DurationSample implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Span id. */
    private final String subjectId;
    private final String traceId;
    private final Double duration;
    private final Instant timestamp;
    private final String service;
    private final String operation;

    private DurationSample(Builder builder) {
        this.subjectId = builder.subjectId;
        this.traceId = builder.traceId;
        this.duration = builder.duration;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.service = builder.service != null ? builder.service : "unknown";
        this.operation = builder.operation != null ? builder.operation : "unknown";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DurationSample}. Missing service or operation
     * names are recorded as {@code unknown}.
     */
    public static class Builder {
        private String subjectId;
        private String traceId;
        private Double duration;
        private Instant timestamp;
        private String service;
        private String operation;

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder duration(Double duration) {
            this.duration = duration;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public DurationSample build() {
            return new DurationSample(this);
        }
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getTraceId() {
        return traceId;
    }

    public Double getDuration() {
        return duration;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getService() {
        return service;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DurationSample that))
            return false;
        return Objects.equals(subjectId, that.subjectId)
                && Objects.equals(traceId, that.traceId)
                && Objects.equals(duration, that.duration)
                && timestamp.equals(that.timestamp)
                && service.equals(that.service)
                && operation.equals(that.operation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, traceId, duration, timestamp, service, operation);
    }

    @Override
    public String toString() {
        return "DurationSample{" +
                "spanId='" + subjectId + '\'' +
                ", operation='" + operation + '\'' +
                ", service='" + service + '\'' +
                ", duration=" + duration +
                ", timestamp=" + timestamp +
                '}';
    }
}
