package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single anomalous observation reported by one detection criterion.
 *
 * <p>
 * Instances are immutable. One observation flagged by several criteria is
 * reported as several anomalies that share {@code timestamp} and
 * {@code subject} but differ in {@link #getDetectionMethod()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code subject} and
 * {@code detectionMethod} are required, and the optional numeric fields must
 * match what the method declares (see {@link DetectionMethod}). When an
 * expected value is given without a deviation, the deviation is derived as
 * {@code value - expectedValue}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Deviation reported for a full counter reset. */
    public static final double RESET_DEVIATION = -1.0;

    private final Instant timestamp;

    /** Field name, metric name, or operation name. */
    private final String subject;

    private final double value;
    private final Double expectedValue;
    private final Double deviation;
    private final Double zScore;
    private final double threshold;
    private final DetectionMethod detectionMethod;

    /** Ranking severity; higher is worse. */
    private final double score;

    private final String service;
    private final String operation;
    private final String traceId;
    private final String spanId;

    /** Human-readable description of what was detected. */
    private final String details;

    private Anomaly(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.subject = Objects.requireNonNull(builder.subject, "subject must not be null");
        this.detectionMethod = Objects.requireNonNull(builder.detectionMethod,
                "detectionMethod must not be null");
        this.value = builder.value;
        this.expectedValue = builder.expectedValue;
        if (builder.deviation == null && builder.expectedValue != null) {
            this.deviation = builder.value - builder.expectedValue;
        } else {
            this.deviation = builder.deviation;
        }
        this.zScore = builder.zScore;
        this.threshold = builder.threshold;
        this.score = builder.score;
        this.service = builder.service;
        this.operation = builder.operation;
        this.traceId = builder.traceId;
        this.spanId = builder.spanId;
        this.details = builder.details;
        checkFieldsMatchMethod();
    }

    private void checkFieldsMatchMethod() {
        if (!Double.isFinite(score) || score < 0) {
            throw new IllegalStateException(
                    detectionMethod + " anomaly requires a finite, non-negative score, got: " + score);
        }
        if (detectionMethod.carriesZScore() != (zScore != null)) {
            throw new IllegalStateException(detectionMethod
                    + (zScore == null ? " anomaly requires a zScore" : " anomaly must not carry a zScore"));
        }
        if (detectionMethod.carriesExpectedValue() != (expectedValue != null)) {
            throw new IllegalStateException(detectionMethod
                    + (expectedValue == null
                            ? " anomaly requires an expectedValue"
                            : " anomaly must not carry an expectedValue"));
        }
        if (expectedValue == null && deviation != null) {
            throw new IllegalStateException(detectionMethod + " anomaly must not carry a deviation");
        }
        if (detectionMethod == DetectionMethod.RESET && !Objects.equals(deviation, RESET_DEVIATION)) {
            throw new IllegalStateException("reset anomaly deviation must be " + RESET_DEVIATION);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-filled with this anomaly's fields.
     *
     * @return builder instance
     */
    public Builder toBuilder() {
        return new Builder()
                .timestamp(timestamp)
                .subject(subject)
                .value(value)
                .expectedValue(expectedValue)
                .deviation(deviation)
                .zScore(zScore)
                .threshold(threshold)
                .detectionMethod(detectionMethod)
                .score(score)
                .service(service)
                .operation(operation)
                .traceId(traceId)
                .spanId(spanId)
                .details(details);
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private String subject;
        private double value;
        private Double expectedValue;
        private Double deviation;
        private Double zScore;
        private double threshold;
        private DetectionMethod detectionMethod;
        private double score;
        private String service;
        private String operation;
        private String traceId;
        private String spanId;
        private String details;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder expectedValue(Double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviation(Double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder zScore(Double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder detectionMethod(DetectionMethod detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
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

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link Anomaly}
         * @throws NullPointerException  if a required field is missing
         * @throws IllegalStateException if the optional fields do not match the
         *                               detection method, or the score is invalid
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSubject() {
        return subject;
    }

    public double getValue() {
        return value;
    }

    public Double getExpectedValue() {
        return expectedValue;
    }

    public Double getDeviation() {
        return deviation;
    }

    @JsonProperty("zScore")
    public Double getZScore() {
        return zScore;
    }

    public double getThreshold() {
        return threshold;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public double getScore() {
        return score;
    }

    public String getService() {
        return service;
    }

    public String getOperation() {
        return operation;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public String getDetails() {
        return details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(score, that.score) == 0
                && detectionMethod == that.detectionMethod
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(subject, that.subject)
                && Objects.equals(service, that.service)
                && Objects.equals(operation, that.operation)
                && Objects.equals(spanId, that.spanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, subject, detectionMethod, value, spanId);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "method=" + detectionMethod +
                ", subject='" + subject + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", score=" + score +
                (service != null ? ", service='" + service + '\'' : "") +
                (operation != null ? ", operation='" + operation + '\'' : "") +
                '}';
    }
}
