package com.telemetrysentinel.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.telemetrysentinel.core.source.TelemetryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON document the runner reads its telemetry from.
 *
 * <pre>
 * {
 *   "metrics": [ {"metric": "http.requests", "service": "cart",
 *                 "timestamp": "2024-05-01T10:00:00Z", "value": 100} ],
 *   "records": [ {"@timestamp": "2024-05-01T10:00:00Z", "latency_ms": 42,
 *                 "service.name": "cart", "traceId": "abc"} ],
 *   "spans":   [ {"spanId": "s1", "traceId": "t1", "operation": "checkout",
 *                 "service": "cart", "duration": 12000000,
 *                 "timestamp": "2024-05-01T10:00:00Z"} ]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryDataset {

    private List<MetricEntry> metrics = new ArrayList<>();
    private List<TelemetryRecord> records = new ArrayList<>();
    private List<SpanEntry> spans = new ArrayList<>();

    public List<MetricEntry> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<MetricEntry> metrics) {
        this.metrics = metrics != null ? metrics : new ArrayList<>();
    }

    public List<TelemetryRecord> getRecords() {
        return records;
    }

    public void setRecords(List<TelemetryRecord> records) {
        this.records = records != null ? records : new ArrayList<>();
    }

    public List<SpanEntry> getSpans() {
        return spans;
    }

    public void setSpans(List<SpanEntry> spans) {
        this.spans = spans != null ? spans : new ArrayList<>();
    }

    /** One metric observation. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricEntry {
        private String metric;
        private String service;
        private Instant timestamp;
        private Double value;

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public String getService() {
            return service;
        }

        public void setService(String service) {
            this.service = service;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Double getValue() {
            return value;
        }

        public void setValue(Double value) {
            this.value = value;
        }
    }

    /** One span with its duration. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SpanEntry {
        private String spanId;
        private String traceId;
        private String service;
        private String operation;
        private Double duration;
        private Instant timestamp;

        public String getSpanId() {
            return spanId;
        }

        public void setSpanId(String spanId) {
            this.spanId = spanId;
        }

        public String getTraceId() {
            return traceId;
        }

        public void setTraceId(String traceId) {
            this.traceId = traceId;
        }

        public String getService() {
            return service;
        }

        public void setService(String service) {
            this.service = service;
        }

        public String getOperation() {
            return operation;
        }

        public void setOperation(String operation) {
            this.operation = operation;
        }

        public Double getDuration() {
            return duration;
        }

        public void setDuration(Double duration) {
            this.duration = duration;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(Instant timestamp) {
            this.timestamp = timestamp;
        }
    }
}
