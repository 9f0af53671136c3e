package com.telemetrysentinel.core.source;

import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.model.WindowStatistics;
import com.telemetrysentinel.core.stats.StatisticsKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link TelemetrySource} over telemetry already held in memory.
 *
 * <p>
 * Metric series are bucketed by exact timestamp: points of the same metric
 * sharing a timestamp (e.g. from several services) are averaged into one
 * sample. The source is immutable once built and therefore safe for
 * concurrent reads.
 * </p>
 *
 * @since 1.0.0
 */
public final class InMemoryTelemetrySource implements TelemetrySource {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTelemetrySource.class);

    private final List<MetricPoint> metricPoints;
    private final List<TelemetryRecord> records;
    private final List<DurationSample> durations;

    private InMemoryTelemetrySource(Builder builder) {
        this.metricPoints = List.copyOf(builder.metricPoints);
        this.records = List.copyOf(builder.records);
        this.durations = List.copyOf(builder.durations);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // TelemetrySource
    // ---------------------------------------------------------------

    @Override
    public List<MetricSample> fetchCounterSeries(String metric, TimeRange range, String groupBy) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(range, "range must not be null");

        Map<Instant, List<Double>> buckets = new TreeMap<>();
        for (MetricPoint point : metricPoints) {
            if (point.metric.equals(metric)
                    && range.contains(point.timestamp)
                    && (groupBy == null || groupBy.equals(point.service))) {
                List<Double> bucket = buckets.computeIfAbsent(point.timestamp, t -> new ArrayList<>());
                if (point.value != null) {
                    bucket.add(point.value);
                }
            }
        }

        List<MetricSample> series = new ArrayList<>(buckets.size());
        buckets.forEach((timestamp, values) -> series.add(new MetricSample(timestamp,
                values.isEmpty() ? null : average(values))));
        LOG.trace("Series '{}' (group={}) in {}: {} bucket(s)", metric, groupBy, range, series.size());
        return series;
    }

    @Override
    public WindowStatistics fetchFieldWindowStatistics(String field, TimeRange range, Set<Double> percentileRanks) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(percentileRanks, "percentileRanks must not be null");

        double[] values = records.stream()
                .filter(r -> inRange(r, range))
                .map(r -> r.getNumericField(field))
                .flatMap(Optional::stream)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (values.length == 0) {
            return WindowStatistics.empty();
        }
        double[] ranks = percentileRanks.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        return StatisticsKernel.summarize(values, ranks.length == 0 ? StatisticsKernel.DEFAULT_PERCENTILE_RANKS : ranks);
    }

    @Override
    public List<TelemetryRecord> fetchExemplars(String field, TimeRange range, ExemplarDirection direction, int limit) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }

        Comparator<TelemetryRecord> byValue = Comparator.comparingDouble(
                r -> r.getNumericField(field).orElseThrow());
        return records.stream()
                .filter(r -> inRange(r, range) && r.getNumericField(field).isPresent())
                .sorted(direction == ExemplarDirection.HIGHEST ? byValue.reversed() : byValue)
                .limit(limit)
                .toList();
    }

    @Override
    public List<DurationSample> fetchDurationSamples(TimeRange range, DurationFilter filters) {
        Objects.requireNonNull(range, "range must not be null");
        DurationFilter filter = filters != null ? filters : DurationFilter.none();
        return durations.stream()
                .filter(s -> range.contains(s.getTimestamp()))
                .filter(s -> filter.matches(s.getService(), s.getOperation()))
                .toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static boolean inRange(TelemetryRecord record, TimeRange range) {
        Instant timestamp = record.getTimestamp();
        return timestamp != null && range.contains(timestamp);
    }

    private static double average(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** One raw metric observation. */
    private static final class MetricPoint {
        private final String metric;
        private final String service;
        private final Instant timestamp;
        private final Double value;

        private MetricPoint(String metric, String service, Instant timestamp, Double value) {
            this.metric = metric;
            this.service = service;
            this.timestamp = timestamp;
            this.value = value;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Accumulates telemetry for an {@link InMemoryTelemetrySource}.
     * Not thread-safe.
     */
    public static class Builder {
        private final List<MetricPoint> metricPoints = new ArrayList<>();
        private final List<TelemetryRecord> records = new ArrayList<>();
        private final List<DurationSample> durations = new ArrayList<>();

        /**
         * @param metric    metric name; must not be {@code null}
         * @param service   emitting service, or {@code null}
         * @param timestamp bucket timestamp; must not be {@code null}
         * @param value     observed value, or {@code null} for an empty bucket
         */
        public Builder metricPoint(String metric, String service, Instant timestamp, Double value) {
            metricPoints.add(new MetricPoint(
                    Objects.requireNonNull(metric, "metric must not be null"),
                    service,
                    Objects.requireNonNull(timestamp, "timestamp must not be null"),
                    value));
            return this;
        }

        /**
         * Add a series of one service in one call.
         */
        public Builder metricSeries(String metric, String service, List<MetricSample> samples) {
            for (MetricSample sample : samples) {
                metricPoint(metric, service, sample.getTimestamp(), sample.getValue());
            }
            return this;
        }

        /**
         * @param record a document with a resolvable timestamp
         * @throws IllegalArgumentException if the record has no timestamp
         */
        public Builder record(TelemetryRecord record) {
            Objects.requireNonNull(record, "record must not be null");
            if (record.getTimestamp() == null) {
                throw new IllegalArgumentException("Record has no timestamp: " + record);
            }
            records.add(record);
            return this;
        }

        public Builder durationSample(DurationSample sample) {
            durations.add(Objects.requireNonNull(sample, "sample must not be null"));
            return this;
        }

        public Builder durationSamples(List<DurationSample> samples) {
            samples.forEach(this::durationSample);
            return this;
        }

        public InMemoryTelemetrySource build() {
            LOG.debug("Built in-memory source: {} metric point(s), {} record(s), {} span(s)",
                    metricPoints.size(), records.size(), durations.size());
            return new InMemoryTelemetrySource(this);
        }
    }
}
