package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.stats.StatisticsKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rare states in metrics that take a handful of discrete values (circuit
 * breaker state, replica role, health level).
 *
 * <p>
 * Each occurrence of a value seen in less than {@value #RARE_VALUE_FREQUENCY}
 * of the points is a {@code rare-value} anomaly. Each change from one value to
 * the next whose pair occurs in less than {@value #RARE_TRANSITION_FREQUENCY}
 * of all consecutive pairs is a {@code rare-transition} anomaly, with the
 * previous value as the expected one. Scores grow as the frequency falls
 * further below its cutoff.
 * </p>
 *
 * <p>
 * Values are compared exactly. With few points no value can be rare: at least
 * 21 points are needed before one occurrence is below 5%.
 * </p>
 *
 * @since 1.0.0
 */
public class EnumSeriesAnalyzer implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EnumSeriesAnalyzer.class);

    static final int MIN_SAMPLES = 5;
    static final double RARE_VALUE_FREQUENCY = 0.05;
    static final double RARE_TRANSITION_FREQUENCY = 0.03;

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (String metric : request.getSubjects().getEnumMetrics()) {
            for (String service : request.seriesGroups()) {
                List<MetricSample> series = source.fetchGaugeSeries(metric, request.getAnalysisRange(), service);
                anomalies.addAll(analyze(metric, service, series, request.getOptions()));
            }
        }
        return anomalies;
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.ENUM;
    }

    /**
     * Analyze one state series.
     *
     * @param metric  metric name, used as the anomaly subject
     * @param service service the series belongs to, or {@code null}
     * @param samples samples in ascending timestamp order
     * @param options unused beyond validation; the cutoffs are fixed
     * @return rare-value anomalies followed by rare-transition anomalies
     */
    public List<Anomaly> analyze(String metric, String service, List<MetricSample> samples,
            DetectionOptions options) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<MetricSample> valid = SampleFilters.validMetricSamples(samples);
        if (valid.size() < MIN_SAMPLES) {
            LOG.debug("Enum '{}' (service={}): {} valid point(s), need {} – skipping",
                    metric, service, valid.size(), MIN_SAMPLES);
            return List.of();
        }

        int n = valid.size();
        Map<Double, Integer> valueCounts = new HashMap<>();
        Map<Transition, Integer> transitionCounts = new HashMap<>();
        for (int i = 0; i < n; i++) {
            valueCounts.merge(valid.get(i).getValue(), 1, Integer::sum);
            if (i > 0) {
                transitionCounts.merge(new Transition(valid.get(i - 1).getValue(), valid.get(i).getValue()),
                        1, Integer::sum);
            }
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricSample sample : valid) {
            double frequency = (double) valueCounts.get(sample.getValue()) / n;
            if (frequency < RARE_VALUE_FREQUENCY) {
                anomalies.add(base(metric, service, sample)
                        .threshold(RARE_VALUE_FREQUENCY)
                        .detectionMethod(DetectionMethod.RARE_VALUE)
                        .score(StatisticsKernel.relativeExcess(frequency, RARE_VALUE_FREQUENCY))
                        .details(String.format("Rare value %s detected (frequency: %.2f%%)",
                                format(sample.getValue()), frequency * 100))
                        .build());
            }
        }

        for (int i = 1; i < n; i++) {
            double previous = valid.get(i - 1).getValue();
            MetricSample sample = valid.get(i);
            double frequency = (double) transitionCounts.get(new Transition(previous, sample.getValue())) / (n - 1);
            if (frequency < RARE_TRANSITION_FREQUENCY) {
                anomalies.add(base(metric, service, sample)
                        .expectedValue(previous)
                        .threshold(RARE_TRANSITION_FREQUENCY)
                        .detectionMethod(DetectionMethod.RARE_TRANSITION)
                        .score(StatisticsKernel.relativeExcess(frequency, RARE_TRANSITION_FREQUENCY))
                        .details(String.format("Rare transition from %s to %s detected (frequency: %.2f%%)",
                                format(previous), format(sample.getValue()), frequency * 100))
                        .build());
            }
        }

        LOG.debug("Enum '{}' (service={}): {} point(s), {} distinct value(s), {} anomaly(ies)",
                metric, service, n, valueCounts.size(), anomalies.size());
        return anomalies;
    }

    private static Anomaly.Builder base(String metric, String service, MetricSample sample) {
        return Anomaly.builder()
                .timestamp(sample.getTimestamp())
                .subject(metric)
                .service(service)
                .value(sample.getValue());
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    /** Ordered pair of consecutive values. */
    private static final class Transition {

        private final double from;
        private final double to;

        private Transition(double from, double to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Transition that))
                return false;
            return Double.compare(from, that.from) == 0 && Double.compare(to, that.to) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(from, to);
        }
    }
}
