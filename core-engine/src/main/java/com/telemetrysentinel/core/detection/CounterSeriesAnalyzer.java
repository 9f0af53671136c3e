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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reset-aware analysis of monotonically increasing counters.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>A value below {@code previous * resetDropRatio} is a <i>reset</i>
 * (process restart or rollover). Every reset is reported.</li>
 * <li>Per-second rates are computed between consecutive points, skipping
 * reset points. Rates whose z-score exceeds the threshold are reported.</li>
 * <li>With at least three intervals between resets, intervals whose z-score
 * exceeds the threshold are reported.</li>
 * </ol>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Nothing is reported for a series with fewer than {@value #MIN_SAMPLES} valid
 * points.
 * </p>
 *
 * @since 1.0.0
 */
public class CounterSeriesAnalyzer implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CounterSeriesAnalyzer.class);

    /** Minimum number of valid points in a series. */
    static final int MIN_SAMPLES = 5;

    /** Minimum number of inter-reset intervals for interval analysis. */
    static final int MIN_RESET_INTERVALS = 3;

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (String metric : request.getSubjects().getCounterMetrics()) {
            for (String service : request.seriesGroups()) {
                List<MetricSample> series = source.fetchCounterSeries(metric, request.getAnalysisRange(), service);
                anomalies.addAll(analyze(metric, service, series, request.getOptions()));
            }
        }
        return anomalies;
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.COUNTER;
    }

    /**
     * Analyze one counter series.
     *
     * @param metric  metric name, used as the anomaly subject
     * @param service service the series belongs to, or {@code null}
     * @param samples samples in ascending timestamp order
     * @param options thresholds
     * @return reset, rate and reset-interval anomalies
     */
    public List<Anomaly> analyze(String metric, String service, List<MetricSample> samples,
            DetectionOptions options) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<MetricSample> valid = SampleFilters.validMetricSamples(samples);
        if (valid.size() < MIN_SAMPLES) {
            LOG.debug("Counter '{}' (service={}): {} valid point(s), need {} – skipping",
                    metric, service, valid.size(), MIN_SAMPLES);
            return List.of();
        }

        List<Integer> resets = new ArrayList<>();
        List<Instant> rateTimestamps = new ArrayList<>();
        List<Double> rates = new ArrayList<>();

        for (int i = 1; i < valid.size(); i++) {
            MetricSample previous = valid.get(i - 1);
            MetricSample current = valid.get(i);
            if (current.getValue() < previous.getValue() * options.getResetDropRatio()) {
                resets.add(i);
                continue;
            }
            double seconds = Duration.between(previous.getTimestamp(), current.getTimestamp()).toMillis() / 1000.0;
            if (seconds <= 0) {
                continue;
            }
            rateTimestamps.add(current.getTimestamp());
            rates.add((current.getValue() - previous.getValue()) / seconds);
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int index : resets) {
            anomalies.add(resetAnomaly(metric, service, valid.get(index - 1), valid.get(index), options));
        }
        anomalies.addAll(rateAnomalies(metric, service, rateTimestamps, rates, options));
        anomalies.addAll(resetIntervalAnomalies(metric, service, valid, resets, options));

        LOG.debug("Counter '{}' (service={}): {} reset(s), {} rate(s), {} anomaly(ies)",
                metric, service, resets.size(), rates.size(), anomalies.size());
        return anomalies;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Anomaly resetAnomaly(String metric, String service, MetricSample from, MetricSample to,
            DetectionOptions options) {
        double fromValue = from.getValue();
        double toValue = to.getValue();
        double score = fromValue > 0 ? (fromValue - toValue) / fromValue : 1.0;
        return Anomaly.builder()
                .timestamp(to.getTimestamp())
                .subject(metric)
                .service(service)
                .value(toValue)
                .expectedValue(fromValue)
                .deviation(Anomaly.RESET_DEVIATION)
                .threshold(fromValue * options.getResetDropRatio())
                .detectionMethod(DetectionMethod.RESET)
                .score(score)
                .details(String.format("Counter reset from %.2f to %.2f", fromValue, toValue))
                .build();
    }

    private static List<Anomaly> rateAnomalies(String metric, String service, List<Instant> timestamps,
            List<Double> rates, DetectionOptions options) {
        if (rates.isEmpty()) {
            return List.of();
        }
        double[] values = toArray(rates);
        double mean = StatisticsKernel.mean(values);
        double stdDev = StatisticsKernel.stdDev(values, mean);
        if (stdDev == 0) {
            LOG.debug("Counter '{}' (service={}): constant rate – skipping rate analysis", metric, service);
            return List.of();
        }

        double threshold = options.getZScoreThreshold();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double zScore = StatisticsKernel.zScore(values[i], mean, stdDev);
            if (Math.abs(zScore) > threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(timestamps.get(i))
                        .subject(metric)
                        .service(service)
                        .value(values[i])
                        .expectedValue(mean)
                        .zScore(zScore)
                        .threshold(threshold)
                        .detectionMethod(DetectionMethod.RATE_Z_SCORE)
                        .score(Math.abs(zScore))
                        .details(String.format(
                                "Rate of change (%.2f/s) has z-score of %.2f, exceeding threshold of %.1f",
                                values[i], zScore, threshold))
                        .build());
            }
        }
        return anomalies;
    }

    private static List<Anomaly> resetIntervalAnomalies(String metric, String service, List<MetricSample> valid,
            List<Integer> resets, DetectionOptions options) {
        if (resets.size() < 2) {
            return List.of();
        }
        double[] intervals = new double[resets.size() - 1];
        for (int i = 1; i < resets.size(); i++) {
            Instant previous = valid.get(resets.get(i - 1)).getTimestamp();
            Instant current = valid.get(resets.get(i)).getTimestamp();
            intervals[i - 1] = Duration.between(previous, current).toMillis() / 1000.0;
        }
        if (intervals.length < MIN_RESET_INTERVALS) {
            return List.of();
        }
        double mean = StatisticsKernel.mean(intervals);
        double stdDev = StatisticsKernel.stdDev(intervals, mean);
        if (stdDev == 0) {
            return List.of();
        }

        double threshold = options.getZScoreThreshold();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < intervals.length; i++) {
            double zScore = StatisticsKernel.zScore(intervals[i], mean, stdDev);
            if (Math.abs(zScore) > threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(valid.get(resets.get(i + 1)).getTimestamp())
                        .subject(metric)
                        .service(service)
                        .value(intervals[i])
                        .expectedValue(mean)
                        .zScore(zScore)
                        .threshold(threshold)
                        .detectionMethod(DetectionMethod.RESET_INTERVAL)
                        .score(Math.abs(zScore))
                        .details(String.format(
                                "Unusual time between counter resets: %.2f minutes (z-score: %.2f)",
                                intervals[i] / 60.0, zScore))
                        .build());
            }
        }
        return anomalies;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
