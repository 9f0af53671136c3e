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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stalls and unusual rates in counters that only ever grow (bytes sent, jobs
 * completed).
 *
 * <p>
 * The analysis runs on the per-second rate between consecutive points; pairs
 * with a non-positive time delta yield no rate. Unlike
 * {@link CounterSeriesAnalyzer} there is no reset handling, so a drop shows up
 * as a negative rate.
 * </p>
 *
 * <ul>
 * <li>{@code plateau}: the rate is exactly zero while the counter is above
 * {@value #MIN_PLATEAU_VALUE}. The expected value is where the counter would
 * be after the same interval at the mean rate.</li>
 * <li>{@code rate-z-score}: |z| of the rate above the threshold.</li>
 * <li>{@code rate-percentile}: rate above the configured percentile of all
 * rates.</li>
 * </ul>
 *
 * <p>
 * Needs {@value #MIN_SAMPLES} valid points and {@value #MIN_RATES} rates.
 * </p>
 *
 * @since 1.0.0
 */
public class MonotonicCounterAnalyzer implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MonotonicCounterAnalyzer.class);

    static final int MIN_SAMPLES = 5;
    static final int MIN_RATES = 3;

    /** Counters at or below this value are too small for a stall to matter. */
    static final double MIN_PLATEAU_VALUE = 1.0;

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (String metric : request.getSubjects().getMonotonicMetrics()) {
            for (String service : request.seriesGroups()) {
                List<MetricSample> series = source.fetchCounterSeries(metric, request.getAnalysisRange(), service);
                anomalies.addAll(analyze(metric, service, series, request.getOptions()));
            }
        }
        return anomalies;
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.MONOTONIC;
    }

    /**
     * Analyze one monotonic counter series.
     *
     * @param metric  metric name, used as the anomaly subject
     * @param service service the series belongs to, or {@code null}
     * @param samples samples in ascending timestamp order
     * @param options thresholds
     * @return plateau, rate z-score and rate percentile anomalies
     */
    public List<Anomaly> analyze(String metric, String service, List<MetricSample> samples,
            DetectionOptions options) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<MetricSample> valid = SampleFilters.validMetricSamples(samples);
        if (valid.size() < MIN_SAMPLES) {
            LOG.debug("Monotonic counter '{}' (service={}): {} valid point(s), need {} – skipping",
                    metric, service, valid.size(), MIN_SAMPLES);
            return List.of();
        }

        List<RatePoint> points = new ArrayList<>();
        for (int i = 1; i < valid.size(); i++) {
            MetricSample previous = valid.get(i - 1);
            MetricSample current = valid.get(i);
            double seconds = Duration.between(previous.getTimestamp(), current.getTimestamp()).toMillis() / 1000.0;
            if (seconds > 0) {
                points.add(new RatePoint(current, (current.getValue() - previous.getValue()) / seconds, seconds));
            }
        }
        if (points.size() < MIN_RATES) {
            LOG.debug("Monotonic counter '{}' (service={}): {} rate(s), need {} – skipping",
                    metric, service, points.size(), MIN_RATES);
            return List.of();
        }

        double[] rates = points.stream().mapToDouble(p -> p.rate).toArray();
        double mean = StatisticsKernel.mean(rates);
        double stdDev = StatisticsKernel.stdDev(rates, mean);
        double percentile = StatisticsKernel.percentile(StatisticsKernel.sortedCopy(rates),
                options.getPercentileThreshold());
        double zThreshold = options.getZScoreThreshold();

        List<Anomaly> anomalies = new ArrayList<>();
        for (RatePoint point : points) {
            double counterValue = point.sample.getValue();
            if (point.rate == 0 && counterValue > MIN_PLATEAU_VALUE) {
                anomalies.add(base(metric, service, point)
                        .value(counterValue)
                        .expectedValue(counterValue + mean * point.seconds)
                        .threshold(0)
                        .detectionMethod(DetectionMethod.PLATEAU)
                        .score(1.0)
                        .details(String.format("Counter has plateaued (stopped increasing) at value %.2f",
                                counterValue))
                        .build());
            }
        }

        if (stdDev != 0) {
            for (RatePoint point : points) {
                double zScore = StatisticsKernel.zScore(point.rate, mean, stdDev);
                if (Math.abs(zScore) > zThreshold) {
                    anomalies.add(base(metric, service, point)
                            .value(point.rate)
                            .expectedValue(mean)
                            .zScore(zScore)
                            .threshold(zThreshold)
                            .detectionMethod(DetectionMethod.RATE_Z_SCORE)
                            .score(Math.abs(zScore))
                            .details(String.format(
                                    "Rate of change (%.2f/s) has z-score of %.2f, exceeding threshold of %.1f",
                                    point.rate, zScore, zThreshold))
                            .build());
                }
            }
        }

        for (RatePoint point : points) {
            if (point.rate > percentile) {
                anomalies.add(base(metric, service, point)
                        .value(point.rate)
                        .threshold(percentile)
                        .detectionMethod(DetectionMethod.RATE_PERCENTILE)
                        .score(StatisticsKernel.relativeExcess(point.rate, percentile))
                        .details(String.format("Rate of change (%.2f/s) exceeds p%.0f (%.2f/s)",
                                point.rate, options.getPercentileThreshold(), percentile))
                        .build());
            }
        }

        LOG.debug("Monotonic counter '{}' (service={}): {} rate(s), {} anomaly(ies)",
                metric, service, rates.length, anomalies.size());
        return anomalies;
    }

    private static Anomaly.Builder base(String metric, String service, RatePoint point) {
        return Anomaly.builder()
                .timestamp(point.sample.getTimestamp())
                .subject(metric)
                .service(service);
    }

    /** Rate ending at {@code sample}. */
    private static final class RatePoint {

        private final MetricSample sample;
        private final double rate;
        private final double seconds;

        private RatePoint(MetricSample sample, double rate, double seconds) {
            this.sample = sample;
            this.rate = rate;
            this.seconds = seconds;
        }
    }
}
