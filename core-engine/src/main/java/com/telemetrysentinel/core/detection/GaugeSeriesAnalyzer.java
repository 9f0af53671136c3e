package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.stats.IqrBounds;
import com.telemetrysentinel.core.stats.StatisticsKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point outliers and sudden jumps in gauge series (values that move freely,
 * such as memory in use or queue depth).
 *
 * <p>
 * Each point is checked by z-score, percentile and IQR fences against the
 * whole series, and by its relative change from the previous point. Each
 * firing criterion produces its own anomaly. Series with fewer than
 * {@value #MIN_SAMPLES} valid points are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class GaugeSeriesAnalyzer implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(GaugeSeriesAnalyzer.class);

    static final int MIN_SAMPLES = 5;

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<Anomaly> anomalies = new ArrayList<>();
        for (String metric : request.getSubjects().getGaugeMetrics()) {
            for (String service : request.seriesGroups()) {
                List<MetricSample> series = source.fetchGaugeSeries(metric, request.getAnalysisRange(), service);
                anomalies.addAll(analyze(metric, service, series, request.getOptions()));
            }
        }
        return anomalies;
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.GAUGE;
    }

    /**
     * Analyze one gauge series.
     *
     * @param metric  metric name, used as the anomaly subject
     * @param service service the series belongs to, or {@code null}
     * @param samples samples in ascending timestamp order
     * @param options thresholds
     * @return anomalies of all four criteria
     */
    public List<Anomaly> analyze(String metric, String service, List<MetricSample> samples,
            DetectionOptions options) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<MetricSample> valid = SampleFilters.validMetricSamples(samples);
        if (valid.size() < MIN_SAMPLES) {
            LOG.debug("Gauge '{}' (service={}): {} valid point(s), need {} – skipping",
                    metric, service, valid.size(), MIN_SAMPLES);
            return List.of();
        }

        double[] values = valid.stream().mapToDouble(MetricSample::getValue).toArray();
        double[] sorted = StatisticsKernel.sortedCopy(values);
        double mean = StatisticsKernel.mean(values);
        double stdDev = StatisticsKernel.stdDev(values, mean);
        double percentile = StatisticsKernel.percentile(sorted, options.getPercentileThreshold());
        IqrBounds bounds = StatisticsKernel.iqrBounds(sorted, options.getIqrMultiplier());
        double zThreshold = options.getZScoreThreshold();
        double changeThreshold = options.getChangeThreshold();

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            MetricSample sample = valid.get(i);
            double value = values[i];

            if (stdDev != 0) {
                double zScore = StatisticsKernel.zScore(value, mean, stdDev);
                if (Math.abs(zScore) > zThreshold) {
                    anomalies.add(base(metric, service, sample)
                            .expectedValue(mean)
                            .zScore(zScore)
                            .threshold(zThreshold)
                            .detectionMethod(DetectionMethod.GAUGE_Z_SCORE)
                            .score(Math.abs(zScore))
                            .details(String.format("Z-score of %.2f exceeds threshold of %.1f", zScore, zThreshold))
                            .build());
                }
            }

            if (value > percentile) {
                anomalies.add(base(metric, service, sample)
                        .threshold(percentile)
                        .detectionMethod(DetectionMethod.GAUGE_PERCENTILE)
                        .score(StatisticsKernel.relativeExcess(value, percentile))
                        .details(String.format("Value %.2f exceeds p%.0f (%.2f)",
                                value, options.getPercentileThreshold(), percentile))
                        .build());
            }

            if (bounds.isOutside(value)) {
                double bound = bounds.crossedBound(value);
                anomalies.add(base(metric, service, sample)
                        .expectedValue(mean)
                        .threshold(bound)
                        .detectionMethod(DetectionMethod.GAUGE_IQR)
                        .score(StatisticsKernel.relativeExcess(value, bound))
                        .details(String.format("Value %.2f is outside IQR bounds [%.2f, %.2f]",
                                value, bounds.getLower(), bounds.getUpper()))
                        .build());
            }

            if (i > 0 && values[i - 1] != 0) {
                double previous = values[i - 1];
                double changeRate = Math.abs((value - previous) / previous);
                if (changeRate > changeThreshold) {
                    anomalies.add(base(metric, service, sample)
                            .expectedValue(previous)
                            .threshold(changeThreshold)
                            .detectionMethod(DetectionMethod.GAUGE_CHANGE_RATE)
                            .score(changeRate)
                            .details(String.format("Change rate of %.2f%% exceeds threshold of %.2f%%",
                                    changeRate * 100, changeThreshold * 100))
                            .build());
                }
            }
        }
        LOG.debug("Gauge '{}' (service={}): {} point(s), {} anomaly(ies)",
                metric, service, values.length, anomalies.size());
        return anomalies;
    }

    private static Anomaly.Builder base(String metric, String service, MetricSample sample) {
        return Anomaly.builder()
                .timestamp(sample.getTimestamp())
                .subject(metric)
                .service(service)
                .value(sample.getValue());
    }
}
