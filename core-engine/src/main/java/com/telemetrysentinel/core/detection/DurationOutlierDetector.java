package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.stats.IqrBounds;
import com.telemetrysentinel.core.stats.StatisticsKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Flags slow (or unusually fast) spans within a group of comparable spans.
 *
 * <p>
 * Every span is checked against four independent criteria, and each criterion
 * that fires produces its own anomaly:
 * </p>
 * <ul>
 * <li>{@code absolute-threshold}: duration above the configured cutoff (only
 * when one is configured)</li>
 * <li>{@code duration-z-score}: |z| above the threshold (skipped for a
 * constant group)</li>
 * <li>{@code duration-percentile}: duration above the group's
 * {@code percentileThreshold} percentile</li>
 * <li>{@code duration-iqr}: duration outside the group's Tukey fences</li>
 * </ul>
 *
 * <p>
 * With {@code groupByOperation} (the default) spans are partitioned by
 * operation name and each partition is analyzed on its own; otherwise all spans
 * form one group.
 * </p>
 *
 * @since 1.0.0
 */
public class DurationOutlierDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DurationOutlierDetector.class);

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        List<DurationSample> samples = source.fetchDurationSamples(request.getAnalysisRange(),
                request.durationFilter());
        return analyzeGrouped(samples, request.getOptions());
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.DURATION;
    }

    /**
     * Apply the grouping policy and analyze each group.
     *
     * @param samples spans in any order
     * @param options thresholds and grouping switch
     * @return anomalies of all groups
     */
    public List<Anomaly> analyzeGrouped(List<DurationSample> samples, DetectionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<DurationSample> valid = SampleFilters.validDurationSamples(samples);
        if (valid.isEmpty()) {
            LOG.debug("No spans with a valid duration – skipping");
            return List.of();
        }
        if (!options.isGroupByOperation()) {
            return analyze(valid, options);
        }

        Map<String, List<DurationSample>> byOperation = new TreeMap<>();
        for (DurationSample sample : valid) {
            byOperation.computeIfAbsent(sample.getOperation(), op -> new ArrayList<>()).add(sample);
        }
        List<Anomaly> anomalies = new ArrayList<>();
        byOperation.values().forEach(group -> anomalies.addAll(analyze(group, options)));
        return anomalies;
    }

    /**
     * Analyze one homogeneous group of spans.
     *
     * @param group   spans already grouped by the caller
     * @param options thresholds
     * @return one anomaly per (span, firing criterion)
     */
    public List<Anomaly> analyze(List<DurationSample> group, DetectionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        List<DurationSample> valid = SampleFilters.validDurationSamples(group);
        if (valid.isEmpty()) {
            return List.of();
        }

        double[] durations = valid.stream().mapToDouble(DurationSample::getDuration).toArray();
        double[] sorted = StatisticsKernel.sortedCopy(durations);
        double mean = StatisticsKernel.mean(durations);
        double stdDev = StatisticsKernel.stdDev(durations, mean);
        double percentile = StatisticsKernel.percentile(sorted, options.getPercentileThreshold());
        IqrBounds bounds = StatisticsKernel.iqrBounds(sorted, options.getIqrMultiplier());
        Double absoluteThreshold = options.getAbsoluteThreshold();
        double zThreshold = options.getZScoreThreshold();

        if (stdDev == 0) {
            LOG.debug("Span group of {} has constant duration – skipping z-score", valid.size());
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (DurationSample sample : valid) {
            double duration = sample.getDuration();

            if (absoluteThreshold != null && duration > absoluteThreshold) {
                anomalies.add(base(sample)
                        .threshold(absoluteThreshold)
                        .detectionMethod(DetectionMethod.ABSOLUTE_THRESHOLD)
                        .score(StatisticsKernel.relativeExcess(duration, absoluteThreshold))
                        .details(String.format("Duration %.2f exceeds absolute threshold %.2f",
                                duration, absoluteThreshold))
                        .build());
            }

            if (stdDev != 0) {
                double zScore = StatisticsKernel.zScore(duration, mean, stdDev);
                if (Math.abs(zScore) > zThreshold) {
                    anomalies.add(base(sample)
                            .expectedValue(mean)
                            .zScore(zScore)
                            .threshold(zThreshold)
                            .detectionMethod(DetectionMethod.DURATION_Z_SCORE)
                            .score(Math.abs(zScore))
                            .details(String.format("Duration %.2f has z-score of %.2f (mean %.2f)",
                                    duration, zScore, mean))
                            .build());
                }
            }

            if (duration > percentile) {
                anomalies.add(base(sample)
                        .threshold(percentile)
                        .detectionMethod(DetectionMethod.DURATION_PERCENTILE)
                        .score(StatisticsKernel.relativeExcess(duration, percentile))
                        .details(String.format("Duration %.2f exceeds p%.0f (%.2f)",
                                duration, options.getPercentileThreshold(), percentile))
                        .build());
            }

            if (bounds.isOutside(duration)) {
                double bound = bounds.crossedBound(duration);
                anomalies.add(base(sample)
                        .expectedValue(mean)
                        .threshold(bound)
                        .detectionMethod(DetectionMethod.DURATION_IQR)
                        .score(StatisticsKernel.relativeExcess(duration, bound))
                        .details(String.format("Duration %.2f is outside IQR bounds [%.2f, %.2f]",
                                duration, bounds.getLower(), bounds.getUpper()))
                        .build());
            }
        }
        return anomalies;
    }

    private static Anomaly.Builder base(DurationSample sample) {
        return Anomaly.builder()
                .timestamp(sample.getTimestamp())
                .subject(sample.getOperation())
                .value(sample.getDuration())
                .service(sample.getService())
                .operation(sample.getOperation())
                .traceId(sample.getTraceId())
                .spanId(sample.getSubjectId());
    }
}
