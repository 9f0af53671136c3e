package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.WindowStatistics;
import com.telemetrysentinel.core.source.ExemplarDirection;
import com.telemetrysentinel.core.source.TelemetryRecord;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.stats.StatisticsKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Compares the distribution of a numeric field in the analysis window with
 * the same field in an earlier baseline window.
 *
 * <p>
 * A field shifts when the analysis mean lies more than {@code zScoreThreshold}
 * baseline standard deviations from the baseline mean, or above the baseline's
 * {@code percentileThreshold} percentile. At most one anomaly is reported per
 * field, stamped with the start of the analysis window.
 * </p>
 *
 * <h3>Exemplars</h3>
 * <p>
 * For a flagged field the most extreme records of the analysis window, in the
 * direction of the shift, name the dominant service and the trace to look at.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * A field is skipped unless the baseline holds at least
 * {@value #MIN_BASELINE_COUNT} values, the analysis window at least
 * {@value #MIN_ANALYSIS_COUNT}, and the baseline is not constant.
 * </p>
 *
 * @since 1.0.0
 */
public class DistributionBaselineComparator implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DistributionBaselineComparator.class);

    static final long MIN_BASELINE_COUNT = 10;
    static final long MIN_ANALYSIS_COUNT = 5;

    @Override
    public List<Anomaly> detect(TelemetrySource source, DetectionRequest request) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(request, "request must not be null");

        DetectionOptions options = request.getOptions();
        Set<Double> ranks = Set.of(options.getPercentileThreshold());
        List<Anomaly> anomalies = new ArrayList<>();

        for (String field : request.getSubjects().getStatisticalFields()) {
            WindowStatistics baseline = source.fetchFieldWindowStatistics(field, request.getBaselineRange(), ranks);
            WindowStatistics analysis = source.fetchFieldWindowStatistics(field, request.getAnalysisRange(), ranks);

            Optional<Anomaly> flagged = analyze(field, baseline, analysis,
                    request.getAnalysisRange().getStart(), options);
            if (flagged.isPresent()) {
                ExemplarDirection direction = ExemplarDirection.of(analysis.getMean() - baseline.getMean());
                List<TelemetryRecord> exemplars = source.fetchExemplars(field, request.getAnalysisRange(),
                        direction, options.getExemplarLimit());
                anomalies.add(withExemplarContext(flagged.get(), exemplars));
            }
        }
        return anomalies;
    }

    @Override
    public AnalysisMethod getMethod() {
        return AnalysisMethod.STATISTICAL;
    }

    /**
     * Compare one field's analysis window against its baseline.
     *
     * @param field     field name, used as the anomaly subject
     * @param baseline  statistics of the baseline window
     * @param analysis  statistics of the analysis window
     * @param timestamp timestamp to report, normally the analysis window start
     * @param options   thresholds
     * @return the anomaly, or empty if the field did not shift or could not be
     *         evaluated
     */
    public Optional<Anomaly> analyze(String field, WindowStatistics baseline, WindowStatistics analysis,
            Instant timestamp, DetectionOptions options) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (!baseline.hasAtLeast(MIN_BASELINE_COUNT) || !analysis.hasAtLeast(MIN_ANALYSIS_COUNT)) {
            LOG.debug("Field '{}': baseline={} analysis={} value(s), need {}/{} – skipping",
                    field, baseline.getCount(), analysis.getCount(), MIN_BASELINE_COUNT, MIN_ANALYSIS_COUNT);
            return Optional.empty();
        }
        if (baseline.getStdDev() == 0) {
            LOG.debug("Field '{}': constant baseline – skipping", field);
            return Optional.empty();
        }

        double zThreshold = options.getZScoreThreshold();
        double zScore = StatisticsKernel.zScore(analysis.getMean(), baseline.getMean(), baseline.getStdDev());
        if (Math.abs(zScore) > zThreshold) {
            return Optional.of(Anomaly.builder()
                    .timestamp(timestamp)
                    .subject(field)
                    .value(analysis.getMean())
                    .expectedValue(baseline.getMean())
                    .zScore(zScore)
                    .threshold(zThreshold)
                    .detectionMethod(DetectionMethod.STATISTICAL_Z_SCORE)
                    .score(Math.abs(zScore))
                    .details(String.format(
                            "Mean of '%s' shifted from %.2f to %.2f (z-score: %.2f, threshold: %.1f)",
                            field, baseline.getMean(), analysis.getMean(), zScore, zThreshold))
                    .build());
        }

        OptionalDouble percentile = baseline.percentile(options.getPercentileThreshold());
        if (percentile.isPresent() && analysis.getMean() > percentile.getAsDouble()) {
            double bound = percentile.getAsDouble();
            return Optional.of(Anomaly.builder()
                    .timestamp(timestamp)
                    .subject(field)
                    .value(analysis.getMean())
                    .threshold(bound)
                    .detectionMethod(DetectionMethod.STATISTICAL_PERCENTILE)
                    .score(StatisticsKernel.relativeExcess(analysis.getMean(), bound))
                    .details(String.format(
                            "Mean of '%s' (%.2f) exceeds the baseline %sth percentile (%.2f)",
                            field, analysis.getMean(), formatRank(options.getPercentileThreshold()), bound))
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Attach the dominant service and the most extreme exemplar's ids.
     *
     * @param anomaly   flagged anomaly
     * @param exemplars records ordered most extreme first; may be empty
     * @return the anomaly with exemplar context, or the anomaly unchanged
     */
    static Anomaly withExemplarContext(Anomaly anomaly, List<TelemetryRecord> exemplars) {
        if (exemplars.isEmpty()) {
            return anomaly;
        }
        TelemetryRecord top = exemplars.get(0);
        return anomaly.toBuilder()
                .service(dominantService(exemplars))
                .traceId(top.getTraceId().orElse(null))
                .spanId(top.getSpanId().orElse(null))
                .build();
    }

    /**
     * Plurality vote over the exemplars' services; the first seen wins a tie.
     *
     * @return the dominant service, or {@code null} if no exemplar names one
     */
    static String dominantService(List<TelemetryRecord> exemplars) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (TelemetryRecord record : exemplars) {
            record.getService().ifPresent(service -> votes.merge(service, 1, Integer::sum));
        }
        String dominant = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        return dominant;
    }

    private static String formatRank(double rank) {
        return rank == Math.rint(rank) ? String.valueOf((long) rank) : String.valueOf(rank);
    }
}
