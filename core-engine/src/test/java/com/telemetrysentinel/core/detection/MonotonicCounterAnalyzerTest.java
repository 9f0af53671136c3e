package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.config.SubjectSelection;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.source.InMemoryTelemetrySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MonotonicCounterAnalyzer}.
 */
class MonotonicCounterAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String METRIC = "jobs.completed";

    private MonotonicCounterAnalyzer analyzer;
    private DetectionOptions options;

    @BeforeEach
    void setUp() {
        analyzer = new MonotonicCounterAnalyzer();
        options = new DetectionOptions();
    }

    @Test
    @DisplayName("A counter that stops for one interval should be reported as a plateau")
    void shouldReportPlateau() {
        List<Anomaly> anomalies = analyzer.analyze(METRIC, "worker", series(0, 60, 120, 180, 180, 240, 300), options);

        assertThat(anomalies).hasSize(1);
        Anomaly plateau = anomalies.get(0);
        assertThat(plateau.getDetectionMethod()).isEqualTo(DetectionMethod.PLATEAU);
        assertThat(plateau.getTimestamp()).isEqualTo(minute(4));
        assertThat(plateau.getValue()).isEqualTo(180.0);
        assertThat(plateau.getExpectedValue()).isCloseTo(230.0, within(1e-9));
        assertThat(plateau.getThreshold()).isEqualTo(0.0);
        assertThat(plateau.getScore()).isEqualTo(1.0);
        assertThat(plateau.getService()).isEqualTo("worker");
        assertThat(plateau.getZScore()).isNull();
    }

    @Test
    @DisplayName("A sudden burst should fire the rate z-score and rate percentile criteria")
    void shouldFlagRateBurst() {
        double[] values = new double[21];
        for (int i = 1; i < values.length; i++) {
            values[i] = values[i - 1] + (i == 10 ? 600 : 60);
        }

        List<Anomaly> anomalies = analyzer.analyze(METRIC, null, series(values), options);

        assertThat(anomalies).extracting(Anomaly::getDetectionMethod)
                .containsExactly(DetectionMethod.RATE_Z_SCORE, DetectionMethod.RATE_PERCENTILE);
        assertThat(anomalies).extracting(Anomaly::getTimestamp).containsOnly(minute(10));
        assertThat(anomalies).extracting(Anomaly::getValue).containsOnly(10.0);

        Anomaly z = anomalies.get(0);
        assertThat(z.getZScore()).isCloseTo(Math.sqrt(19), within(1e-9));
        assertThat(z.getExpectedValue()).isCloseTo(1.45, within(1e-9));

        Anomaly percentile = anomalies.get(1);
        assertThat(percentile.getThreshold()).isEqualTo(1.0);
        assertThat(percentile.getScore()).isCloseTo(9.0, within(1e-9));
        assertThat(percentile.getExpectedValue()).isNull();
    }

    @Test
    @DisplayName("A steadily growing counter should produce nothing")
    void shouldNotFlagSteadyGrowth() {
        assertThat(analyzer.analyze(METRIC, null, series(0, 60, 120, 180, 240, 300), options)).isEmpty();
    }

    @Test
    @DisplayName("Counters that never passed one should not plateau")
    void shouldIgnoreStallsOfTinyCounters() {
        assertThat(analyzer.analyze(METRIC, null, series(0, 0, 0, 1, 2), options)).isEmpty();
    }

    @Test
    @DisplayName("Should skip series with too few points or too few usable rates")
    void shouldSkipShortSeries() {
        List<MetricSample> fourValid = new ArrayList<>(series(10, 20, 20, 30));
        fourValid.add(new MetricSample(minute(4), Double.NaN));
        assertThat(analyzer.analyze(METRIC, null, fourValid, options)).isEmpty();

        List<MetricSample> sameInstant = List.of(
                MetricSample.of(T0, 10.0),
                MetricSample.of(T0, 10.0),
                MetricSample.of(T0, 10.0),
                MetricSample.of(minute(1), 10.0),
                MetricSample.of(minute(2), 10.0));
        assertThat(analyzer.analyze(METRIC, null, sameInstant, options)).isEmpty();
    }

    @Test
    @DisplayName("detect() should read each configured monotonic counter per service")
    void detectShouldReadCounterSeries() {
        InMemoryTelemetrySource source = InMemoryTelemetrySource.builder()
                .metricSeries(METRIC, "worker-a", series(0, 60, 120, 180, 180, 240, 300))
                .metricSeries(METRIC, "worker-b", series(0, 60, 120, 180, 240, 300, 360))
                .build();
        SubjectSelection subjects = new SubjectSelection();
        subjects.setMonotonicMetrics(List.of(METRIC));
        subjects.setServices(List.of("worker-a", "worker-b"));
        DetectionRequest request = DetectionRequest.builder()
                .analysisRange(TimeRange.of(T0, T0.plus(Duration.ofHours(1))))
                .subjects(subjects)
                .options(options)
                .build();

        List<Anomaly> anomalies = analyzer.detect(source, request);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getService()).isEqualTo("worker-a");
        assertThat(anomalies.get(0).getSubject()).isEqualTo(METRIC);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant minute(int i) {
        return T0.plus(Duration.ofMinutes(i));
    }

    private static List<MetricSample> series(double... values) {
        List<MetricSample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            samples.add(MetricSample.of(minute(i), values[i]));
        }
        return samples;
    }
}
