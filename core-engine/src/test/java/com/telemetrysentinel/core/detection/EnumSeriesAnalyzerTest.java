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
 * Unit tests for {@link EnumSeriesAnalyzer}.
 */
class EnumSeriesAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String METRIC = "circuit.state";

    private EnumSeriesAnalyzer analyzer;
    private DetectionOptions options;

    @BeforeEach
    void setUp() {
        analyzer = new EnumSeriesAnalyzer();
        options = new DetectionOptions();
    }

    @Test
    @DisplayName("Should flag a state seen once in forty points and the rare changes into states")
    void shouldFlagRareValueAndTransitions() {
        List<Anomaly> anomalies = analyzer.analyze(METRIC, "payments", states(), options);

        assertThat(anomalies).extracting(Anomaly::getDetectionMethod).containsExactly(
                DetectionMethod.RARE_VALUE,
                DetectionMethod.RARE_TRANSITION,
                DetectionMethod.RARE_TRANSITION);

        Anomaly rare = anomalies.get(0);
        assertThat(rare.getTimestamp()).isEqualTo(minute(39));
        assertThat(rare.getValue()).isEqualTo(2.0);
        assertThat(rare.getThreshold()).isEqualTo(0.05);
        assertThat(rare.getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(rare.getExpectedValue()).isNull();
        assertThat(rare.getDetails()).startsWith("Rare value 2 detected");

        Anomaly open = anomalies.get(1);
        assertThat(open.getTimestamp()).isEqualTo(minute(20));
        assertThat(open.getValue()).isEqualTo(1.0);
        assertThat(open.getExpectedValue()).isEqualTo(0.0);
        assertThat(open.getThreshold()).isEqualTo(0.03);
        assertThat(open.getScore()).isCloseTo((0.03 - 1.0 / 39) / 0.03, within(1e-9));

        Anomaly escalate = anomalies.get(2);
        assertThat(escalate.getTimestamp()).isEqualTo(minute(39));
        assertThat(escalate.getExpectedValue()).isEqualTo(1.0);
        assertThat(escalate.getDeviation()).isEqualTo(1.0);

        assertThat(anomalies).extracting(Anomaly::getService).containsOnly("payments");
    }

    @Test
    @DisplayName("With few points no value or change can be rare")
    void shouldNotFlagShortHistories() {
        assertThat(analyzer.analyze(METRIC, null, series(0, 0, 0, 0, 0, 0, 0, 0, 0, 3), options)).isEmpty();
    }

    @Test
    @DisplayName("Should skip series with fewer than five valid points")
    void shouldSkipShortSeries() {
        List<MetricSample> samples = new ArrayList<>(series(0, 1, 0, 1));
        samples.add(new MetricSample(minute(4), null));

        assertThat(analyzer.analyze(METRIC, null, samples, options)).isEmpty();
    }

    @Test
    @DisplayName("detect() should read each configured state metric over the analysis window")
    void detectShouldReadStateSeries() {
        InMemoryTelemetrySource source = InMemoryTelemetrySource.builder()
                .metricSeries(METRIC, "payments", states())
                .build();
        SubjectSelection subjects = new SubjectSelection();
        subjects.setEnumMetrics(List.of(METRIC));
        DetectionRequest request = DetectionRequest.builder()
                .analysisRange(TimeRange.of(T0, T0.plus(Duration.ofHours(1))))
                .subjects(subjects)
                .options(options)
                .build();

        List<Anomaly> anomalies = analyzer.detect(source, request);

        assertThat(anomalies).hasSize(3);
        assertThat(anomalies).extracting(Anomaly::getSubject).containsOnly(METRIC);
        assertThat(anomalies).extracting(Anomaly::getService).containsOnly((String) null);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Twenty 0s, nineteen 1s, then a single 2. */
    private static List<MetricSample> states() {
        double[] values = new double[40];
        for (int i = 20; i < 39; i++) {
            values[i] = 1;
        }
        values[39] = 2;
        return series(values);
    }

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
