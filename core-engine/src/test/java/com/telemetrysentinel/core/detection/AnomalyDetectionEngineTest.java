package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionConfig;
import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.config.SubjectSelection;
import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.DetectionResult;
import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.model.WindowStatistics;
import com.telemetrysentinel.core.source.DurationFilter;
import com.telemetrysentinel.core.source.ExemplarDirection;
import com.telemetrysentinel.core.source.InMemoryTelemetrySource;
import com.telemetrysentinel.core.source.TelemetryRecord;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.source.TelemetrySourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link AnomalyDetectionEngine} over an in-memory source.
 */
class AnomalyDetectionEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final TimeRange ANALYSIS = TimeRange.of(T0, T0.plus(Duration.ofHours(1)));
    private static final String COUNTER = "http.server.requests";
    private static final String FIELD = "latency_ms";

    private InMemoryTelemetrySource source;
    private DetectionConfig config;

    @BeforeEach
    void setUp() {
        InMemoryTelemetrySource.Builder builder = InMemoryTelemetrySource.builder();

        double[] counter = { 100, 110, 121, 50, 60, 75 };
        for (int i = 0; i < counter.length; i++) {
            builder.metricPoint(COUNTER, "cart", T0.plus(Duration.ofMinutes(i)), counter[i]);
        }

        Instant baselineStart = T0.minus(Duration.ofHours(1));
        for (int i = 0; i < 20; i++) {
            builder.record(record(baselineStart.plusSeconds(60L * i), i % 2 == 0 ? 90 : 110, "cart", "b-" + i));
        }
        for (int i = 0; i < 5; i++) {
            builder.record(record(T0.plusSeconds(60L * i), 200, "cart", "trace-" + i));
            builder.record(record(T0.plusSeconds(60L * i + 30), 190, "checkout", "other-" + i));
        }

        double[] durations = { 10, 12, 11, 13, 1000 };
        for (int i = 0; i < durations.length; i++) {
            builder.durationSample(DurationSample.builder()
                    .subjectId("span-" + i)
                    .traceId("trace-" + i)
                    .service("cart")
                    .operation("checkout")
                    .duration(durations[i])
                    .timestamp(T0.plusSeconds(i))
                    .build());
        }
        source = builder.build();

        DetectionOptions options = new DetectionOptions();
        options.setAbsoluteThreshold(500.0);
        SubjectSelection subjects = new SubjectSelection();
        subjects.setCounterMetrics(List.of(COUNTER));
        subjects.setStatisticalFields(List.of(FIELD));
        config = new DetectionConfig();
        config.setOptions(options);
        config.setSubjects(subjects);
    }

    @Test
    @DisplayName("Should combine every selected method into one ranked result")
    void shouldCombineMethods() {
        DetectionResult result;
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source)) {
            result = engine.detect(config, ANALYSIS);
        }

        assertThat(result.getTotalAnomalies()).isEqualTo(4);
        assertThat(result.getAnomalies()).extracting(Anomaly::getDetectionMethod).containsExactly(
                DetectionMethod.DURATION_IQR,
                DetectionMethod.STATISTICAL_Z_SCORE,
                DetectionMethod.ABSOLUTE_THRESHOLD,
                DetectionMethod.RESET);
        assertThat(result.getByMethod()).containsOnlyKeys(
                DetectionMethod.DURATION_IQR,
                DetectionMethod.STATISTICAL_Z_SCORE,
                DetectionMethod.ABSOLUTE_THRESHOLD,
                DetectionMethod.RESET);
        assertThat(result.getByOperation()).containsOnlyKeys("checkout", AnomalyAggregator.UNKNOWN_GROUP);
        assertThat(result.getByService()).isNull();
    }

    @Test
    @DisplayName("Should rank monotonic counter and state anomalies in the same result")
    void shouldRunMonotonicAndEnumMethods() {
        InMemoryTelemetrySource.Builder builder = InMemoryTelemetrySource.builder();
        double[] completed = { 0, 60, 120, 180, 180, 240, 300 };
        for (int i = 0; i < completed.length; i++) {
            builder.metricPoint("jobs.completed", "worker", T0.plus(Duration.ofMinutes(i)), completed[i]);
        }
        for (int i = 0; i < 40; i++) {
            double state = i < 20 ? 0 : i < 39 ? 1 : 2;
            builder.metricPoint("circuit.state", "worker", T0.plus(Duration.ofMinutes(i)), state);
        }
        config.getOptions().withMethods(AnalysisMethod.MONOTONIC, AnalysisMethod.ENUM);
        config.getSubjects().setMonotonicMetrics(List.of("jobs.completed"));
        config.getSubjects().setEnumMetrics(List.of("circuit.state"));

        DetectionResult result;
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(builder.build())) {
            result = engine.detect(config, ANALYSIS);
        }

        assertThat(result.getAnomalies()).extracting(Anomaly::getDetectionMethod).containsExactly(
                DetectionMethod.PLATEAU,
                DetectionMethod.RARE_VALUE,
                DetectionMethod.RARE_TRANSITION,
                DetectionMethod.RARE_TRANSITION);
        assertThat(result.getAnomalies().get(2).getTimestamp()).isEqualTo(T0.plus(Duration.ofMinutes(20)));
        assertThat(result.getByOperation()).containsOnlyKeys(AnomalyAggregator.UNKNOWN_GROUP);
    }

    @Test
    @DisplayName("Should cap the result at maxResults")
    void shouldApplyMaxResults() {
        config.getOptions().setMaxResults(2);

        DetectionResult result;
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source, 2)) {
            result = engine.detect(config, ANALYSIS);
        }

        assertThat(result.getAnomalies()).hasSize(2);
        assertThat(result.getTotalAnomalies()).isEqualTo(4);
        assertThat(result.isTruncated()).isTrue();
    }

    @Test
    @DisplayName("Should group by service when several services are requested")
    void shouldGroupByServiceForSeveralServices() {
        config.getSubjects().setServices(List.of("cart", "checkout"));
        config.getOptions().withMethods(AnalysisMethod.DURATION);

        DetectionResult result;
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source)) {
            result = engine.detect(config, ANALYSIS);
        }

        assertThat(result.getByService()).containsOnlyKeys("cart");
        assertThat(result.getByService().get("cart")).hasSize(2);
    }

    @Test
    @DisplayName("Should run a single method synchronously")
    void shouldRunSingleMethod() {
        DetectionRequest request = DetectionRequest.fromConfig(config, ANALYSIS);

        List<Anomaly> anomalies;
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source)) {
            anomalies = engine.detect(AnalysisMethod.DURATION, request);
        }

        assertThat(anomalies).extracting(Anomaly::getDetectionMethod)
                .containsExactly(DetectionMethod.ABSOLUTE_THRESHOLD, DetectionMethod.DURATION_IQR);
    }

    @Test
    @DisplayName("A source failure should reach the caller unchanged")
    void shouldPropagateSourceFailure() {
        TelemetrySourceException failure = new TelemetrySourceException("backend unavailable");
        TelemetrySource failing = new FailingSource(failure);

        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(failing)) {
            assertThatThrownBy(() -> engine.detect(config, ANALYSIS)).isSameAs(failure);
        }
    }

    @Test
    @DisplayName("Closing the engine should leave a caller-managed executor running")
    void shouldNotShutDownCallerExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source, executor)) {
                assertThat(engine.detect(config, ANALYSIS).getTotalAnomalies()).isEqualTo(4);
            }
            assertThat(executor.isShutdown()).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should reject a non-positive worker count")
    void shouldRejectInvalidWorkerCount() {
        assertThatThrownBy(() -> new AnomalyDetectionEngine(source, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TelemetryRecord record(Instant timestamp, double value, String service, String traceId) {
        TelemetryRecord record = new TelemetryRecord();
        record.setField("@timestamp", timestamp.toString());
        record.setField(FIELD, value);
        record.setField("service.name", service);
        record.setField("traceId", traceId);
        return record;
    }

    /** Source whose every fetch fails with the same exception. */
    private static final class FailingSource implements TelemetrySource {
        private final TelemetrySourceException failure;

        private FailingSource(TelemetrySourceException failure) {
            this.failure = failure;
        }

        @Override
        public List<MetricSample> fetchCounterSeries(String metric, TimeRange range, String groupBy) {
            throw failure;
        }

        @Override
        public WindowStatistics fetchFieldWindowStatistics(String field, TimeRange range, Set<Double> ranks) {
            throw failure;
        }

        @Override
        public List<TelemetryRecord> fetchExemplars(String field, TimeRange range, ExemplarDirection direction,
                int limit) {
            throw failure;
        }

        @Override
        public List<DurationSample> fetchDurationSamples(TimeRange range, DurationFilter filters) {
            throw failure;
        }
    }
}
