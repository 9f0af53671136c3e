package com.telemetrysentinel.runner;

import com.telemetrysentinel.core.config.ConfigLoader;
import com.telemetrysentinel.core.config.DetectionConfig;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.source.TelemetrySourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the full pipeline over the bundled fixture dataset.
 */
class SentinelRunnerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-05-01T11:00:00Z");

    @TempDir
    Path dir;

    private Path dataset;
    private DetectionConfig detectionConfig;

    @BeforeEach
    void setUp() throws IOException {
        dataset = dir.resolve("dataset.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("dataset.json")) {
            Files.copy(in, dataset);
        }
        detectionConfig = ConfigLoader.fromClasspath("runner-detection.yml");
    }

    @Test
    @DisplayName("Should detect the reset, the mean shift and the slow span in the fixture")
    void shouldDetectFixtureAnomalies() {
        DetectionReport report = SentinelRunner.run(config(dataset), detectionConfig);

        assertThat(report.getAnalysisStart()).isEqualTo(START);
        assertThat(report.getAnalysisEnd()).isEqualTo(END);
        assertThat(report.getBaselineStart()).isEqualTo(Instant.parse("2024-04-30T10:00:00Z"));
        assertThat(report.getBaselineEnd()).isEqualTo(START);
        assertThat(report.getMethods()).containsExactly("counter", "statistical", "duration");

        assertThat(report.getResult().getTotalAnomalies()).isEqualTo(4);
        assertThat(report.getResult().getAnomalies()).extracting(Anomaly::getDetectionMethod).containsExactly(
                DetectionMethod.DURATION_IQR,
                DetectionMethod.STATISTICAL_Z_SCORE,
                DetectionMethod.ABSOLUTE_THRESHOLD,
                DetectionMethod.RESET);

        Anomaly shift = report.getResult().getAnomalies().get(1);
        assertThat(shift.getService()).isEqualTo("cart");
        assertThat(shift.getTraceId()).isEqualTo("trace-0");
        assertThat(shift.getSpanId()).isEqualTo("span-0");
    }

    @Test
    @DisplayName("Should fail with a source error when the dataset is missing")
    void shouldFailOnMissingDataset() {
        RunnerConfig config = config(dir.resolve("absent.json"));

        assertThatThrownBy(() -> SentinelRunner.run(config, detectionConfig))
                .isInstanceOf(TelemetrySourceException.class)
                .hasMessageContaining("absent.json");
    }

    @Test
    @DisplayName("Report written to a file should hold the ranked anomalies")
    void shouldWriteReportFile() throws IOException {
        DetectionReport report = SentinelRunner.run(config(dataset), detectionConfig);
        Path output = dir.resolve("report.json");

        new DetectionReportSerializer().write(report, output);

        String json = Files.readString(output);
        assertThat(json).contains("\"totalAnomalies\" : 4").contains("\"duration-iqr\"");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static RunnerConfig config(Path datasetPath) {
        return new RunnerConfig.Builder()
                .datasetPath(datasetPath.toString())
                .analysisStart(START)
                .analysisEnd(END)
                .workerThreads(2)
                .build();
    }
}
