package com.telemetrysentinel.runner;

import com.telemetrysentinel.core.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunnerConfig}.
 */
class RunnerConfigTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-05-01T11:00:00Z");

    @Test
    @DisplayName("Builder should apply defaults")
    void shouldApplyDefaults() {
        RunnerConfig config = new RunnerConfig.Builder().analysisEnd(END).build();

        assertThat(config.getDatasetPath()).isEqualTo("dataset.json");
        assertThat(config.getDetectionConfigPath()).isEmpty();
        assertThat(config.getOutputPath()).isEmpty();
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getAnalysisStart()).isEqualTo(END.minus(RunnerConfig.DEFAULT_ANALYSIS_WINDOW));
    }

    @Test
    @DisplayName("A missing end should default to now")
    void shouldDefaultEndToNow() {
        Instant before = Instant.now();
        RunnerConfig config = new RunnerConfig.Builder().build();

        assertThat(config.getAnalysisEnd()).isAfterOrEqualTo(before);
        assertThat(Duration.between(config.getAnalysisStart(), config.getAnalysisEnd()))
                .isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should expose the analysis window as a range")
    void shouldExposeAnalysisRange() {
        RunnerConfig config = new RunnerConfig.Builder()
                .datasetPath("/data/telemetry.json")
                .analysisStart(START)
                .analysisEnd(END)
                .workerThreads(2)
                .build();

        assertThat(config.analysisRange()).isEqualTo(TimeRange.of(START, END));
        assertThat(config.toString()).contains("/data/telemetry.json").contains("workerThreads=2");
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new RunnerConfig.Builder().datasetPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("datasetPath");
        assertThatThrownBy(() -> new RunnerConfig.Builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> new RunnerConfig.Builder().analysisStart(END).analysisEnd(START).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analysisEnd must be after analysisStart");
    }
}
