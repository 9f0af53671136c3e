package com.telemetrysentinel.runner;

import com.telemetrysentinel.core.model.TimeRange;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the detection runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so a
 * run is fully configurable from a shell, a cron job or a container.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    /** Analysis window length used when {@code ANALYSIS_START} is not set. */
    static final Duration DEFAULT_ANALYSIS_WINDOW = Duration.ofHours(1);

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final String datasetPath;
    private final String detectionConfigPath;

    // ---------------------------------------------------------------
    // Analysis window
    // ---------------------------------------------------------------
    private final Instant analysisStart;
    private final Instant analysisEnd;

    // ---------------------------------------------------------------
    // Output / execution
    // ---------------------------------------------------------------
    private final String outputPath;
    private final int workerThreads;

    private RunnerConfig(Builder b) {
        this.datasetPath = b.datasetPath;
        this.detectionConfigPath = b.detectionConfigPath;
        this.analysisEnd = b.analysisEnd != null ? b.analysisEnd : Instant.now();
        this.analysisStart = b.analysisStart != null ? b.analysisStart : analysisEnd.minus(DEFAULT_ANALYSIS_WINDOW);
        this.outputPath = b.outputPath;
        this.workerThreads = b.workerThreads;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        try {
            return new Builder()
                    .datasetPath(env("DATASET_PATH", "dataset.json"))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .analysisStart(parseInstantEnv("ANALYSIS_START"))
                    .analysisEnd(parseInstantEnv("ANALYSIS_END"))
                    .outputPath(env("OUTPUT_PATH", ""))
                    .workerThreads(Integer.parseInt(env("WORKER_THREADS", "4")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Failed to parse ISO-8601 instant environment variable: " + e.getParsedString(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDatasetPath() {
        return datasetPath;
    }

    /**
     * @return the YAML path, or blank to use the default resolution of
     *         {@link com.telemetrysentinel.core.config.ConfigLoader#load()}
     */
    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    public Instant getAnalysisStart() {
        return analysisStart;
    }

    public Instant getAnalysisEnd() {
        return analysisEnd;
    }

    public TimeRange analysisRange() {
        return TimeRange.of(analysisStart, analysisEnd);
    }

    /**
     * @return the report path, or blank to write to standard output
     */
    public String getOutputPath() {
        return outputPath;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank dataset path, worker threads &gt; 0, analysis end
     * after analysis start). A missing end defaults to now and a missing start
     * to one hour before the end.
     * </p>
     */
    public static class Builder {
        private String datasetPath = "dataset.json";
        private String detectionConfigPath = "";
        private Instant analysisStart;
        private Instant analysisEnd;
        private String outputPath = "";
        private int workerThreads = 4;

        public Builder datasetPath(String v) {
            this.datasetPath = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder analysisStart(Instant v) {
            this.analysisStart = v;
            return this;
        }

        public Builder analysisEnd(Instant v) {
            this.analysisEnd = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            requireNonBlank(datasetPath, "datasetPath");
            Objects.requireNonNull(detectionConfigPath, "detectionConfigPath required");
            Objects.requireNonNull(outputPath, "outputPath required");

            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            RunnerConfig config = new RunnerConfig(this);
            if (!config.analysisEnd.isAfter(config.analysisStart)) {
                throw new IllegalArgumentException("analysisEnd must be after analysisStart, got: ["
                        + config.analysisStart + ", " + config.analysisEnd + ")");
            }
            return config;
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static Instant parseInstantEnv(String name) {
        String value = env(name, "");
        return value.isEmpty() ? null : Instant.parse(value.trim());
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "datasetPath='" + datasetPath + '\'' +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                ", analysisStart=" + analysisStart +
                ", analysisEnd=" + analysisEnd +
                ", outputPath='" + outputPath + '\'' +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
