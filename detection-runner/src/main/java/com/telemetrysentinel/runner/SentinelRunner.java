package com.telemetrysentinel.runner;

import com.telemetrysentinel.core.config.ConfigLoader;
import com.telemetrysentinel.core.config.DetectionConfig;
import com.telemetrysentinel.core.detection.AnomalyDetectionEngine;
import com.telemetrysentinel.core.detection.DetectionRequest;
import com.telemetrysentinel.core.model.DetectionResult;
import com.telemetrysentinel.core.source.TelemetrySource;
import com.telemetrysentinel.core.source.TelemetrySourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for a one-shot detection run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON dataset (DATASET_PATH)
 *     → InMemoryTelemetrySource
 *     → AnomalyDetectionEngine (selected methods, concurrently)
 *     → DetectionReport
 *     → JSON (OUTPUT_PATH, or standard output)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Run settings are resolved from environment variables via
 * {@link RunnerConfig}; detection settings from YAML via {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelRunner.class);

    private SentinelRunner() {
        // entry point, not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment();
        LOG.info("Starting Telemetry Sentinel with config: {}", config);

        // 2. Run detection
        DetectionReport report = run(config, loadDetectionConfig(config));

        // 3. Write report
        DetectionReportSerializer serializer = new DetectionReportSerializer();
        if (config.getOutputPath().isBlank()) {
            serializer.write(report, System.out);
        } else {
            serializer.write(report, Path.of(config.getOutputPath()));
        }
    }

    // ---------------------------------------------------------------
    // Run assembly (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Load the dataset and run detection over the configured window.
     *
     * @throws TelemetrySourceException if the dataset cannot be read
     */
    static DetectionReport run(RunnerConfig config, DetectionConfig detectionConfig) {
        TelemetrySource source;
        try {
            source = new DatasetLoader().load(Path.of(config.getDatasetPath()));
        } catch (TelemetrySourceException e) {
            LOG.error("Telemetry source failed: {}", e.getMessage(), e);
            throw e;
        }
        return run(config, detectionConfig, source);
    }

    /**
     * Run detection against an already open source.
     */
    static DetectionReport run(RunnerConfig config, DetectionConfig detectionConfig, TelemetrySource source) {
        DetectionRequest request = DetectionRequest.fromConfig(detectionConfig, config.analysisRange());
        try (AnomalyDetectionEngine engine = new AnomalyDetectionEngine(source, config.getWorkerThreads())) {
            DetectionResult result = engine.detect(request);
            return new DetectionReport(request, result);
        } catch (TelemetrySourceException e) {
            LOG.error("Telemetry source failed during detection: {}", e.getMessage(), e);
            throw e;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionConfig loadDetectionConfig(RunnerConfig config) {
        String configPath = config.getDetectionConfigPath();
        if (configPath != null && !configPath.isBlank()) {
            return ConfigLoader.fromFile(configPath);
        }
        return ConfigLoader.load();
    }
}
