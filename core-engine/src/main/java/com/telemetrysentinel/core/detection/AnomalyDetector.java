package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.AnalysisMethod;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.source.TelemetrySource;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every call fetches what it
 * needs from the {@link TelemetrySource} and then runs a pure computation, so
 * one instance may serve concurrent calls.
 * </p>
 * <p>
 * Insufficient or degenerate data yields an empty list, never an error.
 * Failures of the source propagate unchanged.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Run this detector for every subject named in the request.
     *
     * @param source  telemetry to read
     * @param request windows, subjects and thresholds
     * @return anomalies in no particular order
     */
    List<Anomaly> detect(TelemetrySource source, DetectionRequest request);

    /**
     * Return the analysis method this detector implements.
     *
     * @return analysis method
     */
    AnalysisMethod getMethod();
}
