package com.telemetrysentinel.runner;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.telemetrysentinel.core.detection.DetectionRequest;
import com.telemetrysentinel.core.model.DetectionResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * What the runner writes: the windows that were compared and the ranked
 * result.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "analysisStart", "analysisEnd", "baselineStart", "baselineEnd", "methods", "result" })
public final class DetectionReport {

    private final Instant analysisStart;
    private final Instant analysisEnd;
    private final Instant baselineStart;
    private final Instant baselineEnd;
    private final List<String> methods;
    private final DetectionResult result;

    public DetectionReport(DetectionRequest request, DetectionResult result) {
        Objects.requireNonNull(request, "request must not be null");
        this.analysisStart = request.getAnalysisRange().getStart();
        this.analysisEnd = request.getAnalysisRange().getEnd();
        this.baselineStart = request.getBaselineRange().getStart();
        this.baselineEnd = request.getBaselineRange().getEnd();
        this.methods = List.copyOf(request.getOptions().getMethods());
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public Instant getAnalysisStart() {
        return analysisStart;
    }

    public Instant getAnalysisEnd() {
        return analysisEnd;
    }

    public Instant getBaselineStart() {
        return baselineStart;
    }

    public Instant getBaselineEnd() {
        return baselineEnd;
    }

    public List<String> getMethods() {
        return methods;
    }

    public DetectionResult getResult() {
        return result;
    }

    @Override
    public String toString() {
        return "DetectionReport{analysis=[" + analysisStart + ", " + analysisEnd + "), " + result + '}';
    }
}
