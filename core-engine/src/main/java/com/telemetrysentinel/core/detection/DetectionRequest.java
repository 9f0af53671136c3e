package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.config.DetectionConfig;
import com.telemetrysentinel.core.config.DetectionOptions;
import com.telemetrysentinel.core.config.SubjectSelection;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.source.DurationFilter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One detection call: the window under analysis, the baseline window it is
 * compared against, the subjects to analyze and the thresholds to apply.
 *
 * <p>
 * When no baseline is given it is the window of length
 * {@link DetectionOptions#baselineLookbackDuration()} that ends where the
 * analysis window starts.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionRequest {

    private final TimeRange analysisRange;
    private final TimeRange baselineRange;
    private final SubjectSelection subjects;
    private final DetectionOptions options;

    private DetectionRequest(Builder builder) {
        this.analysisRange = Objects.requireNonNull(builder.analysisRange, "analysisRange must not be null");
        this.options = builder.options != null ? builder.options : new DetectionOptions();
        this.options.validate();
        this.subjects = builder.subjects != null ? builder.subjects : new SubjectSelection();
        this.baselineRange = builder.baselineRange != null
                ? builder.baselineRange
                : analysisRange.preceding(options.baselineLookbackDuration());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Bind a loaded configuration to a concrete analysis window.
     *
     * @param config        validated configuration
     * @param analysisRange window under analysis
     * @return request with the derived baseline window
     */
    public static DetectionRequest fromConfig(DetectionConfig config, TimeRange analysisRange) {
        Objects.requireNonNull(config, "config must not be null");
        return builder()
                .analysisRange(analysisRange)
                .options(config.getOptions())
                .subjects(config.getSubjects())
                .build();
    }

    public TimeRange getAnalysisRange() {
        return analysisRange;
    }

    public TimeRange getBaselineRange() {
        return baselineRange;
    }

    public SubjectSelection getSubjects() {
        return subjects;
    }

    public DetectionOptions getOptions() {
        return options;
    }

    /**
     * @return the span filter derived from the requested services and operation
     */
    public DurationFilter durationFilter() {
        return new DurationFilter(subjects.getServices(), subjects.getOperation());
    }

    /**
     * Service labels to fetch metric series for: each requested service, or a
     * single {@code null} entry meaning the series over all services.
     *
     * @return non-empty list
     */
    public List<String> seriesGroups() {
        List<String> services = subjects.getServices();
        return services.isEmpty() ? Collections.singletonList(null) : services;
    }

    @Override
    public String toString() {
        return "DetectionRequest{" +
                "analysis=" + analysisRange +
                ", baseline=" + baselineRange +
                ", subjects=" + subjects +
                '}';
    }

    /**
     * Fluent builder for {@link DetectionRequest}. Only the analysis range is
     * required.
     */
    public static class Builder {
        private TimeRange analysisRange;
        private TimeRange baselineRange;
        private SubjectSelection subjects;
        private DetectionOptions options;

        public Builder analysisRange(TimeRange analysisRange) {
            this.analysisRange = analysisRange;
            return this;
        }

        /**
         * Override the derived baseline window.
         */
        public Builder baselineRange(TimeRange baselineRange) {
            this.baselineRange = baselineRange;
            return this;
        }

        public Builder subjects(SubjectSelection subjects) {
            this.subjects = subjects;
            return this;
        }

        public Builder options(DetectionOptions options) {
            this.options = options;
            return this;
        }

        /**
         * @return the request
         * @throws NullPointerException  if the analysis range is missing
         * @throws IllegalStateException if the options are invalid
         */
        public DetectionRequest build() {
            return new DetectionRequest(this);
        }
    }
}
