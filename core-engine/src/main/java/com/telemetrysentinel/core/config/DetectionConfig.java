package com.telemetrysentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * options:
 *   methods: [counter, statistical, duration]
 *   zScoreThreshold: 3
 *   absoluteThreshold: 500000000.0
 *   maxResults: 100
 * subjects:
 *   counterMetrics: [http.server.requests]
 *   statisticalFields: [latency_ms]
 *   services: [checkout, cart]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectionOptions options = new DetectionOptions();
    private SubjectSelection subjects = new SubjectSelection();

    public DetectionOptions getOptions() {
        return options;
    }

    public void setOptions(DetectionOptions options) {
        this.options = options != null ? options : new DetectionOptions();
    }

    public SubjectSelection getSubjects() {
        return subjects;
    }

    public void setSubjects(SubjectSelection subjects) {
        this.subjects = subjects != null ? subjects : new SubjectSelection();
    }

    /**
     * Validate the options and check that every selected method has something
     * to analyze.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (options == null) {
            options = new DetectionOptions();
        }
        if (subjects == null) {
            subjects = new SubjectSelection();
        }
        try {
            options.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        if (errors.isEmpty()) {
            options.resolveMethods().forEach(method -> {
                switch (method) {
                    case COUNTER -> {
                        if (subjects.getCounterMetrics().isEmpty()) {
                            errors.add("Method 'counter' requires 'subjects.counterMetrics'");
                        }
                    }
                    case GAUGE -> {
                        if (subjects.getGaugeMetrics().isEmpty()) {
                            errors.add("Method 'gauge' requires 'subjects.gaugeMetrics'");
                        }
                    }
                    case MONOTONIC -> {
                        if (subjects.getMonotonicMetrics().isEmpty()) {
                            errors.add("Method 'monotonic' requires 'subjects.monotonicMetrics'");
                        }
                    }
                    case ENUM -> {
                        if (subjects.getEnumMetrics().isEmpty()) {
                            errors.add("Method 'enum' requires 'subjects.enumMetrics'");
                        }
                    }
                    case STATISTICAL -> {
                        if (subjects.getStatisticalFields().isEmpty()) {
                            errors.add("Method 'statistical' requires 'subjects.statisticalFields'");
                        }
                    }
                    case DURATION -> {
                        // spans need no explicit subject
                    }
                }
            });
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "DetectionConfig{options=" + options + ", subjects=" + subjects + '}';
    }
}
