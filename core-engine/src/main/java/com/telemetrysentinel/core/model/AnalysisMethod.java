package com.telemetrysentinel.core.model;

import java.util.Locale;

/**
 * Families of detection a caller can select for a combined run.
 *
 * @since 1.0.0
 */
public enum AnalysisMethod {

    /** Reset-aware rate analysis of counter series. */
    COUNTER,

    /** Baseline-vs-analysis comparison of numeric fields. */
    STATISTICAL,

    /** Span duration outliers per operation. */
    DURATION,

    /** Point outliers and sudden changes in gauge series. */
    GAUGE,

    /** Stalls and unusual rates in counters that never decrease. */
    MONOTONIC,

    /** Rare states and rare state changes in series with a few discrete values. */
    ENUM;

    /**
     * @return the lowercase configuration name, e.g. {@code counter}
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a method from its configuration name (case-insensitive).
     *
     * @param name e.g. {@code duration}
     * @return the matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnalysisMethod fromConfigName(String name) {
        if (name != null) {
            for (AnalysisMethod method : values()) {
                if (method.configName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown analysis method: '" + name
                + "'. Supported: counter, statistical, duration, gauge, monotonic, enum");
    }
}
