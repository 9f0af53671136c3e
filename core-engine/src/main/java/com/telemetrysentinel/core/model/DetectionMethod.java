package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The criterion that produced an {@link Anomaly}.
 *
 * <p>
 * Each constant declares which optional numeric fields an anomaly of that
 * kind carries. {@link Anomaly.Builder#build()} rejects anomalies that do not
 * match, so consumers can rely on the method alone to know what is populated.
 * </p>
 *
 * <table>
 * <caption>Field population per method</caption>
 * <tr><th>method</th><th>expectedValue / deviation</th><th>zScore</th></tr>
 * <tr><td>reset</td><td>yes (deviation is always -1)</td><td>no</td></tr>
 * <tr><td>rate-z-score, reset-interval</td><td>yes</td><td>yes</td></tr>
 * <tr><td>statistical-z-score, duration-z-score, gauge-z-score</td><td>yes</td><td>yes</td></tr>
 * <tr><td>duration-iqr, gauge-iqr, gauge-change-rate, plateau,
 * rare-transition</td><td>yes</td><td>no</td></tr>
 * <tr><td>statistical-percentile, duration-percentile, gauge-percentile,
 * rate-percentile, rare-value, absolute-threshold</td><td>no</td><td>no</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    RESET("reset", true, false),
    RATE_Z_SCORE("rate-z-score", true, true),
    RESET_INTERVAL("reset-interval", true, true),
    STATISTICAL_Z_SCORE("statistical-z-score", true, true),
    STATISTICAL_PERCENTILE("statistical-percentile", false, false),
    ABSOLUTE_THRESHOLD("absolute-threshold", false, false),
    DURATION_Z_SCORE("duration-z-score", true, true),
    DURATION_PERCENTILE("duration-percentile", false, false),
    DURATION_IQR("duration-iqr", true, false),
    GAUGE_Z_SCORE("gauge-z-score", true, true),
    GAUGE_PERCENTILE("gauge-percentile", false, false),
    GAUGE_IQR("gauge-iqr", true, false),
    GAUGE_CHANGE_RATE("gauge-change-rate", true, false),
    PLATEAU("plateau", true, false),
    RATE_PERCENTILE("rate-percentile", false, false),
    RARE_VALUE("rare-value", false, false),
    RARE_TRANSITION("rare-transition", true, false);

    private final String label;
    private final boolean carriesExpectedValue;
    private final boolean carriesZScore;

    DetectionMethod(String label, boolean carriesExpectedValue, boolean carriesZScore) {
        this.label = label;
        this.carriesExpectedValue = carriesExpectedValue;
        this.carriesZScore = carriesZScore;
    }

    /**
     * @return the wire label, e.g. {@code duration-iqr}
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @return {@code true} if anomalies of this kind carry
     *         {@code expectedValue} and {@code deviation}
     */
    public boolean carriesExpectedValue() {
        return carriesExpectedValue;
    }

    /**
     * @return {@code true} if anomalies of this kind carry a {@code zScore}
     */
    public boolean carriesZScore() {
        return carriesZScore;
    }

    /**
     * Resolve a method from its wire label (case-insensitive).
     *
     * @param label e.g. {@code rate-z-score}
     * @return the matching method
     * @throws IllegalArgumentException if no method has that label
     */
    public static DetectionMethod fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (DetectionMethod method : values()) {
                if (method.label.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detection method: '" + label + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
