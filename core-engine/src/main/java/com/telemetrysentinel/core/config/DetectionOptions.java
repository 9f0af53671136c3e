package com.telemetrysentinel.core.config;

import com.telemetrysentinel.core.model.AnalysisMethod;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tunable thresholds and switches for one detection run.
 *
 * <p>
 * Defaults: counter, statistical and duration methods, z-score threshold 3, 95th
 * percentile, IQR multiplier 1.5, absolute threshold disabled, unlimited
 * results, per-operation duration grouping, 50% reset drop, 50% gauge change,
 * 5 exemplars, 7 day baseline.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern LOOKBACK = Pattern.compile("(\\d+)\\s*([smhdw])");

    private List<String> methods = new ArrayList<>(List.of("counter", "statistical", "duration"));

    private double zScoreThreshold = 3.0;

    /** Percentile rank used by every percentile criterion. */
    private double percentileThreshold = 95.0;

    private double iqrMultiplier = 1.5;

    /** Duration cutoff; {@code null} disables the absolute criterion. */
    private Double absoluteThreshold;

    /** Cap on returned anomalies; {@code null} means unlimited. */
    private Integer maxResults;

    private boolean groupByOperation = true;

    /** Fractional change between consecutive gauge points that counts as sudden. */
    private double changeThreshold = 0.5;

    /** A counter value below {@code previous * resetDropRatio} is a reset. */
    private double resetDropRatio = 0.5;

    private int exemplarLimit = 5;

    /** Length of the baseline window, e.g. {@code 7d}, {@code 12h}. */
    private String baselineLookback = "7d";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every option holds a legal value.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (methods == null || methods.isEmpty()) {
            errors.add("'methods' must name at least one of: counter, statistical, duration, gauge, monotonic, enum");
        } else {
            for (String method : methods) {
                try {
                    AnalysisMethod.fromConfigName(method);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }
        if (!(zScoreThreshold > 0)) {
            errors.add("'zScoreThreshold' must be > 0, got: " + zScoreThreshold);
        }
        if (!(percentileThreshold > 0 && percentileThreshold <= 100)) {
            errors.add("'percentileThreshold' must be in (0, 100], got: " + percentileThreshold);
        }
        if (!(iqrMultiplier > 0)) {
            errors.add("'iqrMultiplier' must be > 0, got: " + iqrMultiplier);
        }
        if (absoluteThreshold != null && !Double.isFinite(absoluteThreshold)) {
            errors.add("'absoluteThreshold' must be finite, got: " + absoluteThreshold);
        }
        if (maxResults != null && maxResults < 1) {
            errors.add("'maxResults' must be >= 1, got: " + maxResults);
        }
        if (!(changeThreshold > 0)) {
            errors.add("'changeThreshold' must be > 0, got: " + changeThreshold);
        }
        if (!(resetDropRatio > 0 && resetDropRatio < 1)) {
            errors.add("'resetDropRatio' must be in (0, 1), got: " + resetDropRatio);
        }
        if (exemplarLimit < 1) {
            errors.add("'exemplarLimit' must be >= 1, got: " + exemplarLimit);
        }
        try {
            baselineLookbackDuration();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionOptions: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return the selected methods as an unmodifiable set
     * @throws IllegalArgumentException if a method name is unknown
     */
    public Set<AnalysisMethod> resolveMethods() {
        EnumSet<AnalysisMethod> resolved = EnumSet.noneOf(AnalysisMethod.class);
        for (String method : methods) {
            resolved.add(AnalysisMethod.fromConfigName(method));
        }
        return Collections.unmodifiableSet(resolved);
    }

    /**
     * Parse {@link #getBaselineLookback()}: a positive amount followed by
     * {@code s}, {@code m}, {@code h}, {@code d} or {@code w}.
     *
     * @return the baseline window length
     * @throws IllegalArgumentException if the text cannot be parsed
     */
    public Duration baselineLookbackDuration() {
        Matcher m = baselineLookback == null
                ? null
                : LOOKBACK.matcher(baselineLookback.trim().toLowerCase(Locale.ROOT));
        if (m == null || !m.matches() || Long.parseLong(m.group(1)) == 0) {
            throw new IllegalArgumentException(
                    "'baselineLookback' must look like 30m, 12h or 7d, got: '" + baselineLookback + "'");
        }
        long amount = Long.parseLong(m.group(1));
        return switch (m.group(2)) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> Duration.ofDays(amount * 7);
        };
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getMethods() {
        return methods;
    }

    public void setMethods(List<String> methods) {
        this.methods = methods != null ? new ArrayList<>(methods) : new ArrayList<>();
    }

    /**
     * Select methods by enum rather than by name.
     */
    public DetectionOptions withMethods(AnalysisMethod... selected) {
        List<String> names = new ArrayList<>();
        for (AnalysisMethod method : selected) {
            names.add(method.configName());
        }
        setMethods(names);
        return this;
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public void setZScoreThreshold(double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }

    public double getPercentileThreshold() {
        return percentileThreshold;
    }

    public void setPercentileThreshold(double percentileThreshold) {
        this.percentileThreshold = percentileThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public Double getAbsoluteThreshold() {
        return absoluteThreshold;
    }

    public void setAbsoluteThreshold(Double absoluteThreshold) {
        this.absoluteThreshold = absoluteThreshold;
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Integer maxResults) {
        this.maxResults = maxResults;
    }

    public boolean isGroupByOperation() {
        return groupByOperation;
    }

    public void setGroupByOperation(boolean groupByOperation) {
        this.groupByOperation = groupByOperation;
    }

    public double getChangeThreshold() {
        return changeThreshold;
    }

    public void setChangeThreshold(double changeThreshold) {
        this.changeThreshold = changeThreshold;
    }

    public double getResetDropRatio() {
        return resetDropRatio;
    }

    public void setResetDropRatio(double resetDropRatio) {
        this.resetDropRatio = resetDropRatio;
    }

    public int getExemplarLimit() {
        return exemplarLimit;
    }

    public void setExemplarLimit(int exemplarLimit) {
        this.exemplarLimit = exemplarLimit;
    }

    public String getBaselineLookback() {
        return baselineLookback;
    }

    public void setBaselineLookback(String baselineLookback) {
        this.baselineLookback = baselineLookback;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionOptions that))
            return false;
        return Double.compare(zScoreThreshold, that.zScoreThreshold) == 0
                && Double.compare(percentileThreshold, that.percentileThreshold) == 0
                && Double.compare(iqrMultiplier, that.iqrMultiplier) == 0
                && groupByOperation == that.groupByOperation
                && Double.compare(changeThreshold, that.changeThreshold) == 0
                && Double.compare(resetDropRatio, that.resetDropRatio) == 0
                && exemplarLimit == that.exemplarLimit
                && Objects.equals(methods, that.methods)
                && Objects.equals(absoluteThreshold, that.absoluteThreshold)
                && Objects.equals(maxResults, that.maxResults)
                && Objects.equals(baselineLookback, that.baselineLookback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(methods, zScoreThreshold, percentileThreshold, iqrMultiplier, absoluteThreshold,
                maxResults, groupByOperation, changeThreshold, resetDropRatio, exemplarLimit, baselineLookback);
    }

    @Override
    public String toString() {
        return "DetectionOptions{" +
                "methods=" + methods +
                ", zScoreThreshold=" + zScoreThreshold +
                ", percentileThreshold=" + percentileThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", absoluteThreshold=" + absoluteThreshold +
                ", maxResults=" + maxResults +
                ", groupByOperation=" + groupByOperation +
                ", changeThreshold=" + changeThreshold +
                ", resetDropRatio=" + resetDropRatio +
                ", exemplarLimit=" + exemplarLimit +
                ", baselineLookback='" + baselineLookback + '\'' +
                '}';
    }
}
