package com.telemetrysentinel.core.stats;

import com.telemetrysentinel.core.model.WindowStatistics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Numeric primitives shared by every detector.
 *
 * <p>
 * All functions are deterministic and side-effect free. None of them accepts
 * an empty input: callers enforce their own minimum sample counts first, and
 * an empty array here is a programming error.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsKernel {

    /** Percentile ranks computed by {@link #summarize(double[], double...)} when none are given. */
    public static final double[] DEFAULT_PERCENTILE_RANKS = {25, 50, 75, 90, 95, 99};

    private StatisticsKernel() {
        // utility class, not instantiable
    }

    /**
     * @param values at least one value
     * @return arithmetic mean
     */
    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation around a precomputed mean.
     *
     * @param values at least one value
     * @param mean   mean of {@code values}
     * @return {@code sqrt(avg((v - mean)^2))}
     */
    public static double stdDev(double[] values, double mean) {
        requireNonEmpty(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Nearest-rank percentile.
     *
     * @param sortedValues values in ascending order, at least one
     * @param p            percentile rank
     * @return {@code sortedValues[ceil(p * n / 100) - 1]}, index clamped to
     *         {@code [0, n - 1]}
     */
    public static double percentile(double[] sortedValues, double p) {
        requireNonEmpty(sortedValues);
        int n = sortedValues.length;
        int index = (int) Math.ceil(p * n / 100.0) - 1;
        index = Math.max(0, Math.min(n - 1, index));
        return sortedValues[index];
    }

    /**
     * Tukey fences around the interquartile range.
     *
     * @param sortedValues values in ascending order, at least one
     * @param multiplier   fence multiplier, usually 1.5
     * @return quartiles and fences
     */
    public static IqrBounds iqrBounds(double[] sortedValues, double multiplier) {
        double q1 = percentile(sortedValues, 25);
        double q3 = percentile(sortedValues, 75);
        double iqr = q3 - q1;
        return new IqrBounds(q1, q3, q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    /**
     * Standard score of a value.
     *
     * <p>
     * Returns {@code 0} when {@code stdDev == 0}. That is only a guard against
     * division by zero; callers must still treat a zero deviation as a reason
     * to skip z-score detection.
     * </p>
     *
     * @return {@code (value - mean) / stdDev}, or {@code 0}
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0) {
            return 0;
        }
        return (value - mean) / stdDev;
    }

    /**
     * Severity of a value beyond a positional bound.
     *
     * @return {@code |value - bound| / |bound|}, or {@code |value - bound|} when
     *         the bound is zero
     */
    public static double relativeExcess(double value, double bound) {
        double excess = Math.abs(value - bound);
        return bound == 0 ? excess : excess / Math.abs(bound);
    }

    /**
     * Sorted copy of the input.
     *
     * @param values values in any order
     * @return new ascending array
     */
    public static double[] sortedCopy(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Full summary of a distribution.
     *
     * @param values          at least one value, any order
     * @param percentileRanks ranks to compute; {@link #DEFAULT_PERCENTILE_RANKS}
     *                        when empty
     * @return statistics of {@code values}
     */
    public static WindowStatistics summarize(double[] values, double... percentileRanks) {
        requireNonEmpty(values);
        double[] sorted = sortedCopy(values);
        double mean = mean(values);
        double[] ranks = percentileRanks.length == 0 ? DEFAULT_PERCENTILE_RANKS : percentileRanks;
        Map<Double, Double> percentiles = new LinkedHashMap<>();
        for (double rank : ranks) {
            percentiles.put(rank, percentile(sorted, rank));
        }
        return new WindowStatistics(values.length, mean, stdDev(values, mean),
                sorted[0], sorted[sorted.length - 1], percentiles);
    }

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must contain at least one element");
        }
    }
}
