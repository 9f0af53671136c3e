package com.telemetrysentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary statistics of one numeric distribution over one window.
 *
 * <p>
 * Computed per call and never persisted. Percentiles are keyed by rank
 * (e.g. {@code 95.0}); only the ranks requested from the producer are present.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final WindowStatistics EMPTY =
            new WindowStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Map.of());

    private final long count;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final SortedMap<Double, Double> percentiles;

    /**
     * @param count       number of values summarized
     * @param mean        arithmetic mean
     * @param stdDev      population standard deviation
     * @param min         smallest value
     * @param max         largest value
     * @param percentiles percentile rank to value; must not be {@code null}
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public WindowStatistics(long count, double mean, double stdDev, double min, double max,
            Map<Double, Double> percentiles) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        Objects.requireNonNull(percentiles, "percentiles must not be null");
        this.count = count;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.percentiles = Collections.unmodifiableSortedMap(new TreeMap<>(percentiles));
    }

    /**
     * Statistics of a window without any value.
     *
     * @return shared empty instance
     */
    public static WindowStatistics empty() {
        return EMPTY;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * @return unmodifiable view of all computed percentiles, ordered by rank
     */
    public SortedMap<Double, Double> getPercentiles() {
        return percentiles;
    }

    /**
     * Look up a computed percentile.
     *
     * @param rank percentile rank in {@code (0, 100]}
     * @return the value, or empty if that rank was not computed
     */
    public OptionalDouble percentile(double rank) {
        Double value = percentiles.get(rank);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * @param minimumCount floor required by the caller
     * @return {@code true} if at least {@code minimumCount} values were seen
     */
    public boolean hasAtLeast(long minimumCount) {
        return count >= minimumCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowStatistics that))
            return false;
        return count == that.count
                && Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && percentiles.equals(that.percentiles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, stdDev, min, max, percentiles);
    }

    @Override
    public String toString() {
        return "WindowStatistics{" +
                "count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", min=" + min +
                ", max=" + max +
                ", percentiles=" + percentiles +
                '}';
    }
}
