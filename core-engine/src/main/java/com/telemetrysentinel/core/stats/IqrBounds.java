package com.telemetrysentinel.core.stats;

/**
 * Quartiles and Tukey fences computed by
 * {@link StatisticsKernel#iqrBounds(double[], double)}.
 *
 * @since 1.0.0
 */
public final class IqrBounds {

    private final double q1;
    private final double q3;
    private final double lower;
    private final double upper;

    IqrBounds(double q1, double q3, double lower, double upper) {
        this.q1 = q1;
        this.q3 = q3;
        this.lower = lower;
        this.upper = upper;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /**
     * @return {@code true} if {@code value} lies strictly outside the fences
     */
    public boolean isOutside(double value) {
        return value < lower || value > upper;
    }

    /**
     * @return the fence {@code value} crossed; meaningful only when
     *         {@link #isOutside(double)} holds
     */
    public double crossedBound(double value) {
        return value > upper ? upper : lower;
    }

    @Override
    public String toString() {
        return "IqrBounds{q1=" + q1 + ", q3=" + q3 + ", lower=" + lower + ", upper=" + upper + '}';
    }
}
