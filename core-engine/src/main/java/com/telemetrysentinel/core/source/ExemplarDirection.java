package com.telemetrysentinel.core.source;

/**
 * End of a distribution to draw exemplar records from.
 *
 * @since 1.0.0
 */
public enum ExemplarDirection {

    /** Largest values first. */
    HIGHEST,

    /** Smallest values first. */
    LOWEST;

    /**
     * @param deviation signed shift of the analysis window from its baseline
     * @return {@link #LOWEST} for a negative shift, {@link #HIGHEST} otherwise
     */
    public static ExemplarDirection of(double deviation) {
        return deviation < 0 ? LOWEST : HIGHEST;
    }
}
