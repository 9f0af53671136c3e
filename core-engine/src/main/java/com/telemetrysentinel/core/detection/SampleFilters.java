package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes malformed samples before any statistic is computed.
 *
 * <p>
 * A missing or non-finite value never reaches the statistics kernel. Dropped
 * samples are counted and logged at {@code DEBUG}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SampleFilters {

    private static final Logger LOG = LoggerFactory.getLogger(SampleFilters.class);

    private SampleFilters() {
        // utility class, not instantiable
    }

    /**
     * Keep metric samples whose value is present and finite, in input order.
     *
     * @param samples raw series; must not be {@code null}
     * @return new list of valid samples
     */
    public static List<MetricSample> validMetricSamples(List<MetricSample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        List<MetricSample> valid = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            if (sample != null && sample.getValue() != null && Double.isFinite(sample.getValue())) {
                valid.add(sample);
            }
        }
        logDropped("metric", samples.size(), valid.size());
        return valid;
    }

    /**
     * Keep duration samples whose duration is present, finite and positive.
     *
     * @param samples raw spans; must not be {@code null}
     * @return new list of valid samples
     */
    public static List<DurationSample> validDurationSamples(List<DurationSample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        List<DurationSample> valid = new ArrayList<>(samples.size());
        for (DurationSample sample : samples) {
            if (sample != null && isValidDuration(sample.getDuration())) {
                valid.add(sample);
            }
        }
        logDropped("duration", samples.size(), valid.size());
        return valid;
    }

    static boolean isValidDuration(Double duration) {
        return duration != null && Double.isFinite(duration) && duration > 0;
    }

    private static void logDropped(String kind, int total, int kept) {
        if (kept < total) {
            LOG.debug("Dropped {} invalid {} sample(s) of {}", total - kept, kind, total);
        }
    }
}
