package com.telemetrysentinel.core.source;

import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.model.MetricSample;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.model.WindowStatistics;

import java.util.List;
import java.util.Set;

/**
 * Read-only access to stored telemetry.
 *
 * <p>
 * This is the only collaborator of the detection core. How data is stored,
 * queried or mapped onto field names is entirely the implementation's concern.
 * Implementations must be safe to call from several threads at once, because
 * the engine runs detectors concurrently.
 * </p>
 *
 * <p>
 * Every method may throw {@link TelemetrySourceException}; the core passes
 * such failures to its caller unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public interface TelemetrySource {

    /**
     * Fetch a counter metric as one value per time bucket.
     *
     * @param metric  metric name
     * @param range   window to read
     * @param groupBy service to restrict the series to, or {@code null} for the
     *                series aggregated over all services
     * @return samples in ascending timestamp order
     */
    List<MetricSample> fetchCounterSeries(String metric, TimeRange range, String groupBy);

    /**
     * Fetch a gauge metric as one value per time bucket.
     *
     * <p>
     * The default reads it the same way as a counter series; sources that store
     * gauges differently override this.
     * </p>
     *
     * @see #fetchCounterSeries(String, TimeRange, String)
     */
    default List<MetricSample> fetchGaugeSeries(String metric, TimeRange range, String groupBy) {
        return fetchCounterSeries(metric, range, groupBy);
    }

    /**
     * Summarize the distribution of a numeric field over a window.
     *
     * @param field           field name
     * @param range           window to summarize
     * @param percentileRanks percentile ranks the caller needs
     * @return statistics; {@link WindowStatistics#empty()} when no value exists
     */
    WindowStatistics fetchFieldWindowStatistics(String field, TimeRange range, Set<Double> percentileRanks);

    /**
     * Fetch the records whose field value is most extreme in one direction.
     *
     * @param field     field name
     * @param range     window to search
     * @param direction which end of the distribution to read
     * @param limit     maximum number of records
     * @return at most {@code limit} records, most extreme first
     */
    List<TelemetryRecord> fetchExemplars(String field, TimeRange range, ExemplarDirection direction, int limit);

    /**
     * Fetch span durations.
     *
     * @param range   window to read
     * @param filters service / operation restrictions
     * @return samples in no particular order
     */
    List<DurationSample> fetchDurationSamples(TimeRange range, DurationFilter filters);
}
