/**
 * Statistical anomaly detectors and the combined detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.telemetrysentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.telemetrysentinel.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.telemetrysentinel.core.detection.CounterSeriesAnalyzer}:
 * counter resets, rates and reset intervals</li>
 * <li>{@link com.telemetrysentinel.core.detection.DistributionBaselineComparator}:
 * field distribution against a baseline window</li>
 * <li>{@link com.telemetrysentinel.core.detection.DurationOutlierDetector}:
 * span durations per operation</li>
 * <li>{@link com.telemetrysentinel.core.detection.GaugeSeriesAnalyzer}:
 * gauge outliers and sudden changes</li>
 * <li>{@link com.telemetrysentinel.core.detection.MonotonicCounterAnalyzer}:
 * stalled and unusually fast monotonic counters</li>
 * <li>{@link com.telemetrysentinel.core.detection.EnumSeriesAnalyzer}:
 * rare states and state changes</li>
 * </ul>
 *
 * <p>
 * {@link com.telemetrysentinel.core.detection.AnomalyDetectionEngine} runs the
 * selected detectors concurrently and merges their output with
 * {@link com.telemetrysentinel.core.detection.AnomalyAggregator}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new method, implement {@code AnomalyDetector}, add an
 * {@code AnalysisMethod} constant and map it in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.detection;
