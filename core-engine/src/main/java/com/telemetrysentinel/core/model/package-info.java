/**
 * Domain model shared by the detectors, the aggregator and their callers.
 *
 * <ul>
 * <li>{@link com.telemetrysentinel.core.model.Anomaly}: one flagged
 * observation, tagged with its
 * {@link com.telemetrysentinel.core.model.DetectionMethod}</li>
 * <li>{@link com.telemetrysentinel.core.model.WindowStatistics}: per-call
 * summary of a distribution</li>
 * <li>{@link com.telemetrysentinel.core.model.MetricSample} and
 * {@link com.telemetrysentinel.core.model.DurationSample}: input samples</li>
 * <li>{@link com.telemetrysentinel.core.model.DetectionResult}: ranked and
 * grouped output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.model;
