/**
 * Command-line batch runner for Telemetry Sentinel.
 *
 * <p>
 * This package loads a JSON telemetry dataset into the core's in-memory
 * source, runs the combined detection for one analysis window and writes the
 * ranked report as JSON.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.telemetrysentinel.runner.SentinelRunner}: main entry
 * point</li>
 * <li>{@link com.telemetrysentinel.runner.RunnerConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.telemetrysentinel.runner.DatasetLoader}: JSON dataset
 * reader</li>
 * <li>{@link com.telemetrysentinel.runner.DetectionReportSerializer}: JSON
 * report writer</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.runner;
