/**
 * Configuration loading and validation for detection runs.
 *
 * <p>
 * Options and subjects are defined in YAML and loaded by
 * {@link com.telemetrysentinel.core.config.ConfigLoader} into a
 * {@link com.telemetrysentinel.core.config.DetectionConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.config;
