/**
 * Boundary between the detection core and telemetry storage.
 *
 * <p>
 * {@link com.telemetrysentinel.core.source.TelemetrySource} is the single
 * collaborator the engine reads from.
 * {@link com.telemetrysentinel.core.source.InMemoryTelemetrySource} answers it
 * from data already loaded into memory.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.source;
