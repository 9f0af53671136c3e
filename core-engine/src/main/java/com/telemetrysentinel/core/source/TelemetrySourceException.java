package com.telemetrysentinel.core.source;

/**
 * A {@link TelemetrySource} could not answer a fetch.
 *
 * <p>
 * The detection core does not retry or suppress this exception; retry policy
 * belongs to the source implementation.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetrySourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TelemetrySourceException(String message) {
        super(message);
    }

    public TelemetrySourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
