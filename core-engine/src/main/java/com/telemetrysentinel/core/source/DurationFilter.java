package com.telemetrysentinel.core.source;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Restrictions applied when fetching span durations.
 *
 * <p>
 * An empty service set means every service; a {@code null} operation means
 * every operation.
 * </p>
 *
 * @since 1.0.0
 */
public final class DurationFilter {

    private static final DurationFilter NONE = new DurationFilter(List.of(), null);

    private final Set<String> services;
    private final String operation;

    public DurationFilter(List<String> services, String operation) {
        Objects.requireNonNull(services, "services must not be null");
        this.services = Collections.unmodifiableSet(new LinkedHashSet<>(services));
        this.operation = operation;
    }

    public static DurationFilter none() {
        return NONE;
    }

    public Set<String> getServices() {
        return services;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return {@code true} if a span with these labels passes the filter
     */
    public boolean matches(String service, String spanOperation) {
        return (services.isEmpty() || services.contains(service))
                && (operation == null || operation.equals(spanOperation));
    }

    @Override
    public String toString() {
        return "DurationFilter{services=" + services + ", operation='" + operation + "'}";
    }
}
