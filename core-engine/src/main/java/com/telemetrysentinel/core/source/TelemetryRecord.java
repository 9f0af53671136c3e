package com.telemetrysentinel.core.source;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A stored telemetry document (log line, metric document or span).
 *
 * <p>
 * Documents are free-form, so the record keeps every property in a
 * {@link Map}. Field lookups accept dotted paths: {@code service.name}
 * matches either a flat key {@code "service.name"} or a nested object
 * {@code {"service": {"name": ...}}}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Records are filled once by their producer and only read afterwards; they are
 * <strong>not</strong> safe for concurrent mutation.
 * </p>
 *
 * <p>
 * Only the raw fields take part in JSON binding; the typed accessors are
 * views over them.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class TelemetryRecord {

    /** Keys consulted, in order, for the record timestamp. */
    static final List<String> TIMESTAMP_FIELDS = List.of("@timestamp", "timestamp");

    /** Keys consulted, in order, for the emitting service. */
    static final List<String> SERVICE_FIELDS =
            List.of("service.name", "resource.attributes.service.name", "Resource.service.name", "service");

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /** Explicit timestamp; overrides the timestamp fields when set. */
    private Instant timestamp;

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the JSON key; must not be {@code null}
     * @param value the JSON value
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable view of all fields
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * Retrieve a field value by flat key or dotted path.
     *
     * @param fieldName the key or path
     * @return the value, or empty if not present
     */
    public Optional<Object> getField(String fieldName) {
        if (fields.containsKey(fieldName)) {
            return Optional.ofNullable(fields.get(fieldName));
        }
        Object current = fields;
        for (String part : fieldName.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(part);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Retrieve a numeric field, coercing numbers and numeric strings.
     *
     * @param fieldName the key or path
     * @return the value as a {@code double}, or empty if missing, non-numeric
     *         or not finite
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = getField(fieldName).orElse(null);
        Double parsed = null;
        if (raw instanceof Number n) {
            parsed = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                parsed = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return parsed != null && Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
    }

    /**
     * @param fieldName the key or path
     * @return the value's string form, or empty if missing
     */
    public Optional<String> getStringField(String fieldName) {
        return getField(fieldName).map(Object::toString);
    }

    /**
     * @return the first non-blank service label found, or empty
     */
    public Optional<String> getService() {
        for (String key : SERVICE_FIELDS) {
            Optional<String> value = getStringField(key).filter(s -> !s.isBlank());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public Optional<String> getTraceId() {
        return firstString("traceId", "trace.id", "trace_id");
    }

    public Optional<String> getSpanId() {
        return firstString("spanId", "span.id", "span_id");
    }

    // ---------------------------------------------------------------
    // Timestamp
    // ---------------------------------------------------------------

    /**
     * The record timestamp: the explicit one if set, else the first parseable
     * {@code @timestamp} / {@code timestamp} field (ISO-8601 text or epoch
     * milliseconds).
     *
     * @return the timestamp, or {@code null} if none can be determined
     */
    public Instant getTimestamp() {
        if (timestamp != null) {
            return timestamp;
        }
        for (String key : TIMESTAMP_FIELDS) {
            Object raw = fields.get(key);
            if (raw instanceof Number n) {
                return Instant.ofEpochMilli(n.longValue());
            }
            if (raw instanceof String s) {
                Optional<Instant> parsed = parseInstant(s);
                if (parsed.isPresent()) {
                    return parsed.get();
                }
            }
        }
        return null;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    private static Optional<Instant> parseInstant(String text) {
        try {
            return Optional.of(Instant.parse(text.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Optional<String> firstString(String... keys) {
        for (String key : keys) {
            Optional<String> value = getStringField(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return Objects.equals(fields, that.fields) && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, timestamp);
    }

    @Override
    public String toString() {
        return "TelemetryRecord" + fields;
    }
}
