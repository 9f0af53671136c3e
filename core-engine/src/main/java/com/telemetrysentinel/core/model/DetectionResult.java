package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranked, grouped output of one detection call.
 *
 * <p>
 * {@link #getAnomalies()} is ordered by score (highest first). The grouped
 * views are partitions of that same list and preserve its order inside each
 * group. {@code byOperation} and {@code byService} are {@code null} when that
 * grouping was not requested.
 * </p>
 *
 * <p>
 * Only the properties marked {@link JsonProperty} are serialized; the method
 * partition is written keyed by wire label.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class DetectionResult {

    private final List<Anomaly> anomalies;
    private final int totalAnomalies;
    private final Map<DetectionMethod, List<Anomaly>> byMethod;
    private final Map<String, List<Anomaly>> byOperation;
    private final Map<String, List<Anomaly>> byService;

    /**
     * @param anomalies      ranked (and possibly truncated) anomalies
     * @param totalAnomalies number of anomalies before truncation
     * @param byMethod       anomalies partitioned by detection method
     * @param byOperation    anomalies partitioned by operation, or {@code null}
     * @param byService      anomalies partitioned by service, or {@code null}
     */
    public DetectionResult(List<Anomaly> anomalies, int totalAnomalies,
            Map<DetectionMethod, List<Anomaly>> byMethod,
            Map<String, List<Anomaly>> byOperation,
            Map<String, List<Anomaly>> byService) {
        this.anomalies = List.copyOf(Objects.requireNonNull(anomalies, "anomalies must not be null"));
        this.totalAnomalies = totalAnomalies;
        this.byMethod = freeze(Objects.requireNonNull(byMethod, "byMethod must not be null"));
        this.byOperation = byOperation != null ? freeze(byOperation) : null;
        this.byService = byService != null ? freeze(byService) : null;
    }

    private static <K> Map<K, List<Anomaly>> freeze(Map<K, List<Anomaly>> groups) {
        Map<K, List<Anomaly>> copy = new LinkedHashMap<>();
        groups.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Result of a call that produced nothing.
     *
     * @return empty result without optional groupings
     */
    public static DetectionResult empty() {
        return new DetectionResult(List.of(), 0, Map.of(), null, null);
    }

    @JsonProperty
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    /**
     * @return number of anomalies found, including any removed by
     *         {@code maxResults}
     */
    @JsonProperty
    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    /**
     * @return {@code true} if {@code maxResults} removed anomalies
     */
    public boolean isTruncated() {
        return totalAnomalies > anomalies.size();
    }

    public Map<DetectionMethod, List<Anomaly>> getByMethod() {
        return byMethod;
    }

    /**
     * @return the method partition keyed by wire label, for serialization
     */
    @JsonProperty("byMethod")
    public Map<String, List<Anomaly>> getByMethodLabel() {
        Map<String, List<Anomaly>> labelled = new LinkedHashMap<>();
        byMethod.forEach((method, list) -> labelled.put(method.getLabel(), list));
        return labelled;
    }

    @JsonProperty
    public Map<String, List<Anomaly>> getByOperation() {
        return byOperation;
    }

    @JsonProperty
    public Map<String, List<Anomaly>> getByService() {
        return byService;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomalies=" + anomalies.size() +
                ", totalAnomalies=" + totalAnomalies +
                ", methods=" + byMethod.keySet() +
                '}';
    }
}
