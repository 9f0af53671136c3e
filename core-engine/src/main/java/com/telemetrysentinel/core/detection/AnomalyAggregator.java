package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.DetectionResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Merges detector outputs into one ranked, grouped {@link DetectionResult}.
 *
 * <h3>Ranking</h3>
 * <p>
 * Score descending, then timestamp ascending. Remaining ties are broken by
 * subject, detection method and span id, so the output does not depend on the
 * order in which detectors finished.
 * </p>
 *
 * <p>
 * Only {@code maxResults} drops anomalies. Groups are views over the
 * (possibly truncated) ranked list and keep its order; a missing operation or
 * service is grouped under {@value #UNKNOWN_GROUP}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyAggregator {

    static final String UNKNOWN_GROUP = "unknown";

    /** Total order used to rank anomalies. */
    public static final Comparator<Anomaly> RANKING = Comparator
            .comparingDouble(Anomaly::getScore).reversed()
            .thenComparing(Anomaly::getTimestamp)
            .thenComparing(Anomaly::getSubject)
            .thenComparing(Anomaly::getDetectionMethod)
            .thenComparing(Anomaly::getSpanId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private AnomalyAggregator() {
        // utility class, not instantiable
    }

    /**
     * Merge, rank, truncate and group.
     *
     * @param batches          anomaly lists from any subset of detectors
     * @param maxResults       cap on returned anomalies, or {@code null}
     * @param groupByOperation whether to build the operation partition
     * @param groupByService   whether to build the service partition
     * @return the aggregated result
     * @throws IllegalArgumentException if {@code maxResults} is below 1
     */
    public static DetectionResult aggregate(Collection<? extends Collection<Anomaly>> batches, Integer maxResults,
            boolean groupByOperation, boolean groupByService) {
        Objects.requireNonNull(batches, "batches must not be null");
        if (maxResults != null && maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1, got: " + maxResults);
        }

        List<Anomaly> ranked = new ArrayList<>();
        batches.forEach(ranked::addAll);
        int total = ranked.size();
        ranked.sort(RANKING);
        if (maxResults != null && ranked.size() > maxResults) {
            ranked = ranked.subList(0, maxResults);
        }

        Map<DetectionMethod, List<Anomaly>> byMethod = new EnumMap<>(DetectionMethod.class);
        for (Anomaly anomaly : ranked) {
            byMethod.computeIfAbsent(anomaly.getDetectionMethod(), m -> new ArrayList<>()).add(anomaly);
        }

        return new DetectionResult(ranked, total, byMethod,
                groupByOperation ? groupBy(ranked, Anomaly::getOperation) : null,
                groupByService ? groupBy(ranked, Anomaly::getService) : null);
    }

    /**
     * @return a new list sorted by {@link #RANKING}
     */
    public static List<Anomaly> rank(Collection<Anomaly> anomalies) {
        List<Anomaly> ranked = new ArrayList<>(anomalies);
        ranked.sort(RANKING);
        return ranked;
    }

    private static Map<String, List<Anomaly>> groupBy(List<Anomaly> ranked, Function<Anomaly, String> key) {
        Map<String, List<Anomaly>> groups = new LinkedHashMap<>();
        for (Anomaly anomaly : ranked) {
            String group = key.apply(anomaly);
            groups.computeIfAbsent(group != null ? group : UNKNOWN_GROUP, g -> new ArrayList<>()).add(anomaly);
        }
        return groups;
    }
}
