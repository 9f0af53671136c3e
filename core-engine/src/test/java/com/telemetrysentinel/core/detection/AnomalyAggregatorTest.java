package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyAggregator}.
 */
class AnomalyAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should keep the highest scores and report the pre-truncation total")
    void shouldTruncateToMaxResults() {
        List<Anomaly> batch = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            batch.add(percentile("latency_ms", T0, i, null, null));
        }

        DetectionResult result = AnomalyAggregator.aggregate(List.of(batch), 2, false, false);

        assertThat(result.getAnomalies()).extracting(Anomaly::getScore).containsExactly(10.0, 9.0);
        assertThat(result.getTotalAnomalies()).isEqualTo(10);
        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getByMethod().get(DetectionMethod.STATISTICAL_PERCENTILE)).hasSize(2);
    }

    @Test
    @DisplayName("Should merge batches and break score ties by timestamp, then subject")
    void shouldRankDeterministically() {
        Anomaly late = percentile("b", T0.plusSeconds(60), 2, null, null);
        Anomaly earlyB = percentile("b", T0, 2, null, null);
        Anomaly earlyA = percentile("a", T0, 2, null, null);
        Anomaly top = percentile("z", T0.plusSeconds(600), 5, null, null);

        DetectionResult result = AnomalyAggregator.aggregate(
                List.of(List.of(late, earlyB), List.of(earlyA, top)), null, false, false);

        assertThat(result.getAnomalies()).containsExactly(top, earlyA, earlyB, late);
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.getTotalAnomalies()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should group under 'unknown' when an anomaly has no operation or service")
    void shouldGroupUnknown() {
        Anomaly checkout = percentile("latency_ms", T0, 3, "cart", "checkout");
        Anomaly anonymous = percentile("latency_ms", T0, 1, null, null);

        DetectionResult result = AnomalyAggregator.aggregate(List.of(List.of(anonymous, checkout)), null, true, true);

        assertThat(result.getByOperation()).containsOnlyKeys("checkout", AnomalyAggregator.UNKNOWN_GROUP);
        assertThat(result.getByOperation().get("checkout")).containsExactly(checkout);
        assertThat(result.getByService()).containsOnlyKeys("cart", AnomalyAggregator.UNKNOWN_GROUP);
        assertThat(result.getByService().get(AnomalyAggregator.UNKNOWN_GROUP)).containsExactly(anonymous);
    }

    @Test
    @DisplayName("Should omit groupings that were not requested")
    void shouldOmitUnrequestedGroupings() {
        DetectionResult result = AnomalyAggregator.aggregate(
                List.of(List.of(percentile("x", T0, 1, "cart", "checkout"))), null, false, false);

        assertThat(result.getByOperation()).isNull();
        assertThat(result.getByService()).isNull();
    }

    @Test
    @DisplayName("Should produce an empty result for no anomalies")
    void shouldHandleEmptyInput() {
        DetectionResult result = AnomalyAggregator.aggregate(List.of(List.of(), List.of()), 5, true, false);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getTotalAnomalies()).isZero();
        assertThat(result.getByMethod()).isEmpty();
        assertThat(result.getByOperation()).isEmpty();
    }

    @Test
    @DisplayName("Grouped views should be read-only and detached from the caller's lists")
    void shouldExposeReadOnlyPartitions() {
        Anomaly a = percentile("latency", T0, 2.0, "cart", "checkout");
        Anomaly b = percentile("latency", T0.plusSeconds(60), 1.0, "cart", "checkout");

        DetectionResult result = AnomalyAggregator.aggregate(List.of(List.of(a, b)), null, true, true);

        assertThatThrownBy(() -> result.getByMethod().get(DetectionMethod.STATISTICAL_PERCENTILE).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getByOperation().get("checkout").add(a))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getByService().get("cart").remove(0))
                .isInstanceOf(UnsupportedOperationException.class);

        List<Anomaly> callerList = new ArrayList<>(List.of(a));
        Map<String, List<Anomaly>> callerGroups = new LinkedHashMap<>();
        callerGroups.put("checkout", callerList);
        DetectionResult direct = new DetectionResult(List.of(a), 1,
                Map.of(DetectionMethod.STATISTICAL_PERCENTILE, callerList), callerGroups, null);
        callerList.add(b);

        assertThat(direct.getByOperation().get("checkout")).containsExactly(a);
        assertThat(direct.getByMethod().get(DetectionMethod.STATISTICAL_PERCENTILE)).containsExactly(a);
    }

    @Test
    @DisplayName("Should reject a maxResults below one")
    void shouldRejectInvalidMaxResults() {
        assertThatThrownBy(() -> AnomalyAggregator.aggregate(List.of(), 0, false, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxResults");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Anomaly percentile(String subject, Instant timestamp, double score, String service,
            String operation) {
        return Anomaly.builder()
                .timestamp(timestamp)
                .subject(subject)
                .value(100 + score)
                .threshold(100)
                .detectionMethod(DetectionMethod.STATISTICAL_PERCENTILE)
                .score(score)
                .service(service)
                .operation(operation)
                .build();
    }
}
