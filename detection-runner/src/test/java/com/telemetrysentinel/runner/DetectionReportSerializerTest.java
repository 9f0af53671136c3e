package com.telemetrysentinel.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetrysentinel.core.detection.AnomalyAggregator;
import com.telemetrysentinel.core.detection.DetectionRequest;
import com.telemetrysentinel.core.model.Anomaly;
import com.telemetrysentinel.core.model.DetectionMethod;
import com.telemetrysentinel.core.model.DetectionResult;
import com.telemetrysentinel.core.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionReportSerializer}.
 */
class DetectionReportSerializerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-05-01T11:00:00Z");

    private final DetectionReportSerializer serializer = new DetectionReportSerializer();
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should write ISO timestamps, wire labels and only populated fields")
    void shouldSerializeReport() throws Exception {
        JsonNode json = reader.readTree(serializer.toJson(report()));

        assertThat(json.get("analysisStart").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("baselineEnd").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("methods").get(0).asText()).isEqualTo("counter");

        JsonNode result = json.get("result");
        assertThat(result.get("totalAnomalies").asInt()).isEqualTo(2);
        assertThat(result.has("truncated")).isFalse();
        assertThat(result.has("byService")).isFalse();
        assertThat(result.get("byMethod").has("reset")).isTrue();
        assertThat(result.get("byOperation").has("unknown")).isTrue();

        JsonNode first = result.get("anomalies").get(0);
        assertThat(first.get("detectionMethod").asText()).isEqualTo("duration-z-score");
        assertThat(first.get("zScore").asDouble()).isEqualTo(5.0);
        assertThat(first.get("timestamp").asText()).isEqualTo("2024-05-01T10:05:00Z");
        assertThat(first.get("operation").asText()).isEqualTo("checkout");

        JsonNode reset = result.get("anomalies").get(1);
        assertThat(reset.get("deviation").asDouble()).isEqualTo(-1.0);
        assertThat(reset.has("zScore")).isFalse();
        assertThat(reset.has("traceId")).isFalse();
    }

    @Test
    @DisplayName("Should end the stream output with a newline and leave the stream open")
    void shouldWriteToStream() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        serializer.write(report(), out);
        serializer.write(report(), out);

        String written = out.toString(StandardCharsets.UTF_8);
        assertThat(written).endsWith("}\n");
        assertThat(written.split("\"analysisStart\"")).hasSize(3);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectionReport report() {
        DetectionRequest request = DetectionRequest.builder()
                .analysisRange(TimeRange.of(START, END))
                .build();
        Anomaly slow = Anomaly.builder()
                .timestamp(START.plusSeconds(300))
                .subject("checkout")
                .operation("checkout")
                .service("cart")
                .value(1000)
                .expectedValue(100.0)
                .zScore(5.0)
                .threshold(3.0)
                .detectionMethod(DetectionMethod.DURATION_Z_SCORE)
                .score(5.0)
                .build();
        Anomaly reset = Anomaly.builder()
                .timestamp(START.plusSeconds(120))
                .subject("http.server.requests")
                .value(10)
                .expectedValue(100.0)
                .deviation(Anomaly.RESET_DEVIATION)
                .threshold(50)
                .detectionMethod(DetectionMethod.RESET)
                .score(0.9)
                .build();
        DetectionResult result = AnomalyAggregator.aggregate(List.of(List.of(reset, slow)), null, true, false);
        return new DetectionReport(request, result);
    }
}
