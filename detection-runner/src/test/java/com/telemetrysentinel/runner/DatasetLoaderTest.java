package com.telemetrysentinel.runner;

import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.model.TimeRange;
import com.telemetrysentinel.core.source.InMemoryTelemetrySource;
import com.telemetrysentinel.core.source.TelemetrySourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DatasetLoader}.
 */
class DatasetLoaderTest {

    private static final TimeRange DAY = TimeRange.of(
            Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z"));

    private final DatasetLoader loader = new DatasetLoader();

    @Test
    @DisplayName("Should load metrics, records and spans, dropping entries without a timestamp")
    void shouldLoadFixture() throws Exception {
        InMemoryTelemetrySource source;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("dataset.json")) {
            source = loader.load(in);
        }

        assertThat(source.fetchCounterSeries("http.server.requests", DAY, "cart")).hasSize(6);
        assertThat(source.fetchFieldWindowStatistics("latency_ms", DAY, Set.of(95.0)).getCount()).isEqualTo(30);
        assertThat(source.fetchDurationSamples(DAY, null))
                .extracting(DurationSample::getSubjectId)
                .containsExactly("span-0", "span-1", "span-2", "span-3", "span-4");
    }

    @Test
    @DisplayName("Should accept a document with missing sections")
    void shouldAcceptPartialDocument() {
        InMemoryTelemetrySource source = loader.load(stream("{\"spans\": null}"));

        assertThat(source.fetchDurationSamples(DAY, null)).isEmpty();
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
        assertThatThrownBy(() -> loader.load(stream("{\"metrics\": [")))
                .isInstanceOf(TelemetrySourceException.class)
                .hasMessageContaining("Malformed telemetry dataset");
    }

    @Test
    @DisplayName("Should fail on an empty document")
    void shouldFailOnNullDocument() {
        assertThatThrownBy(() -> loader.load(stream("null")))
                .isInstanceOf(TelemetrySourceException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should fail when the file does not exist")
    void shouldFailOnMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.json");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(TelemetrySourceException.class)
                .hasMessageContaining("not found")
                .hasMessageContaining("missing.json");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
