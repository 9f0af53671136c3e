package com.telemetrysentinel.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.telemetrysentinel.core.model.DurationSample;
import com.telemetrysentinel.core.source.InMemoryTelemetrySource;
import com.telemetrysentinel.core.source.TelemetryRecord;
import com.telemetrysentinel.core.source.TelemetrySourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link TelemetryDataset} JSON file into an
 * {@link InMemoryTelemetrySource}.
 *
 * <p>
 * Individual entries without the data they need (metric name, timestamp) are
 * logged and dropped, ensuring that a single bad entry does not fail the
 * whole run. An unreadable or malformed file fails the run with a
 * {@link TelemetrySourceException}.
 * </p>
 */
public class DatasetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetLoader.class);

    private final ObjectMapper mapper;

    public DatasetLoader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param path dataset file
     * @return source over the dataset
     * @throws TelemetrySourceException if the file cannot be read or parsed
     */
    public InMemoryTelemetrySource load(Path path) {
        Objects.requireNonNull(path, "Dataset path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            InMemoryTelemetrySource source = load(in);
            LOG.info("Loaded telemetry dataset from {}", path);
            return source;
        } catch (NoSuchFileException e) {
            throw new TelemetrySourceException("Telemetry dataset not found: " + path, e);
        } catch (IOException e) {
            throw new TelemetrySourceException("Failed to read telemetry dataset: " + path, e);
        }
    }

    /**
     * @param in dataset JSON; not closed by this method
     * @return source over the dataset
     * @throws TelemetrySourceException if the stream cannot be parsed
     */
    public InMemoryTelemetrySource load(InputStream in) {
        Objects.requireNonNull(in, "Dataset stream must not be null");
        TelemetryDataset dataset;
        try {
            dataset = mapper.readValue(in, TelemetryDataset.class);
        } catch (IOException e) {
            throw new TelemetrySourceException("Malformed telemetry dataset: " + e.getMessage(), e);
        }
        if (dataset == null) {
            throw new TelemetrySourceException("Telemetry dataset is empty");
        }
        return toSource(dataset);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    InMemoryTelemetrySource toSource(TelemetryDataset dataset) {
        InMemoryTelemetrySource.Builder builder = InMemoryTelemetrySource.builder();
        int skipped = 0;

        for (TelemetryDataset.MetricEntry entry : dataset.getMetrics()) {
            if (entry == null || entry.getMetric() == null || entry.getTimestamp() == null) {
                skipped++;
                continue;
            }
            builder.metricPoint(entry.getMetric(), entry.getService(), entry.getTimestamp(), entry.getValue());
        }

        for (TelemetryRecord record : dataset.getRecords()) {
            if (record == null || record.getTimestamp() == null) {
                skipped++;
                continue;
            }
            builder.record(record);
        }

        for (TelemetryDataset.SpanEntry span : dataset.getSpans()) {
            if (span == null || span.getTimestamp() == null) {
                skipped++;
                continue;
            }
            builder.durationSample(DurationSample.builder()
                    .subjectId(span.getSpanId())
                    .traceId(span.getTraceId())
                    .service(span.getService())
                    .operation(span.getOperation())
                    .duration(span.getDuration())
                    .timestamp(span.getTimestamp())
                    .build());
        }

        if (skipped > 0) {
            LOG.warn("Skipped {} dataset entry(ies) without a metric name or timestamp", skipped);
        }
        LOG.debug("Dataset: {} metric point(s), {} record(s), {} span(s)",
                dataset.getMetrics().size(), dataset.getRecords().size(), dataset.getSpans().size());
        return builder.build();
    }
}
