package com.telemetrysentinel.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Converts a {@link DetectionReport} to pretty-printed JSON with ISO-8601
 * timestamps.
 */
public class DetectionReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionReportSerializer.class);

    private final ObjectMapper mapper;

    public DetectionReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * @return the report as a JSON string
     * @throws IllegalStateException if the report cannot be serialized
     */
    public String toJson(DetectionReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize detection report: " + e.getMessage(), e);
        }
    }

    /**
     * Write the report to a stream; the stream is flushed, not closed.
     *
     * @throws IllegalStateException if writing fails
     */
    public void write(DetectionReport report, OutputStream out) {
        Objects.requireNonNull(out, "out must not be null");
        try {
            out.write(toJson(report).getBytes(StandardCharsets.UTF_8));
            out.write('\n');
            out.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write detection report", e);
        }
    }

    /**
     * Write the report to a file, replacing any existing content.
     *
     * @throws IllegalStateException if writing fails
     */
    public void write(DetectionReport report, Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            write(report, out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write detection report: " + path, e);
        }
        LOG.info("Wrote detection report to {}", path);
    }
}
