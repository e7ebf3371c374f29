package com.flightsentinel.core.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightsentinel.core.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link TelemetrySource} over a line-delimited JSON file.
 *
 * <p>
 * The cursor is a count of complete lines. Each call reads the file, skips
 * the lines already consumed and parses the rest. Blank lines and lines that
 * are not a JSON object are skipped (malformed ones with a warning) but
 * still counted, so they are never retried. Trailing bytes after the last
 * newline belong to a line the producer is still writing: they are neither
 * parsed nor counted, and are picked up once the newline arrives. The cursor
 * lives in memory only: a new instance starts from the first line.
 * </p>
 *
 * <p>
 * If the file becomes shorter than the cursor (the producer truncated it on
 * restart) the cursor is left where it is and nothing is returned until the
 * file grows past it again.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonlTelemetrySource implements TelemetrySource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonlTelemetrySource.class);

    private final Path path;
    private final ObjectMapper mapper;

    private volatile long cursor;

    /**
     * @param path telemetry file; it does not need to exist yet
     */
    public JsonlTelemetrySource(Path path) {
        this.path = Objects.requireNonNull(path, "Telemetry path must not be null");
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<TelemetryRecord> readNew() {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new TelemetrySourceUnavailableException("Telemetry file " + path + " not found", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read telemetry file: " + path, e);
        }

        int complete = completeLength(content);
        if (complete < content.length) {
            LOG.debug("Telemetry file {} ends with an unfinished line ({} byte(s)); leaving it for the next read",
                    path, content.length - complete);
        }

        List<TelemetryRecord> records = new ArrayList<>();
        long lineCount = 0;
        Iterator<String> lines = new String(content, 0, complete, StandardCharsets.UTF_8).lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            lineCount++;
            if (lineCount <= cursor || line.isBlank()) {
                continue;
            }
            parse(line, lineCount, records);
        }

        if (lineCount < cursor) {
            LOG.warn("Telemetry file {} shrank to {} line(s), below cursor {}; waiting for it to grow",
                    path, lineCount, cursor);
        } else {
            cursor = lineCount;
        }
        return records;
    }

    @Override
    public long getCursor() {
        return cursor;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return length of the prefix that ends with the last {@code '\n'}
     */
    private static int completeLength(byte[] content) {
        for (int i = content.length - 1; i >= 0; i--) {
            if (content[i] == '\n') {
                return i + 1;
            }
        }
        return 0;
    }

    private void parse(String line, long lineNumber, List<TelemetryRecord> out) {
        try {
            TelemetryRecord record = mapper.readValue(line, TelemetryRecord.class);
            if (record != null) {
                out.add(record);
            }
        } catch (JsonProcessingException e) {
            LOG.warn("Skipping malformed telemetry line {} in {}: {}", lineNumber, path, e.getOriginalMessage());
        }
    }
}
