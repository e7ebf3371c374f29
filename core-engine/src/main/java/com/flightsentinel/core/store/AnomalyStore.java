package com.flightsentinel.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flightsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * File-backed collection of confirmed anomalies, stored as one JSON array.
 *
 * <p>
 * {@link #append(List)} is a read-modify-write of the whole file: the
 * current array is read, the new anomalies are added at the end, and the
 * result replaces the file via a sibling temp file and a move. A missing,
 * empty or unparsable file reads as an empty collection.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations are {@code synchronized}. This serializes writers inside one
 * JVM only; the file itself must have a single writing process.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyStore {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyStore.class);
    private static final TypeReference<List<Anomaly>> ANOMALY_LIST = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    /**
     * @param path location of the JSON array file; must not be {@code null}
     */
    public AnomalyStore(Path path) {
        this.path = Objects.requireNonNull(path, "Anomaly store path must not be null").toAbsolutePath();
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Append anomalies after every entry already in the store.
     *
     * @param anomalies anomalies to add, in order; an empty list is a no-op
     * @throws UncheckedIOException if the store cannot be written
     */
    public synchronized void append(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty()) {
            return;
        }
        List<Anomaly> all = new ArrayList<>(readAll());
        all.addAll(anomalies);
        write(all);
        LOG.info("Saved {} new anomalies to {} ({} total)", anomalies.size(), path, all.size());
    }

    /**
     * Discard every stored anomaly, leaving an empty JSON array.
     *
     * @throws UncheckedIOException if the store cannot be written
     */
    public synchronized void reset() {
        write(List.of());
        LOG.info("Anomaly store reset: {}", path);
    }

    /**
     * Read the current contents.
     *
     * @return stored anomalies in append order; empty if the file is missing,
     *         empty or corrupt
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public synchronized List<Anomaly> readAll() {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read anomaly store: " + path, e);
        }
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            return List.of();
        }
        try {
            List<Anomaly> anomalies = mapper.readValue(content, ANOMALY_LIST);
            return anomalies != null ? anomalies : List.of();
        } catch (JsonProcessingException e) {
            LOG.warn("Anomaly store {} is corrupt, treating as empty: {}", path, e.getOriginalMessage());
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse anomaly store: " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void write(List<Anomaly> anomalies) {
        Path dir = path.getParent();
        Path tmp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), anomalies);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write anomaly store: " + path, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
