package com.pennywise.common.retry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise.common.model.FailureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable failure log: a JSON array of {@link FailureRecord} kept in a single file with
 * a fixed name inside the configured directory, capped to the most recent entries.
 *
 * <p>Storage problems never reach the caller; they are logged and the operation is
 * skipped.
 */
public class JsonFileLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLogSink.class);

    public static final String FILE_NAME = "provider_errors.json";

    private static final TypeReference<List<FailureRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path file;
    private final int capacity;
    private final ObjectMapper objectMapper;

    public JsonFileLogSink(Path directory, int capacity, ObjectMapper objectMapper) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.file         = directory.resolve(FILE_NAME);
        this.capacity     = capacity;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(FailureRecord record) {
        List<FailureRecord> records = new ArrayList<>(read());
        records.add(record);
        if (records.size() > capacity) {
            records = new ArrayList<>(records.subList(records.size() - capacity, records.size()));
        }
        write(records);
    }

    @Override
    public synchronized List<FailureRecord> readAll() {
        return List.copyOf(read());
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Failed to clear failure log. file={}", file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private List<FailureRecord> read() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<FailureRecord> records = objectMapper.readValue(file.toFile(), RECORD_LIST);
            return records != null ? records : List.of();
        } catch (IOException e) {
            log.error("Failed to read failure log, starting empty. file={}", file, e);
            return List.of();
        }
    }

    private void write(List<FailureRecord> records) {
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), records);
        } catch (IOException e) {
            log.error("Failed to store failure record. file={}", file, e);
        }
    }
}
