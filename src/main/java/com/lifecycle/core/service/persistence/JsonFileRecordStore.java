package com.lifecycle.core.service.persistence;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifecycle.core.service.exception.StoragePersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * File-backed implementation of RecordStore.
 *
 * Keeps the whole collection in memory and rewrites one JSON array file on every
 * mutation. The file is written to a sibling temp file first and moved into place,
 * so a crash never leaves a half-written collection behind.
 */
@Slf4j
public class JsonFileRecordStore<T> implements RecordStore<T> {

    private final Path file;
    private final Function<T, String> idExtractor;
    private final ObjectMapper objectMapper;
    private final JavaType listType;
    private final Map<String, T> records = new LinkedHashMap<>();

    public JsonFileRecordStore(Path file, Class<T> type, Function<T, String> idExtractor,
                               ObjectMapper objectMapper) {
        this.file = file;
        this.idExtractor = idExtractor;
        this.objectMapper = objectMapper;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
        load();
    }

    @Override
    public synchronized void insert(T record) {
        String id = idExtractor.apply(record);
        if (records.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate id in " + file.getFileName() + ": " + id);
        }
        records.put(id, record);
        flush();
    }

    @Override
    public synchronized void upsert(T record) {
        records.put(idExtractor.apply(record), record);
        flush();
    }

    @Override
    public synchronized Optional<T> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized Collection<T> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized boolean delete(String id) {
        if (records.remove(id) == null) {
            return false;
        }
        flush();
        return true;
    }

    @Override
    public synchronized int count() {
        return records.size();
    }

    public Path getFile() {
        return file;
    }

    // ==================== File I/O ====================

    private void load() {
        if (!Files.exists(file)) {
            log.info("No existing store file at {}, starting empty", file);
            return;
        }
        try {
            List<T> loaded = objectMapper.readValue(file.toFile(), listType);
            loaded.forEach(record -> records.put(idExtractor.apply(record), record));
            log.info("Loaded {} records from {}", records.size(), file);
        } catch (IOException e) {
            throw new StoragePersistenceException("Failed to read store file " + file, e);
        }
    }

    private void flush() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(temp.toFile(), new ArrayList<>(records.values()));
            moveIntoPlace(temp);
        } catch (IOException e) {
            throw new StoragePersistenceException("Failed to write store file " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
