package com.lifecycle.core.service.persistence;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory implementation of RecordStore.
 * Thread-safe record storage backed by a ConcurrentHashMap; contents do not survive a restart.
 */
@Slf4j
public class InMemoryRecordStore<T> implements RecordStore<T> {

    private final String collection;
    private final Function<T, String> idExtractor;
    private final Map<String, T> records = new ConcurrentHashMap<>();

    public InMemoryRecordStore(String collection, Function<T, String> idExtractor) {
        this.collection = collection;
        this.idExtractor = idExtractor;
    }

    @Override
    public void insert(T record) {
        String id = idExtractor.apply(record);
        if (records.putIfAbsent(id, record) != null) {
            throw new IllegalArgumentException("Duplicate " + collection + " id: " + id);
        }
        log.debug("Inserted {} record: {}", collection, id);
    }

    @Override
    public void upsert(T record) {
        records.put(idExtractor.apply(record), record);
    }

    @Override
    public Optional<T> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Collection<T> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public boolean delete(String id) {
        return records.remove(id) != null;
    }

    @Override
    public int count() {
        return records.size();
    }
}
