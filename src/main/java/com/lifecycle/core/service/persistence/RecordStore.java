package com.lifecycle.core.service.persistence;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage-backend interface for lifecycle records (jobs and policies).
 *
 * Implementations must be thread-safe. Writes are whole-record upserts keyed by id,
 * so a record read back always reflects the last completed write.
 *
 * @param <T> the record type
 */
public interface RecordStore<T> {

    /**
     * Inserts a new record.
     *
     * @param record the record to insert
     * @throws IllegalArgumentException if a record with the same id already exists
     */
    void insert(T record);

    /**
     * Inserts or replaces the record with the same id.
     *
     * @param record the record to write
     */
    void upsert(T record);

    /**
     * Retrieves a record by id.
     *
     * @param id the record identifier
     * @return the record if found
     */
    Optional<T> findById(String id);

    /**
     * Retrieves all records.
     *
     * @return snapshot of all records
     */
    Collection<T> findAll();

    /**
     * Deletes a record by id.
     *
     * @param id the record identifier
     * @return true if deleted, false if not found
     */
    boolean delete(String id);

    /**
     * Gets the number of stored records.
     *
     * @return record count
     */
    int count();
}
