package com.lifecycle.core.service.persistence;

import java.util.function.Function;

/**
 * Creates one store per record collection in the configured persistence mode.
 */
public interface RecordStoreFactory {

    <T> RecordStore<T> create(String collection, Class<T> type, Function<T, String> idExtractor);
}
