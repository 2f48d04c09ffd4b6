package com.lifecycle.core.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifecycle.core.service.persistence.InMemoryRecordStore;
import com.lifecycle.core.service.persistence.JsonFileRecordStore;
import com.lifecycle.core.service.persistence.RecordStore;
import com.lifecycle.core.service.persistence.RecordStoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.function.Function;

/**
 * Selects the record store implementation for jobs and policies.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PersistenceConfig {

    private final LifecycleConfig lifecycleConfig;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RecordStoreFactory recordStoreFactory(ObjectMapper objectMapper) {
        var persistence = lifecycleConfig.getPersistence();
        if (persistence.getMode() == LifecycleConfig.PersistenceMode.MEMORY) {
            log.info("Using in-memory job and policy stores; records are lost on restart");
            return new RecordStoreFactory() {
                @Override
                public <T> RecordStore<T> create(
                        String collection, Class<T> type, Function<T, String> idExtractor) {
                    return new InMemoryRecordStore<>(collection, idExtractor);
                }
            };
        }

        Path dataDir = Paths.get(persistence.getDataDir()).toAbsolutePath().normalize();
        log.info("Using JSON file stores under {}", dataDir);
        return new RecordStoreFactory() {
            @Override
            public <T> RecordStore<T> create(
                    String collection, Class<T> type, Function<T, String> idExtractor) {
                return new JsonFileRecordStore<>(dataDir.resolve(collection + ".json"), type, idExtractor,
                        objectMapper);
            }
        };
    }
}
