package com.lifecycle.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Data Lifecycle Service Application - Entry point for the Spring Boot application.
 *
 * This application manages the lifecycle of accumulated operational data:
 * - Archives stale files into verified tar.gz bundles
 * - Applies retention policies (delete, archive, compress, move)
 * - Tracks every run as an auditable job with statistics
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.lifecycle.core.service.config")
public class DataLifecycleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataLifecycleServiceApplication.class, args);
    }
}
