package com.lifecycle.core.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overall application configuration for the data lifecycle service.
 *
 * Contains feature toggles, persistence mode and the storage layout.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleConfig {

    /**
     * Enable or disable lifecycle management entirely.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    @Valid
    private Features features = new Features();

    /**
     * Where jobs and policies are kept.
     */
    @Valid
    private Persistence persistence = new Persistence();

    /**
     * Storage layout scanned by cleanup and archival.
     */
    @Valid
    private Storage storage = new Storage();

    @Getter
    @Setter
    public static class Features {

        /**
         * Register cron triggers for enabled policies on startup.
         */
        private boolean schedulingEnabled = true;

        /**
         * Register the running-job gauges.
         */
        private boolean metricsEnabled = true;
    }

    @Getter
    @Setter
    public static class Persistence {

        /**
         * Store implementation: memory or file.
         */
        @NotNull
        private PersistenceMode mode = PersistenceMode.FILE;

        /**
         * Directory holding the JSON collections in file mode.
         */
        @NotBlank
        private String dataDir = "./data/lifecycle";
    }

    @Getter
    @Setter
    public static class Storage {

        /**
         * Root for data types without an explicit directory.
         */
        @NotBlank
        private String baseDir = "./storage";

        /**
         * Logical data type name to storage directory. Relative paths resolve against baseDir.
         */
        private Map<String, String> dataTypes = defaultDataTypes();

        private static Map<String, String> defaultDataTypes() {
            Map<String, String> types = new LinkedHashMap<>();
            types.put("test_results", "test_results");
            types.put("performance_data", "performance_data");
            types.put("logs", "logs");
            types.put("temp", "temp");
            types.put("other", "other");
            return types;
        }
    }

    public enum PersistenceMode {
        MEMORY,
        FILE
    }
}
