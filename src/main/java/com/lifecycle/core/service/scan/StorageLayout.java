package com.lifecycle.core.service.scan;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves logical data types to storage directories.
 */
public class StorageLayout {

    private final Path baseDir;
    private final Map<String, Path> roots;

    public StorageLayout(Path baseDir, Map<String, String> dataTypes) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        Map<String, Path> resolved = new LinkedHashMap<>();
        dataTypes.forEach((type, dir) -> resolved.put(type, this.baseDir.resolve(Paths.get(dir)).normalize()));
        this.roots = Collections.unmodifiableMap(resolved);
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Directory of a data type; unknown types map to a same-named directory under the base dir.
     */
    public Path root(String dataType) {
        Path root = roots.get(dataType);
        return root != null ? root : baseDir.resolve(dataType).normalize();
    }

    public Map<String, Path> roots() {
        return roots;
    }

    /**
     * Resolves a caller-supplied path against the base dir.
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            return baseDir;
        }
        return baseDir.resolve(Paths.get(path)).toAbsolutePath().normalize();
    }
}
