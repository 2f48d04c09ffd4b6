package com.lifecycle.core.service.scan;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Walks a storage root and reports regular files with size and modification time.
 *
 * Entries that cannot be read are skipped with a warning; a partial listing is
 * returned instead of failing the scan.
 */
@Slf4j
public class FileScanner {

    public static final String UNTYPED = "other";

    public List<StorageItem> scan(Path root) {
        return scan(root, UNTYPED);
    }

    /**
     * Recursively lists regular files under the root.
     *
     * @param root the directory to walk; a missing root yields an empty list
     * @param dataType logical data type stamped on each item
     */
    public List<StorageItem> scan(Path root, String dataType) {
        if (!Files.isDirectory(root)) {
            log.debug("Scan root does not exist or is not a directory: {}", root);
            return Collections.emptyList();
        }

        List<StorageItem> items = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        items.add(new StorageItem(
                                file.toAbsolutePath().normalize(),
                                dataType,
                                attrs.size(),
                                attrs.lastModifiedTime().toInstant()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable entry {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Scan of {} ended early: {}", root, e.getMessage());
        }

        log.debug("Scanned {} files under {}", items.size(), root);
        return items;
    }

    /**
     * Reads one regular file.
     *
     * @return empty if the path is missing, not a regular file or unreadable
     */
    public Optional<StorageItem> stat(Path file, String dataType) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            if (!attrs.isRegularFile()) {
                return Optional.empty();
            }
            return Optional.of(new StorageItem(file.toAbsolutePath().normalize(), dataType, attrs.size(),
                    attrs.lastModifiedTime().toInstant()));
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Keeps items strictly older than the threshold.
     *
     * @param thresholdDays age threshold; 0 or negative keeps every item
     */
    public List<StorageItem> filterByAge(List<StorageItem> items, int thresholdDays, Instant now) {
        if (thresholdDays <= 0) {
            return List.copyOf(items);
        }
        Duration threshold = Duration.ofDays(thresholdDays);
        return items.stream()
                .filter(item -> item.age(now).compareTo(threshold) > 0)
                .toList();
    }

    /**
     * Sums the sizes of the given items.
     */
    public long totalSize(List<StorageItem> items) {
        return items.stream().mapToLong(StorageItem::sizeBytes).sum();
    }
}
