package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.archive.ArchiveBuilder;
import com.lifecycle.core.service.archive.ArchiveResult;
import com.lifecycle.core.service.exception.IntegrityException;
import com.lifecycle.core.service.policy.LifecycleAction;
import com.lifecycle.core.service.scan.StorageItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a lifecycle action to a batch of stale items.
 *
 * Items are handled independently: a failure is recorded against the item and the batch
 * carries on. In a dry run nothing on disk changes but the outcome reports what would
 * have been processed and freed.
 */
@Slf4j
public class ActionExecutor {

    public static final String PARAM_TARGET = "target";
    /** Directory whose layout a move keeps below the target; defaults to the batch's common parent. */
    public static final String PARAM_SOURCE_ROOT = "sourceRoot";
    public static final String PARAM_ARCHIVE_PATH = "archivePath";
    public static final String PARAM_ARCHIVE_NAME = "archiveName";
    public static final String PARAM_COMPRESSION_LEVEL = "compressionLevel";

    public static final String GZIP_SUFFIX = ".gz";

    private final ArchiveBuilder archiveBuilder;
    private final Path defaultArchiveDir;
    private final int compressionLevel;

    public ActionExecutor(ArchiveBuilder archiveBuilder, Path defaultArchiveDir, int compressionLevel) {
        this.archiveBuilder = archiveBuilder;
        this.defaultArchiveDir = defaultArchiveDir;
        this.compressionLevel = compressionLevel;
    }

    public ActionOutcome apply(LifecycleAction action, List<StorageItem> items,
                               Map<String, Object> parameters, boolean dryRun) {
        return apply(action, items, parameters, dryRun, ExecutionMonitor.NONE);
    }

    /**
     * Applies the action to every item, checking for cancellation between items.
     */
    public ActionOutcome apply(LifecycleAction action, List<StorageItem> items,
                               Map<String, Object> parameters, boolean dryRun, ExecutionMonitor monitor) {
        if (items.isEmpty()) {
            return ActionOutcome.empty();
        }
        Map<String, Object> params = new HashMap<>(parameters != null ? parameters : Map.of());
        if (action == LifecycleAction.MOVE) {
            params.putIfAbsent(PARAM_SOURCE_ROOT, commonParent(items).toString());
        }

        if (dryRun) {
            return simulate(action, items, monitor);
        }
        if (action == LifecycleAction.ARCHIVE) {
            return archive(items, params, monitor);
        }

        int processed = 0;
        long freed = 0;
        List<String> errors = new ArrayList<>();
        for (StorageItem item : items) {
            if (monitor.isCancelled()) {
                log.info("{} batch cancelled after {} of {} items", action, processed, items.size());
                return new ActionOutcome(processed, freed, errors, List.of(), true);
            }
            if (alreadyDone(action, item)) {
                log.debug("{} already compressed, skipped", item.path());
                monitor.itemCompleted(item, true);
                continue;
            }
            try {
                freed += applyToItem(action, item, params);
                processed++;
                monitor.itemCompleted(item, true);
            } catch (IOException | RuntimeException e) {
                log.warn("{} failed for {}: {}", action, item.path(), e.getMessage());
                errors.add(item.path() + ": " + e.getMessage());
                monitor.itemCompleted(item, false);
            }
        }

        log.info("{} applied to {} items, {} bytes freed, {} errors", action, processed, freed, errors.size());
        return new ActionOutcome(processed, freed, errors, List.of(), false);
    }

    /**
     * Performs a single-item action.
     *
     * @return bytes released from the source location
     */
    protected long applyToItem(LifecycleAction action, StorageItem item, Map<String, Object> params)
            throws IOException {
        switch (action) {
            case DELETE:
                Files.delete(item.path());
                return item.sizeBytes();
            case COMPRESS:
                compress(item, intParam(params, PARAM_COMPRESSION_LEVEL, compressionLevel));
                return item.sizeBytes();
            case MOVE:
                move(item, params);
                return item.sizeBytes();
            default:
                throw new IllegalArgumentException("Unsupported per-item action: " + action);
        }
    }

    // ==================== Actions ====================

    private ActionOutcome simulate(LifecycleAction action, List<StorageItem> items, ExecutionMonitor monitor) {
        int processed = 0;
        long freed = 0;
        for (StorageItem item : items) {
            if (monitor.isCancelled()) {
                return new ActionOutcome(processed, freed, List.of(), List.of(), true);
            }
            if (alreadyDone(action, item)) {
                monitor.itemCompleted(item, true);
                continue;
            }
            log.info("[dry-run] would {} {} ({} bytes)", action, item.path(), item.sizeBytes());
            processed++;
            freed += item.sizeBytes();
            monitor.itemCompleted(item, true);
        }
        return new ActionOutcome(processed, freed, List.of(), List.of(), false);
    }

    private ActionOutcome archive(List<StorageItem> items, Map<String, Object> params, ExecutionMonitor monitor) {
        if (monitor.isCancelled()) {
            return new ActionOutcome(0, 0, List.of(), List.of(), true);
        }
        Path archiveDir = params.containsKey(PARAM_ARCHIVE_PATH)
                ? Paths.get(String.valueOf(params.get(PARAM_ARCHIVE_PATH)))
                : defaultArchiveDir;
        String name = String.valueOf(params.getOrDefault(PARAM_ARCHIVE_NAME, "cleanup"));
        Path root = commonParent(items);
        List<Path> files = items.stream().map(StorageItem::path).toList();

        ArchiveResult result;
        try {
            result = archiveBuilder.build(root, files, archiveDir, name);
            try {
                archiveBuilder.verify(result);
            } catch (IntegrityException e) {
                Files.deleteIfExists(result.path());
                throw e;
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Archiving {} items failed, originals kept: {}", items.size(), e.getMessage());
            List<String> errors = items.stream()
                    .map(item -> item.path() + ": " + e.getMessage())
                    .toList();
            items.forEach(item -> monitor.itemCompleted(item, false));
            return new ActionOutcome(0, 0, errors, List.of(), false);
        }

        if (result.fileCount() == 0) {
            deleteQuietly(result.path());
            List<String> errors = items.stream()
                    .map(item -> item.path() + ": unreadable, not archived")
                    .toList();
            items.forEach(item -> monitor.itemCompleted(item, false));
            return new ActionOutcome(0, 0, errors, List.of(), false);
        }

        int processed = 0;
        long freed = 0;
        List<String> errors = new ArrayList<>();
        for (StorageItem item : items) {
            if (!result.includes(item.path())) {
                errors.add(item.path() + ": unreadable, not archived");
                monitor.itemCompleted(item, false);
                continue;
            }
            try {
                Files.deleteIfExists(item.path());
                processed++;
                freed += item.sizeBytes();
                monitor.itemCompleted(item, true);
            } catch (IOException e) {
                log.warn("Archived {} but could not remove the original: {}", item.path(), e.getMessage());
                errors.add(item.path() + ": " + e.getMessage());
                monitor.itemCompleted(item, false);
            }
        }
        return new ActionOutcome(processed, freed, errors, List.of(result.path()), false);
    }

    private void compress(StorageItem item, int level) throws IOException {
        Path source = item.path();
        Path target = source.resolveSibling(source.getFileName() + GZIP_SUFFIX);

        var gzipParameters = new GzipParameters();
        gzipParameters.setCompressionLevel(level);
        gzipParameters.setFilename(source.getFileName().toString());
        // an existing sibling is never overwritten
        OutputStream fileOut = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW);
        try (fileOut; OutputStream out = new GzipCompressorOutputStream(fileOut, gzipParameters)) {
            Files.copy(source, out);
        } catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }
        Files.delete(source);
        log.debug("Compressed {} -> {}", source, target);
    }

    private void move(StorageItem item, Map<String, Object> params) throws IOException {
        Object target = params.get(PARAM_TARGET);
        if (target == null) {
            throw new IllegalArgumentException("Move requires a '" + PARAM_TARGET + "' parameter");
        }
        Path source = item.path().toAbsolutePath().normalize();
        Path targetDir = Paths.get(String.valueOf(target)).toAbsolutePath().normalize();
        Object root = params.get(PARAM_SOURCE_ROOT);
        Path sourceRoot = root != null ? Paths.get(String.valueOf(root)).toAbsolutePath().normalize() : null;

        Path relative = sourceRoot != null && source.startsWith(sourceRoot)
                ? sourceRoot.relativize(source)
                : source.getFileName();
        Path destination = targetDir.resolve(relative).normalize();
        Files.createDirectories(destination.getParent());
        // fails with FileAlreadyExistsException rather than replacing
        Files.move(source, destination);
        log.debug("Moved {} -> {}", item.path(), destination);
    }

    // ==================== Helpers ====================

    private static boolean alreadyDone(LifecycleAction action, StorageItem item) {
        return action == LifecycleAction.COMPRESS
                && item.path().getFileName().toString().endsWith(GZIP_SUFFIX);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }

    static Path commonParent(List<StorageItem> items) {
        Path common = items.get(0).path().toAbsolutePath().getParent();
        for (StorageItem item : items) {
            Path parent = item.path().toAbsolutePath().getParent();
            while (common != null && !parent.startsWith(common)) {
                common = common.getParent();
            }
        }
        return common != null ? common : items.get(0).path().toAbsolutePath().getRoot();
    }

    private static int intParam(Map<String, Object> params, String key, int fallback) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric parameter {}={}", key, value);
            }
        }
        return fallback;
    }
}
