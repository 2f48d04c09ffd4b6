package com.lifecycle.core.service.archive;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of writing one tar.gz bundle.
 *
 * @param path bundle location
 * @param originalSize summed size of the input files
 * @param compressedSize size of the bundle on disk
 * @param compressionRatio percentage saved, within [0, 100]
 * @param fileCount number of tar entries written
 * @param checksum SHA-256 of the bundle, hex encoded
 * @param skipped absolute paths of requested files that could not be read and were left out
 */
public record ArchiveResult(
        Path path,
        long originalSize,
        long compressedSize,
        double compressionRatio,
        int fileCount,
        String checksum,
        List<Path> skipped
) {

    public ArchiveResult(Path path, long originalSize, long compressedSize, double compressionRatio,
                         int fileCount, String checksum) {
        this(path, originalSize, compressedSize, compressionRatio, fileCount, checksum, List.of());
    }

    /**
     * Whether the file made it into the bundle.
     */
    public boolean includes(Path file) {
        return !skipped.contains(file.toAbsolutePath().normalize());
    }

    /**
     * Computes the percentage saved, 0 when nothing was archived or the bundle grew.
     */
    public static double ratio(long originalSize, long compressedSize) {
        if (originalSize <= 0) {
            return 0.0;
        }
        double ratio = (1.0 - (double) compressedSize / originalSize) * 100.0;
        return Math.max(0.0, Math.min(100.0, ratio));
    }
}
