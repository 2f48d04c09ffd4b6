package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.exception.IntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.DigestInputStream;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Writes, verifies and extracts tar.gz bundles.
 *
 * Entries are stored relative to the source root with POSIX long-name headers, so bundles
 * open with any standard tar utility.
 */
@Slf4j
public class ArchiveBuilder {

    public static final String EXTENSION = ".tar.gz";

    private static final int BUFFER_SIZE = 64 * 1024;

    private final int compressionLevel;
    private final CompressionFormat format;
    private final Clock clock;

    public ArchiveBuilder(int compressionLevel, CompressionFormat format, Clock clock) {
        if (compressionLevel < 1 || compressionLevel > 9) {
            throw new IllegalArgumentException("Compression level must be between 1 and 9: " + compressionLevel);
        }
        this.compressionLevel = compressionLevel;
        this.format = format;
        this.clock = clock;
    }

    public ArchiveBuilder(int compressionLevel, Clock clock) {
        this(compressionLevel, CompressionFormat.GZIP, clock);
    }

    // ==================== Build ====================

    /**
     * Bundles the listed files into {@code <destinationDir>/<jobName>_<millis>.tar.gz}.
     * Files that cannot be read at build time are reported in {@link ArchiveResult#skipped()}.
     *
     * @param sourceRoot directory the entry names are relative to
     * @param files files to include; relative paths resolve against sourceRoot
     * @param destinationDir directory receiving the bundle, created if missing
     * @param jobName base name of the bundle
     * @throws IOException if the bundle cannot be written
     */
    public ArchiveResult build(Path sourceRoot, List<Path> files, Path destinationDir, String jobName)
            throws IOException {
        format.requireSupported();

        Path root = sourceRoot.toAbsolutePath().normalize();
        Files.createDirectories(destinationDir);
        Path bundle = bundlePath(destinationDir, safeName(jobName) + "_" + clock.millis());

        long originalSize = 0;
        int fileCount = 0;
        List<Path> skipped = new ArrayList<>();
        MessageDigest digest = sha256();
        byte[] buffer = new byte[BUFFER_SIZE];

        try (OutputStream fileOut = Files.newOutputStream(bundle, StandardOpenOption.CREATE_NEW);
             OutputStream digestOut = new DigestOutputStream(
                     new BufferedOutputStream(fileOut, BUFFER_SIZE), digest);
             GzipCompressorOutputStream gzipOut = new GzipCompressorOutputStream(digestOut, gzipParameters());
             TarArchiveOutputStream tarOut = new TarArchiveOutputStream(gzipOut)) {

            tarOut.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tarOut.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            for (Path file : files) {
                Path absolute = root.resolve(file).toAbsolutePath().normalize();
                String entryName = root.relativize(absolute).toString().replace('\\', '/');

                // vanished or unreadable since the scan
                BasicFileAttributes attributes;
                InputStream in;
                try {
                    attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
                    if (!attributes.isRegularFile()) {
                        throw new IOException("Not a regular file");
                    }
                    in = Files.newInputStream(absolute);
                } catch (IOException e) {
                    log.warn("Leaving {} out of {}: {}", absolute, bundle.getFileName(), e.getMessage());
                    skipped.add(absolute);
                    continue;
                }

                try (in) {
                    TarArchiveEntry entry = new TarArchiveEntry(entryName);
                    entry.setSize(attributes.size());
                    entry.setModTime(attributes.lastModifiedTime());
                    tarOut.putArchiveEntry(entry);
                    long remaining = attributes.size();
                    while (remaining > 0) {
                        int read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                        if (read < 0) {
                            break;
                        }
                        tarOut.write(buffer, 0, read);
                        remaining -= read;
                    }
                    tarOut.closeArchiveEntry();
                }

                originalSize += attributes.size();
                fileCount++;
            }
            tarOut.finish();
        } catch (IOException e) {
            Files.deleteIfExists(bundle);
            throw e;
        }

        long compressedSize = Files.size(bundle);
        var result = new ArchiveResult(
                bundle,
                originalSize,
                compressedSize,
                ArchiveResult.ratio(originalSize, compressedSize),
                fileCount,
                HexFormat.of().formatHex(digest.digest()),
                List.copyOf(skipped));

        log.info("Archive written: {} ({} files, {} -> {} bytes, {}% saved)",
                bundle, fileCount, originalSize, compressedSize,
                String.format("%.1f", result.compressionRatio()));
        return result;
    }

    // ==================== Verify ====================

    /**
     * Re-reads the bundle and checks its checksum and entry count against the build result.
     *
     * @throws IntegrityException on any mismatch or read failure
     */
    public void verify(ArchiveResult result) {
        Path bundle = result.path();
        if (!Files.isRegularFile(bundle)) {
            throw new IntegrityException(bundle.toString(), "Archive file is missing");
        }

        String checksum;
        int entries = 0;
        try {
            checksum = checksum(bundle);
            try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(bundle), BUFFER_SIZE);
                 GzipCompressorInputStream gzipIn = new GzipCompressorInputStream(fileIn);
                 TarArchiveInputStream tarIn = new TarArchiveInputStream(gzipIn)) {

                while (tarIn.getNextEntry() != null) {
                    // drain entry so truncation surfaces as an I/O error
                    tarIn.transferTo(OutputStream.nullOutputStream());
                    entries++;
                }
            }
        } catch (IOException e) {
            throw new IntegrityException(bundle.toString(), "Archive is unreadable: " + e.getMessage(), e);
        }

        if (entries != result.fileCount()) {
            throw new IntegrityException(bundle.toString(),
                    "Expected " + result.fileCount() + " entries but found " + entries);
        }
        if (result.checksum() != null && !result.checksum().equals(checksum)) {
            throw new IntegrityException(bundle.toString(), "Checksum mismatch");
        }
        log.debug("Archive verified: {} ({} entries)", bundle, entries);
    }

    // ==================== Extract ====================

    /**
     * Extracts every entry below the target directory.
     *
     * @return extracted file paths
     * @throws IntegrityException if an entry would escape the target directory
     */
    public List<Path> extract(Path bundle, Path targetDir) throws IOException {
        Path target = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(target);
        List<Path> extracted = new ArrayList<>();

        try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(bundle), BUFFER_SIZE);
             GzipCompressorInputStream gzipIn = new GzipCompressorInputStream(fileIn);
             TarArchiveInputStream tarIn = new TarArchiveInputStream(gzipIn)) {

            TarArchiveEntry entry;
            while ((entry = tarIn.getNextEntry()) != null) {
                Path out = target.resolve(entry.getName()).normalize();
                if (!out.startsWith(target)) {
                    throw new IntegrityException(bundle.toString(),
                            "Entry escapes extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                    continue;
                }
                Files.createDirectories(out.getParent());
                Files.copy(tarIn, out, StandardCopyOption.REPLACE_EXISTING);
                if (entry.getModTime() != null) {
                    Files.setLastModifiedTime(out,
                            FileTime.fromMillis(entry.getModTime().getTime()));
                }
                extracted.add(out);
            }
        }

        log.info("Extracted {} entries from {} to {}", extracted.size(), bundle, target);
        return extracted;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    // ==================== Helpers ====================

    private GzipParameters gzipParameters() {
        var parameters = new GzipParameters();
        parameters.setCompressionLevel(compressionLevel);
        parameters.setModificationTime(clock.millis());
        return parameters;
    }

    private static Path bundlePath(Path destinationDir, String baseName) {
        Path candidate = destinationDir.resolve(baseName + EXTENSION);
        for (int suffix = 1; Files.exists(candidate); suffix++) {
            candidate = destinationDir.resolve(baseName + "-" + suffix + EXTENSION);
        }
        return candidate;
    }

    private static String safeName(String jobName) {
        String name = jobName == null || jobName.isBlank() ? "archive" : jobName.trim();
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /**
     * SHA-256 of the raw bundle bytes, read in a pass of its own.
     */
    static String checksum(Path bundle) throws IOException {
        MessageDigest digest = sha256();
        try (InputStream in = new DigestInputStream(Files.newInputStream(bundle), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
