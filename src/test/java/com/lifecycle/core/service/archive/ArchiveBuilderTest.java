package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.exception.IntegrityException;
import com.lifecycle.core.service.exception.UnsupportedFormatException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveBuilderTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private final ArchiveBuilder builder = new ArchiveBuilder(9, clock);

    @TempDir
    Path tempDir;

    @Test
    void buildWritesReadableBundleWithOneEntryPerFile() throws Exception {
        Path source = threeFileSource();

        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "nightly run");

        assertThat(result.fileCount()).isEqualTo(3);
        assertThat(result.originalSize()).isEqualTo(300);
        assertThat(result.compressedSize()).isEqualTo(Files.size(result.path()));
        assertThat(result.path().getFileName().toString())
                .isEqualTo("nightly_run_" + clock.millis() + ArchiveBuilder.EXTENSION);
        assertThat(entryNames(result.path())).containsExactlyInAnyOrder("a.txt", "b.txt", "sub/c.txt");

        builder.verify(result);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 50, 500})
    void freshBundlesVerifyAndCarryTheFileChecksum(int fileCount) throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("many"));
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < fileCount; i++) {
            files.add(Files.writeString(source.resolve("f" + i + ".txt"), "line " + i + "\n".repeat(i % 7)));
        }

        ArchiveResult result = builder.build(source, files, tempDir.resolve("out"), "many");

        builder.verify(result);
        assertThat(result.fileCount()).isEqualTo(fileCount);
        String expected = HexFormat.of().formatHex(
                MessageDigest.getInstance("SHA-256").digest(Files.readAllBytes(result.path())));
        assertThat(result.checksum()).isEqualTo(expected);
    }

    @Test
    void unreadableFilesAreLeftOutAndReported() throws Exception {
        Path source = threeFileSource();
        List<Path> files = new ArrayList<>(sourceFiles(source));
        files.add(source.resolve("never-existed.txt"));

        ArchiveResult result = builder.build(source, files, tempDir.resolve("out"), "job");

        assertThat(result.fileCount()).isEqualTo(3);
        assertThat(result.originalSize()).isEqualTo(300);
        assertThat(result.skipped()).containsExactly(source.resolve("never-existed.txt").toAbsolutePath().normalize());
        assertThat(result.includes(source.resolve("a.txt"))).isTrue();
        assertThat(result.includes(source.resolve("never-existed.txt"))).isFalse();
        builder.verify(result);
    }

    @Test
    void verifyFailsWhenAByteIsRemovedFromTheMiddle() throws Exception {
        Path source = threeFileSource();
        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");

        byte[] bytes = Files.readAllBytes(result.path());
        int middle = bytes.length / 2;
        byte[] damaged = new byte[bytes.length - 1];
        System.arraycopy(bytes, 0, damaged, 0, middle);
        System.arraycopy(bytes, middle + 1, damaged, middle, bytes.length - middle - 1);
        Files.write(result.path(), damaged);

        assertThatThrownBy(() -> builder.verify(result))
                .isInstanceOf(IntegrityException.class);
    }

    @Test
    void verifyFailsOnTruncatedBundle() throws Exception {
        Path source = threeFileSource();
        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");

        byte[] bytes = Files.readAllBytes(result.path());
        Files.write(result.path(), Arrays.copyOf(bytes, bytes.length / 3));

        assertThatThrownBy(() -> builder.verify(result))
                .isInstanceOf(IntegrityException.class)
                .satisfies(e -> assertThat(((IntegrityException) e).getErrorCode()).isEqualTo("INTEGRITY_ERROR"));
    }

    @Test
    void verifyFailsWhenEntryCountDiffers() throws Exception {
        Path source = threeFileSource();
        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");
        var claimed = new ArchiveResult(result.path(), result.originalSize(), result.compressedSize(),
                result.compressionRatio(), 4, result.checksum());

        assertThatThrownBy(() -> builder.verify(claimed))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("Expected 4 entries but found 3");
    }

    @Test
    void verifyFailsWhenBundleIsMissing() throws Exception {
        Path source = threeFileSource();
        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");
        Files.delete(result.path());

        assertThatThrownBy(() -> builder.verify(result)).isInstanceOf(IntegrityException.class);
    }

    @Test
    void emptyInputGivesZeroRatio() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("empty-src"));
        Path empty = Files.createFile(source.resolve("empty.txt"));

        ArchiveResult result = builder.build(source, List.of(empty), tempDir.resolve("out"), "empty");

        assertThat(result.originalSize()).isZero();
        assertThat(result.compressionRatio()).isZero();
        builder.verify(result);
    }

    @Test
    void ratioStaysWithinBounds() {
        assertThat(ArchiveResult.ratio(0, 0)).isZero();
        assertThat(ArchiveResult.ratio(0, 500)).isZero();
        assertThat(ArchiveResult.ratio(100, 400)).isZero();
        assertThat(ArchiveResult.ratio(100, 25)).isEqualTo(75.0);
        assertThat(ArchiveResult.ratio(100, 0)).isEqualTo(100.0);
    }

    @Test
    void sameNameAndMillisDoNotOverwriteEarlierBundle() throws Exception {
        Path source = threeFileSource();
        ArchiveResult first = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");
        ArchiveResult second = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");

        assertThat(second.path()).isNotEqualTo(first.path());
        builder.verify(first);
        builder.verify(second);
    }

    @Test
    void nonGzipFormatFailsBeforeAnyWork() throws Exception {
        Path source = threeFileSource();
        Path out = tempDir.resolve("never-created");
        var bzip = new ArchiveBuilder(9, CompressionFormat.BZIP2, clock);

        assertThatThrownBy(() -> bzip.build(source, sourceFiles(source), out, "job"))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThat(out).doesNotExist();
    }

    @Test
    void unknownFormatNameIsUnsupported() {
        assertThat(CompressionFormat.parse("GZip")).isEqualTo(CompressionFormat.GZIP);
        assertThat(CompressionFormat.parse(null)).isEqualTo(CompressionFormat.GZIP);
        assertThatThrownBy(() -> CompressionFormat.parse("zip")).isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> CompressionFormat.parse("xz").requireSupported())
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void extractRestoresContentAndModificationTime() throws Exception {
        Path source = threeFileSource();
        Instant modified = Instant.parse("2024-01-01T00:00:00Z");
        Files.setLastModifiedTime(source.resolve("a.txt"), FileTime.from(modified));
        ArchiveResult result = builder.build(source, sourceFiles(source), tempDir.resolve("out"), "job");

        List<Path> restored = builder.extract(result.path(), tempDir.resolve("restore"));

        assertThat(restored).hasSize(3);
        Path a = tempDir.resolve("restore/a.txt");
        assertThat(Files.readAllBytes(a)).isEqualTo(Files.readAllBytes(source.resolve("a.txt")));
        assertThat(Files.getLastModifiedTime(a).toInstant()).isEqualTo(modified);
        assertThat(tempDir.resolve("restore/sub/c.txt")).exists();
    }

    @Test
    void extractRejectsEntriesEscapingTarget() throws Exception {
        Path bundle = tempDir.resolve("evil.tar.gz");
        try (OutputStream out = Files.newOutputStream(bundle);
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            byte[] content = "gotcha".getBytes(StandardCharsets.UTF_8);
            var entry = new TarArchiveEntry("../escaped.txt");
            entry.setSize(content.length);
            tar.putArchiveEntry(entry);
            tar.write(content);
            tar.closeArchiveEntry();
        }

        assertThatThrownBy(() -> builder.extract(bundle, tempDir.resolve("target")))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("escapes");
        assertThat(tempDir.resolve("escaped.txt")).doesNotExist();
    }

    @Test
    void rejectsOutOfRangeCompressionLevel() {
        assertThatThrownBy(() -> new ArchiveBuilder(0, clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArchiveBuilder(10, clock)).isInstanceOf(IllegalArgumentException.class);
    }

    private Path threeFileSource() throws Exception {
        Path source = Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(source.resolve("sub"));
        Files.writeString(source.resolve("a.txt"), "a".repeat(100));
        Files.writeString(source.resolve("b.txt"), "b".repeat(100));
        Files.writeString(source.resolve("sub/c.txt"), "c".repeat(100));
        return source;
    }

    private List<Path> sourceFiles(Path source) {
        return List.of(source.resolve("a.txt"), Path.of("b.txt"), Path.of("sub/c.txt"));
    }

    private List<String> entryNames(Path bundle) throws Exception {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(bundle);
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(in);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
