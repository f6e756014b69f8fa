package com.dealbot.common.util;

import com.dealbot.common.constants.ProbeDefaults;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.stream.Stream;

public final class FileUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    private FileUtils() {}

    /**
     * Collapses every run of characters outside {@code [A-Za-z0-9_.-]} into a single underscore.
     * Blank names fall back to {@link ProbeDefaults#DEFAULT_UPLOAD_NAME}.
     */
    public static String sanitizeFileName(String filename) {
        if (filename == null || filename.isBlank()) {
            return ProbeDefaults.DEFAULT_UPLOAD_NAME;
        }
        String sanitized = filename.trim().replaceAll("[^\\w.-]+", "_");
        return sanitized.isEmpty() ? ProbeDefaults.DEFAULT_UPLOAD_NAME : sanitized;
    }

    public static Path createScratchDirectory(Path parent, String prefix) throws IOException {
        byte[] suffix = new byte[8];
        RANDOM.nextBytes(suffix);
        Path base = parent != null ? parent : Path.of(System.getProperty("java.io.tmpdir"));
        Files.createDirectories(base);
        return Files.createDirectory(base.resolve(prefix + HexFormat.of().formatHex(suffix)));
    }

    /**
     * Deletes a directory tree, deepest entries first. Missing paths are ignored.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
