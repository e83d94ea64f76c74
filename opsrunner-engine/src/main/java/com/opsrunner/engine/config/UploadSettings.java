package com.opsrunner.engine.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Upload pipeline settings.
 *
 * @param sharedLimiter when true uploads are admitted through the workflow limiter,
 *                      otherwise through their own limiter of {@code maxConcurrentUploads}
 */
public record UploadSettings(
    Path uploadDir,
    long maxFileSize,
    List<String> allowedExtensions,
    boolean compressionEnabled,
    boolean backupEnabled,
    Path backupDir,
    boolean sharedLimiter,
    int maxConcurrentUploads
) {
    public static final List<String> DEFAULT_EXTENSIONS =
        List.of("txt", "pdf", "doc", "docx", "zip", "tar", "gz");

    public UploadSettings {
        if (uploadDir == null || backupDir == null) {
            throw new IllegalArgumentException("uploadDir and backupDir must be set");
        }
        if (maxFileSize < 1) {
            throw new IllegalArgumentException("maxFileSize must be >= 1, got " + maxFileSize);
        }
        if (maxConcurrentUploads < 1) {
            throw new IllegalArgumentException("maxConcurrentUploads must be >= 1, got " + maxConcurrentUploads);
        }
        allowedExtensions = allowedExtensions == null
            ? DEFAULT_EXTENSIONS
            : allowedExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    public static UploadSettings defaults(Path uploadDir, Path backupDir) {
        return new UploadSettings(uploadDir, 100L * 1024 * 1024, DEFAULT_EXTENSIONS,
            true, true, backupDir, true, 4);
    }

    public Path recordsDir() {
        return uploadDir.resolve("records");
    }

    public Path archiveDir() {
        return uploadDir.resolve("archive");
    }
}
