package com.opsrunner.engine.upload;

import com.opsrunner.core.exception.NotFoundException;
import com.opsrunner.core.exception.UploadException;
import com.opsrunner.core.model.ProcessingStatus;
import com.opsrunner.core.model.UploadInfo;
import com.opsrunner.core.model.UploadMetadata;
import com.opsrunner.core.repository.UploadRecordRepository;
import com.opsrunner.engine.config.UploadSettings;
import com.opsrunner.engine.service.UploadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.GZIPOutputStream;

/**
 * Standard procedure for an uploaded file: validate, back up, store,
 * compress, tag, archive when stale, then write the upload record.
 */
public class FileUploadPipeline implements UploadService {

    private static final Logger log = LoggerFactory.getLogger(FileUploadPipeline.class);

    static final long LARGE_FILE_BYTES = 10L * 1024 * 1024;
    static final Duration ARCHIVE_AGE = Duration.ofDays(30);

    private static final DateTimeFormatter BACKUP_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DAY_STAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    private static final Map<String, String> MIME_TYPES = Map.of(
        "txt", "text/plain",
        "pdf", "application/pdf",
        "doc", "application/msword",
        "docx", "application/msword",
        "zip", "application/zip",
        "tar", "application/x-tar",
        "gz", "application/gzip",
        "json", "application/json",
        "yaml", "application/x-yaml",
        "yml", "application/x-yaml"
    );

    private final UploadSettings settings;
    private final UploadRecordRepository recordRepository;
    private final Clock clock;

    public FileUploadPipeline(UploadSettings settings, UploadRecordRepository recordRepository, Clock clock) {
        this.settings = settings;
        this.recordRepository = recordRepository;
        this.clock = clock;
    }

    @Override
    public UploadInfo process(Path source) {
        UUID uploadId = UUID.randomUUID();
        log.info("Processing upload {}: {}", uploadId, source);

        validate(source);
        UploadInfo upload = describe(uploadId, source);

        try {
            upload = upload.withStatus(ProcessingStatus.PROCESSING);
            if (settings.backupEnabled()) {
                upload = backup(upload);
            }
            upload = store(upload);
            if (settings.compressionEnabled()) {
                upload = compress(upload);
            }
            upload = tag(upload);
            upload = archiveIfStale(upload.withStatus(ProcessingStatus.COMPLETED));
        } catch (IOException e) {
            throw new UploadException(UploadException.PROCESSING_FAILED,
                "Failed to process upload " + source + ": " + e.getMessage(), e);
        }

        recordRepository.save(upload);
        log.info("Upload {} processed: {} ({})", uploadId, upload.processedPath(), upload.processingStatus());
        return upload;
    }

    @Override
    public List<UploadInfo> listUploads() {
        return recordRepository.findAll();
    }

    @Override
    public Optional<UploadInfo> getUpload(UUID uploadId) {
        return recordRepository.findById(uploadId);
    }

    @Override
    public void deleteUpload(UUID uploadId) {
        UploadInfo upload = recordRepository.findById(uploadId)
            .orElseThrow(() -> new NotFoundException("Upload", uploadId.toString()));
        try {
            Files.deleteIfExists(upload.processedPath());
            if (upload.metadata().backupPath() != null) {
                Files.deleteIfExists(upload.metadata().backupPath());
            }
        } catch (IOException e) {
            throw new UploadException(UploadException.PROCESSING_FAILED,
                "Failed to delete files of upload " + uploadId + ": " + e.getMessage(), e);
        }
        recordRepository.delete(uploadId);
        log.info("Upload {} deleted", uploadId);
    }

    // ========== Validation ==========

    void validate(Path source) {
        if (!Files.isRegularFile(source)) {
            throw UploadException.validation("Upload path does not exist or is not a file: " + source);
        }
        long size = sizeOf(source);
        if (size > settings.maxFileSize()) {
            throw UploadException.validation(String.format(
                "File size %d exceeds maximum allowed size %d", size, settings.maxFileSize()));
        }
        extensionOf(source).ifPresent(ext -> {
            if (!settings.allowedExtensions().contains(ext)) {
                throw UploadException.validation("File extension '" + ext + "' is not allowed");
            }
        });
        if (!Files.isReadable(source)) {
            throw UploadException.validation("File is not readable: " + source);
        }
        log.debug("Upload validation passed for {}", source);
    }

    private UploadInfo describe(UUID uploadId, Path source) {
        String filename = source.getFileName().toString();
        return new UploadInfo(
            uploadId,
            filename,
            source,
            settings.uploadDir().resolve(filename),
            sizeOf(source),
            mimeTypeOf(source),
            clock.instant(),
            ProcessingStatus.PENDING,
            UploadMetadata.of(checksumOf(source))
        );
    }

    // ========== Processing steps ==========

    private UploadInfo backup(UploadInfo upload) throws IOException {
        Files.createDirectories(settings.backupDir());
        Path backupPath = settings.backupDir().resolve(
            upload.id() + "_" + BACKUP_STAMP.format(upload.uploadTimestamp()) + ".bak");
        Files.copy(upload.originalPath(), backupPath, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Backup created: {}", backupPath);
        return upload.withMetadata(upload.metadata().withBackupPath(backupPath));
    }

    private UploadInfo store(UploadInfo upload) throws IOException {
        Files.createDirectories(settings.uploadDir());
        Files.copy(upload.originalPath(), upload.processedPath(), StandardCopyOption.REPLACE_EXISTING);
        log.debug("Copied to {}", upload.processedPath());
        return upload;
    }

    private UploadInfo compress(UploadInfo upload) throws IOException {
        Path stored = upload.processedPath();
        Path compressed = stored.resolveSibling(stored.getFileName() + ".gz");
        try (InputStream in = Files.newInputStream(stored);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(compressed))) {
            in.transferTo(out);
        }
        Files.delete(stored);

        long compressedSize = Files.size(compressed);
        double ratio = compressedSize == 0 ? 0.0 : (double) upload.fileSize() / compressedSize;
        log.debug("Compressed {} with ratio {}", compressed, String.format(Locale.ROOT, "%.2f", ratio));
        return upload.withProcessedPath(compressed)
            .withMetadata(upload.metadata().withCompressionRatio(ratio));
    }

    private UploadInfo tag(UploadInfo upload) {
        List<String> tags = new ArrayList<>();
        extensionOf(upload.processedPath()).ifPresent(ext -> tags.add("ext:" + ext));
        if (upload.fileSize() > LARGE_FILE_BYTES) {
            tags.add("large_file");
        }
        tags.add("uploaded:" + DAY_STAMP.format(upload.uploadTimestamp()));
        return upload.withMetadata(upload.metadata().withTags(tags));
    }

    private UploadInfo archiveIfStale(UploadInfo upload) throws IOException {
        Instant threshold = clock.instant().minus(ARCHIVE_AGE);
        if (!upload.uploadTimestamp().isBefore(threshold)) {
            return upload;
        }
        Files.createDirectories(settings.archiveDir());
        Path archived = settings.archiveDir().resolve(upload.processedPath().getFileName());
        Files.move(upload.processedPath(), archived, StandardCopyOption.REPLACE_EXISTING);
        log.info("Upload {} archived to {}", upload.id(), archived);
        return upload.withProcessedPath(archived).withStatus(ProcessingStatus.ARCHIVED);
    }

    // ========== Helpers ==========

    static Optional<String> extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    static String mimeTypeOf(Path path) {
        return extensionOf(path).map(ext -> MIME_TYPES.getOrDefault(ext, DEFAULT_MIME_TYPE))
            .orElse(DEFAULT_MIME_TYPE);
    }

    static String checksumOf(Path path) {
        try (DigestInputStream in = new DigestInputStream(
                Files.newInputStream(path), MessageDigest.getInstance("SHA-256"))) {
            in.transferTo(OutputStream.nullOutputStream());
            return HexFormat.of().formatHex(in.getMessageDigest().digest());
        } catch (IOException e) {
            throw new UploadException(UploadException.PROCESSING_FAILED,
                "Failed to checksum " + path + ": " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw UploadException.validation("Cannot read size of " + path + ": " + e.getMessage());
        }
    }
}
