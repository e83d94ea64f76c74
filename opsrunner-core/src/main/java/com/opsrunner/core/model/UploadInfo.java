package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Record of one file processed by the upload pipeline.
 * Persisted as {@code <upload_dir>/records/<id>.json}.
 */
public record UploadInfo(
    UUID id,
    String filename,
    @JsonProperty("original_path") Path originalPath,
    @JsonProperty("processed_path") Path processedPath,
    @JsonProperty("file_size") long fileSize,
    @JsonProperty("mime_type") String mimeType,
    @JsonProperty("upload_timestamp") Instant uploadTimestamp,
    @JsonProperty("processing_status") ProcessingStatus processingStatus,
    UploadMetadata metadata
) {
    public UploadInfo withProcessedPath(Path path) {
        return new UploadInfo(id, filename, originalPath, path, fileSize, mimeType,
            uploadTimestamp, processingStatus, metadata);
    }

    public UploadInfo withStatus(ProcessingStatus status) {
        return new UploadInfo(id, filename, originalPath, processedPath, fileSize, mimeType,
            uploadTimestamp, status, metadata);
    }

    public UploadInfo withMetadata(UploadMetadata newMetadata) {
        return new UploadInfo(id, filename, originalPath, processedPath, fileSize, mimeType,
            uploadTimestamp, processingStatus, newMetadata);
    }
}
