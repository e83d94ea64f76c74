package com.opsrunner.engine.service;

import com.opsrunner.core.model.UploadInfo;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for processing uploaded files.
 */
public interface UploadService {

    /**
     * Validate, back up, store and optionally compress a file, then record it.
     *
     * @param source File to process
     * @return The saved upload record
     * @throws com.opsrunner.core.exception.UploadException if validation or processing fails
     */
    UploadInfo process(Path source);

    List<UploadInfo> listUploads();

    Optional<UploadInfo> getUpload(UUID uploadId);

    /**
     * Delete an upload's stored file, its backup and its record.
     *
     * @throws com.opsrunner.core.exception.NotFoundException if no record exists
     */
    void deleteUpload(UUID uploadId);
}
