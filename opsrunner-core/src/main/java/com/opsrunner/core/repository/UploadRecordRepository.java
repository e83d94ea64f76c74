package com.opsrunner.core.repository;

import com.opsrunner.core.model.UploadInfo;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for upload records.
 */
public interface UploadRecordRepository {

    void save(UploadInfo upload);

    Optional<UploadInfo> findById(UUID uploadId);

    List<UploadInfo> findAll();

    /**
     * Delete an upload record.
     *
     * @return true if a record existed
     */
    boolean delete(UUID uploadId);
}
