package com.opsrunner.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsrunner.core.model.UploadInfo;
import com.opsrunner.core.repository.UploadRecordRepository;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores upload records as {@code <records_dir>/<upload_id>.json}.
 */
public class FileUploadRecordRepository implements UploadRecordRepository {

    private final JsonRecordStore<UploadInfo> store;

    public FileUploadRecordRepository(Path recordsDir, ObjectMapper mapper) {
        this.store = new JsonRecordStore<>(recordsDir, mapper, UploadInfo.class);
    }

    @Override
    public void save(UploadInfo upload) {
        store.write(upload.id().toString(), upload);
    }

    @Override
    public Optional<UploadInfo> findById(UUID uploadId) {
        return store.read(uploadId.toString());
    }

    @Override
    public List<UploadInfo> findAll() {
        return store.readAll().stream()
            .sorted(Comparator.comparing(UploadInfo::uploadTimestamp))
            .toList();
    }

    @Override
    public boolean delete(UUID uploadId) {
        return store.delete(uploadId.toString());
    }
}
