package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Integrity and bookkeeping data gathered while processing an upload.
 */
public record UploadMetadata(
    String checksum,
    @JsonProperty("compression_ratio") Double compressionRatio,
    @JsonProperty("backup_path") Path backupPath,
    List<String> tags,
    String notes
) {
    public UploadMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static UploadMetadata of(String checksum) {
        return new UploadMetadata(checksum, null, null, List.of(), null);
    }

    public UploadMetadata withBackupPath(Path path) {
        return new UploadMetadata(checksum, compressionRatio, path, tags, notes);
    }

    public UploadMetadata withCompressionRatio(double ratio) {
        return new UploadMetadata(checksum, ratio, backupPath, tags, notes);
    }

    public UploadMetadata withTags(List<String> additionalTags) {
        var newTags = new ArrayList<>(tags);
        newTags.addAll(additionalTags);
        return new UploadMetadata(checksum, compressionRatio, backupPath, newTags, notes);
    }
}
