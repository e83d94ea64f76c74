package com.opsrunner.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsrunner.core.exception.RecordStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Directory of pretty-printed JSON records, one file per record named {@code <key>.json}.
 * Writes go to a temporary file first and are moved into place.
 */
class JsonRecordStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Class<T> type;

    JsonRecordStore(Path directory, ObjectMapper mapper, Class<T> type) {
        this.directory = directory;
        this.mapper = mapper;
        this.type = type;
    }

    Path pathFor(String key) {
        return directory.resolve(key + SUFFIX);
    }

    void write(String key, T value) {
        Path target = pathFor(key);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, key, ".tmp");
            try {
                mapper.writeValue(temp.toFile(), value);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new RecordStorageException("Failed to write record " + target, e);
        }
    }

    Optional<T> read(String key) {
        Path path = pathFor(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new RecordStorageException("Failed to read record " + path, e);
        }
    }

    /**
     * Every readable record, in file name order. Unreadable files are logged and skipped.
     */
    List<T> readAll() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<T> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).sorted().toList()) {
                try {
                    records.add(mapper.readValue(path.toFile(), type));
                } catch (IOException e) {
                    log.warn("Skipping unreadable record {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new RecordStorageException("Failed to list records in " + directory, e);
        }
        return records;
    }

    boolean delete(String key) {
        try {
            return Files.deleteIfExists(pathFor(key));
        } catch (IOException e) {
            throw new RecordStorageException("Failed to delete record " + pathFor(key), e);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
