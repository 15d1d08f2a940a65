package com.boardrag.pipeline.infra;

import com.boardrag.pipeline.config.UploadProperties;
import com.boardrag.pipeline.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local directory shared by request handlers and task workers. Files are named after their storage
 * key, never after user input.
 */
@Slf4j
@Component
public class StagingArea {

    private final Path root;

    public StagingArea(UploadProperties properties) {
        this(Path.of(properties.stagingDir()));
    }

    StagingArea(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path stage(String storageKey, InputStreamSource source) {
        Path target = resolve(storageKey);
        try (InputStream in = source.getInputStream()) {
            Files.createDirectories(root);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Staged {} at {}", storageKey, target);
            return target;
        } catch (IOException e) {
            throw new StorageException(storageKey, "Failed to stage upload " + storageKey + ": " + e.getMessage(), e);
        }
    }

    public Path resolve(String storageKey) {
        Path target = root.resolve(storageKey).normalize();
        if (!target.getParent().equals(root)) {
            throw new IllegalArgumentException("Storage key escapes staging area: " + storageKey);
        }
        return target;
    }

    public void discard(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(staged)) {
                log.debug("Removed staged file {}", staged);
            }
        } catch (IOException e) {
            log.warn("Could not remove staged file {}: {}", staged, e.getMessage());
        }
    }
}
