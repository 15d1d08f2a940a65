package com.boardrag.pipeline.service;

import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.exception.IntegrityMismatchException;
import com.boardrag.pipeline.exception.ObjectNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.infra.ObjectStat;
import com.boardrag.pipeline.infra.ObjectStore;
import com.boardrag.pipeline.infra.StorageRetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Uploads a local file and confirms the stored object has the same size. Both steps retry; a size
 * that still differs after the last verification attempt surfaces as
 * {@link IntegrityMismatchException}.
 */
@Slf4j
@Component
public class VerifiedUploader {

    private final ObjectStore objectStore;
    private final RetryTemplate uploadRetry;
    private final RetryTemplate verifyRetry;

    public VerifiedUploader(ObjectStore objectStore, TaskProperties properties) {
        this.objectStore = objectStore;
        this.uploadRetry = StorageRetryPolicy.create(properties.uploadAttempts(), properties.uploadRetryDelay());
        this.verifyRetry = StorageRetryPolicy.create(properties.verifyAttempts(), properties.verifyDelay());
    }

    public static String contentTypeFor(String filename) {
        return MediaTypeFactory.getMediaType(filename)
            .map(MediaType::toString)
            .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    public UploadReceipt upload(String storageKey, Path source, String contentType) {
        long expectedSize = sizeOf(storageKey, source);

        int uploadAttempts = uploadRetry.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying upload of {} (attempt {})", storageKey, context.getRetryCount() + 1);
            }
            objectStore.put(storageKey, source, contentType);
            return context.getRetryCount() + 1;
        });

        int validationAttempts = verifyRetry.execute(context -> {
            ObjectStat stat = objectStore.stat(storageKey)
                .orElseThrow(() -> new ObjectNotFoundException(storageKey));
            if (stat.size() != expectedSize) {
                throw new IntegrityMismatchException(storageKey, expectedSize, stat.size());
            }
            return context.getRetryCount() + 1;
        });

        log.debug("Uploaded {} ({} bytes) after {} attempt(s), verified after {}",
            storageKey, expectedSize, uploadAttempts, validationAttempts);
        return new UploadReceipt(storageKey, expectedSize, contentType, uploadAttempts, validationAttempts);
    }

    private static long sizeOf(String storageKey, Path source) {
        try {
            return Files.size(source);
        } catch (IOException e) {
            throw new StorageException(storageKey, "Cannot read staged file " + source + ": " + e.getMessage(), e);
        }
    }
}
