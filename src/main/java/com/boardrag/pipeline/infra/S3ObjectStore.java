package com.boardrag.pipeline.infra;

import com.boardrag.pipeline.config.StorageProperties;
import com.boardrag.pipeline.exception.ObjectNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class S3ObjectStore implements ObjectStore {

    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final RetryTemplate retryTemplate;
    private final PresignedUrlRewriter urlRewriter;
    private final StorageProperties properties;

    public S3ObjectStore(S3Client s3Client,
                         S3Presigner s3Presigner,
                         @Qualifier("storageRetryTemplate") RetryTemplate retryTemplate,
                         PresignedUrlRewriter urlRewriter,
                         StorageProperties properties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.retryTemplate = retryTemplate;
        this.urlRewriter = urlRewriter;
        this.properties = properties;
    }

    @PostConstruct
    void ensureBucketExists() {
        if (!properties.createBucket()) {
            return;
        }
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(properties.bucket()).build());
        } catch (NoSuchBucketException e) {
            log.info("Creating bucket {}", properties.bucket());
            s3Client.createBucket(CreateBucketRequest.builder().bucket(properties.bucket()).build());
        } catch (SdkException e) {
            log.warn("Could not verify bucket {} at startup: {}", properties.bucket(), e.getMessage());
        }
    }

    @Override
    public void put(String key, Path source, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(properties.bucket())
            .key(key)
            .contentType(contentType)
            .build();
        try {
            s3Client.putObject(request, RequestBody.fromFile(source));
            log.debug("Stored object {} ({})", key, contentType);
        } catch (SdkException e) {
            throw new StorageException(key, "Failed to store object " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns empty only after every attempt saw a missing or zero-byte object. Other failures that
     * outlive the retries surface as {@link StorageException}.
     */
    @Override
    public Optional<ObjectStat> stat(String key) {
        try {
            return Optional.of(retryTemplate.execute(context -> headOnce(key)));
        } catch (ObjectNotFoundException e) {
            log.debug("Object {} not visible after retries: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean exists(String key) {
        return stat(key).isPresent();
    }

    @Override
    public ObjectStream streamGet(String key) {
        ObjectStat stat = stat(key).orElseThrow(() -> new ObjectNotFoundException(key));

        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(properties.bucket())
            .key(key)
            .overrideConfiguration(config -> config.putHeader("Accept-Encoding", "identity"))
            .build();
        try {
            ResponseInputStream<GetObjectResponse> content = s3Client.getObject(request);
            String contentType = content.response().contentType() != null
                ? content.response().contentType()
                : stat.contentType();
            return new ObjectStream(content, stat.size(), contentType, bufferSize());
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException(key);
        } catch (SdkException e) {
            throw new StorageException(key, "Failed to read object " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(properties.bucket()).key(key).build());
        } catch (SdkException e) {
            throw new StorageException(key, "Failed to delete object " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public DeleteResult deleteMany(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return DeleteResult.success();
        }

        List<ObjectIdentifier> identifiers = keys.stream()
            .map(key -> ObjectIdentifier.builder().key(key).build())
            .toList();

        DeleteObjectsRequest request = DeleteObjectsRequest.builder()
            .bucket(properties.bucket())
            .delete(Delete.builder().objects(identifiers).quiet(true).build())
            .build();
        try {
            DeleteObjectsResponse response = s3Client.deleteObjects(request);
            List<String> failed = new ArrayList<>();
            for (S3Error error : response.errors()) {
                log.warn("Failed to delete object {}: {}", error.key(), error.message());
                failed.add(error.key());
            }
            return new DeleteResult(failed.isEmpty(), failed);
        } catch (SdkException e) {
            log.warn("Bulk delete of {} objects failed: {}", keys.size(), e.getMessage());
            return new DeleteResult(false, List.copyOf(keys));
        }
    }

    @Override
    public String presignGet(String key, Duration ttl) {
        if (!exists(key)) {
            throw new ObjectNotFoundException(key);
        }

        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
            .signatureDuration(ttl != null ? ttl : properties.presignTtl())
            .getObjectRequest(get -> get.bucket(properties.bucket()).key(key))
            .build();
        try {
            PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(request);
            return urlRewriter.rewrite(presigned.url());
        } catch (SdkException e) {
            throw new StorageException(key, "Failed to presign object " + key + ": " + e.getMessage(), e);
        }
    }

    private ObjectStat headOnce(String key) {
        try {
            HeadObjectResponse response = s3Client.headObject(HeadObjectRequest.builder()
                .bucket(properties.bucket())
                .key(key)
                .build());
            long size = response.contentLength() != null ? response.contentLength() : 0L;
            if (size == 0) {
                throw new ObjectNotFoundException(key, "Object " + key + " reports zero bytes");
            }
            return new ObjectStat(key, size, response.contentType());
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException(key);
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                throw new ObjectNotFoundException(key);
            }
            throw new StorageException(key, "Failed to stat object " + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException(key, "Failed to stat object " + key + ": " + e.getMessage(), e);
        }
    }

    private int bufferSize() {
        return (int) properties.streamBufferSize().toBytes();
    }
}
