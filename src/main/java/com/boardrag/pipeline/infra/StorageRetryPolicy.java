package com.boardrag.pipeline.infra;

import com.boardrag.pipeline.exception.StorageException;
import org.springframework.retry.support.RetryTemplate;
import software.amazon.awssdk.core.exception.SdkException;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * Single retry shape for every object store interaction: a bounded number of attempts with a fixed
 * pause, retrying storage and SDK failures only.
 */
public final class StorageRetryPolicy {

    private StorageRetryPolicy() {
    }

    public static RetryTemplate create(int maxAttempts, Duration backoff) {
        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .fixedBackoff(Math.max(1L, backoff.toMillis()))
            .retryOn(List.of(StorageException.class, SdkException.class, UncheckedIOException.class))
            .traversingCauses()
            .build();
    }
}
