package com.boardrag.pipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
    @NotBlank String endpoint,
    String publicEndpoint,
    @NotBlank String region,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    boolean pathStyleAccess,
    boolean createBucket,
    @NotNull Duration presignTtl,
    @NotNull DataSize streamBufferSize,
    @NotNull @Valid Retry retry
) {

    public record Retry(
        @Min(1) @Max(10) int maxAttempts,
        @NotNull Duration backoff
    ) {}
}
