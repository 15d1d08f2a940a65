package com.boardrag.pipeline.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.tasks")
public record TaskProperties(
    @Min(1) @Max(64) int workerPoolSize,
    @Min(1) int maxAttempts,
    @NotNull Duration retryBackoff,
    @NotNull Duration staleAfter,
    @Min(1) int uploadAttempts,
    @NotNull Duration uploadRetryDelay,
    @Min(1) int verifyAttempts,
    @NotNull Duration verifyDelay
) {}
