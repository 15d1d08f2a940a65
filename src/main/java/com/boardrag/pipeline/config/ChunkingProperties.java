package com.boardrag.pipeline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @Min(1) int chunkSize,
    @Min(0) int overlap,
    @Min(1) int summaryBudget,
    @NotBlank String embeddingModel,
    @NotBlank String embeddingVersion
) {

    @AssertTrue(message = "app.chunking.overlap must be smaller than app.chunking.chunk-size")
    public boolean isWindowAdvancing() {
        return overlap < chunkSize;
    }
}
