package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.DocumentChunk;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

public record ChunkResponse(
    UUID id,

    @JsonProperty("file_id")
    UUID fileId,

    @JsonProperty("chunk_index")
    int chunkIndex,

    String content,

    @JsonProperty("vector_id")
    String vectorId,

    @JsonProperty("embedding_model")
    String embeddingModel,

    @JsonProperty("embedding_version")
    String embeddingVersion,

    Map<String, Object> metadata
) {

    public static ChunkResponse from(DocumentChunk chunk) {
        return new ChunkResponse(
            chunk.id(),
            chunk.fileId(),
            chunk.chunkIndex(),
            chunk.content(),
            chunk.vectorId(),
            chunk.embeddingModel(),
            chunk.embeddingVersion(),
            chunk.metadata()
        );
    }
}
