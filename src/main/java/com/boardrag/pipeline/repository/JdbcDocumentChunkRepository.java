package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.DocumentChunk;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentChunkRepository implements DocumentChunkRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    private final RowMapper<DocumentChunk> chunkRowMapper = (rs, rowNum) -> new DocumentChunk(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getObject("file_id", UUID.class),
        rs.getInt("chunk_index"),
        rs.getString("content"),
        rs.getString("vector_id"),
        rs.getString("embedding_model"),
        rs.getString("embedding_version"),
        JdbcDocumentChunkRepository.this.jsonColumns.read(rs.getString("metadata")),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public void saveAll(List<DocumentChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO document_chunks
                    (document_id, file_id, chunk_index, content, vector_id, embedding_model, embedding_version, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                DocumentChunk chunk = chunks.get(i);
                ps.setObject(1, chunk.documentId());
                if (chunk.fileId() != null) {
                    ps.setObject(2, chunk.fileId());
                } else {
                    ps.setNull(2, Types.OTHER);
                }
                ps.setInt(3, chunk.chunkIndex());
                ps.setString(4, chunk.content());
                ps.setString(5, chunk.vectorId());
                ps.setString(6, chunk.embeddingModel());
                ps.setString(7, chunk.embeddingVersion());
                ps.setString(8, jsonColumns.write(chunk.metadata()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
    }

    @Override
    public List<DocumentChunk> findByDocumentId(UUID documentId) {
        String sql = """
            SELECT * FROM document_chunks
            WHERE document_id = :documentId
            ORDER BY file_id NULLS FIRST, chunk_index
            """;

        return jdbcClient.sql(sql)
            .param("documentId", documentId)
            .query(chunkRowMapper)
            .list();
    }

    @Override
    public List<String> findVectorIdsByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT vector_id FROM document_chunks WHERE document_id = :documentId AND vector_id IS NOT NULL")
            .param("documentId", documentId)
            .query(String.class)
            .list();
    }

    @Override
    public List<String> findVectorIdsByFileId(UUID fileId) {
        return jdbcClient.sql("SELECT vector_id FROM document_chunks WHERE file_id = :fileId AND vector_id IS NOT NULL")
            .param("fileId", fileId)
            .query(String.class)
            .list();
    }

    @Override
    public List<String> findSummaryVectorIds(UUID documentId) {
        String sql = """
            SELECT vector_id FROM document_chunks
            WHERE document_id = :documentId
              AND file_id IS NULL
              AND vector_id IS NOT NULL
            """;

        return jdbcClient.sql(sql)
            .param("documentId", documentId)
            .query(String.class)
            .list();
    }

    @Override
    public int deleteByDocumentId(UUID documentId) {
        return jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }

    @Override
    public int deleteByFileId(UUID fileId) {
        return jdbcClient.sql("DELETE FROM document_chunks WHERE file_id = :fileId")
            .param("fileId", fileId)
            .update();
    }

    @Override
    public int deleteSummaryChunks(UUID documentId) {
        return jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :documentId AND file_id IS NULL")
            .param("documentId", documentId)
            .update();
    }

    @Override
    public long countAll() {
        return jdbcClient.sql("SELECT COUNT(*) FROM document_chunks")
            .query(Long.class)
            .single();
    }
}
