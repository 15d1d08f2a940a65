package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.exception.DocumentFileNotFoundException;
import com.boardrag.pipeline.exception.IllegalStatusTransitionException;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileProcessingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentFileRepository implements DocumentFileRepository {

    private final JdbcClient jdbcClient;

    private final JsonColumns jsonColumns;

    private final RowMapper<DocumentFile> fileRowMapper = (rs, rowNum) -> new DocumentFile(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getString("storage_key"),
        rs.getString("original_filename"),
        rs.getString("file_type"),
        rs.getLong("file_size"),
        rs.getString("content_type"),
        FileProcessingStatus.valueOf(rs.getString("processing_status")),
        JdbcDocumentFileRepository.this.jsonColumns.read(rs.getString("metadata")),
        rs.getString("error_message"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public DocumentFile save(DocumentFile file) {
        FileProcessingStatus status = file.processingStatus() != null ? file.processingStatus() : FileProcessingStatus.PENDING;

        return jdbcClient.sql("""
                INSERT INTO document_files
                    (document_id, storage_key, original_filename, file_type, file_size, content_type, processing_status, metadata)
                VALUES (:documentId, :storageKey, :originalFilename, :fileType, :fileSize, :contentType, :status, :metadata::jsonb)
                RETURNING *
                """)
            .param("documentId", file.documentId())
            .param("storageKey", file.storageKey())
            .param("originalFilename", file.originalFilename())
            .param("fileType", file.fileType())
            .param("fileSize", file.fileSize())
            .param("contentType", file.contentType())
            .param("status", status.name())
            .param("metadata", jsonColumns.write(file.metadata()))
            .query(fileRowMapper)
            .single();
    }

    @Override
    public Optional<DocumentFile> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM document_files WHERE id = :id")
            .param("id", id)
            .query(fileRowMapper)
            .optional();
    }

    @Override
    public List<DocumentFile> findByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT * FROM document_files WHERE document_id = :documentId ORDER BY created_at, id")
            .param("documentId", documentId)
            .query(fileRowMapper)
            .list();
    }

    @Override
    public List<DocumentFile> findByDocumentIdAndStatus(UUID documentId, FileProcessingStatus status) {
        String sql = """
            SELECT * FROM document_files
            WHERE document_id = :documentId
              AND processing_status = :status
            ORDER BY created_at, id
            """;

        return jdbcClient.sql(sql)
            .param("documentId", documentId)
            .param("status", status.name())
            .query(fileRowMapper)
            .list();
    }

    @Override
    public int countByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM document_files WHERE document_id = :documentId")
            .param("documentId", documentId)
            .query(Integer.class)
            .single();
    }

    /**
     * Moves the row to {@code target} only when its current status is a legal predecessor. The guard
     * sits in the WHERE clause so concurrent writers cannot skip a state.
     */
    @Override
    public DocumentFile transition(UUID id, FileProcessingStatus target, String errorMessage,
                                   Map<String, Object> metadataPatch) {
        Set<FileProcessingStatus> allowed = FileProcessingStatus.predecessorsOf(target);
        List<String> allowedNames = allowed.stream().map(Enum::name).toList();

        String sql = """
            UPDATE document_files
            SET processing_status = :target,
                error_message = :error,
                metadata = metadata || :patch::jsonb,
                updated_at = NOW()
            WHERE id = :id
              AND processing_status IN (:allowed)
            RETURNING *
            """;

        Optional<DocumentFile> updated = jdbcClient.sql(sql)
            .param("target", target.name())
            .param("error", errorMessage)
            .param("patch", jsonColumns.write(metadataPatch))
            .param("id", id)
            .param("allowed", allowedNames)
            .query(fileRowMapper)
            .optional();

        return updated.orElseThrow(() -> {
            DocumentFile current = findById(id).orElseThrow(() -> new DocumentFileNotFoundException(id));
            return new IllegalStatusTransitionException(id, current.processingStatus(), target);
        });
    }

    @Override
    public void mergeMetadata(UUID id, Map<String, Object> metadataPatch) {
        String sql = """
            UPDATE document_files
            SET metadata = metadata || :patch::jsonb,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("patch", jsonColumns.write(metadataPatch))
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentFileNotFoundException(id);
        }
    }

    @Override
    public void deleteById(UUID id) {
        int rowsAffected = jdbcClient.sql("DELETE FROM document_files WHERE id = :id")
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentFileNotFoundException(id);
        }
    }

    @Override
    public Map<FileProcessingStatus, Long> countByStatus() {
        Map<FileProcessingStatus, Long> counts = new EnumMap<>(FileProcessingStatus.class);
        for (FileProcessingStatus status : FileProcessingStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcClient.sql("SELECT processing_status, COUNT(*) AS total FROM document_files GROUP BY processing_status")
            .query((rs, rowNum) -> Map.entry(FileProcessingStatus.valueOf(rs.getString("processing_status")), rs.getLong("total")))
            .list()
            .forEach(entry -> counts.put(entry.getKey(), entry.getValue()));
        return counts;
    }
}
