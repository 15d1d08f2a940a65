package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;

    private final JsonColumns jsonColumns;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> {
        Array tags = rs.getArray("tags");
        List<String> tagList = tags == null ? List.of() : Arrays.asList((String[]) tags.getArray());

        return new Document(
            rs.getObject("id", UUID.class),
            rs.getString("owner_id"),
            rs.getString("title"),
            rs.getString("summary"),
            tagList,
            DocumentStatus.valueOf(rs.getString("status")),
            rs.getBoolean("is_public"),
            rs.getObject("start_date", OffsetDateTime.class),
            rs.getObject("end_date", OffsetDateTime.class),
            rs.getInt("view_count"),
            rs.getInt("download_count"),
            rs.getBoolean("vectorized"),
            JdbcDocumentRepository.this.jsonColumns.read(rs.getString("metadata")),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    };

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (owner_id, title, summary, tags, status, is_public, start_date, end_date, metadata)
                VALUES (:ownerId, :title, :summary, :tags, :status, :isPublic, :startDate, :endDate, :metadata::jsonb)
                RETURNING *
                """)
            .param("ownerId", document.ownerId())
            .param("title", document.title())
            .param("summary", document.summary())
            .param("tags", document.tags() == null ? new String[0] : document.tags().toArray(String[]::new))
            .param("status", document.status() != null ? document.status().name() : DocumentStatus.PENDING_APPROVAL.name())
            .param("isPublic", document.isPublic())
            .param("startDate", document.startDate())
            .param("endDate", document.endDate())
            .param("metadata", jsonColumns.write(document.metadata()))
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<Document> findAllById(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("SELECT * FROM documents WHERE id IN (:ids)")
            .param("ids", ids)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, Map<String, Object> metadataPatch) {
        String sql = """
            UPDATE documents
            SET status = :status,
                metadata = metadata || :patch::jsonb,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("status", status.name())
            .param("patch", jsonColumns.write(metadataPatch))
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void updateVectorized(UUID id, boolean vectorized, Map<String, Object> metadataPatch) {
        String sql = """
            UPDATE documents
            SET vectorized = :vectorized,
                metadata = metadata || :patch::jsonb,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("vectorized", vectorized)
            .param("patch", jsonColumns.write(metadataPatch))
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void mergeMetadata(UUID id, Map<String, Object> metadataPatch) {
        String sql = """
            UPDATE documents
            SET metadata = metadata || :patch::jsonb,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("patch", jsonColumns.write(metadataPatch))
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public void incrementDownloadCount(UUID id) {
        int rowsAffected = jdbcClient.sql("UPDATE documents SET download_count = download_count + 1 WHERE id = :id")
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new DocumentNotFoundException(id);
        }
    }

    @Override
    public List<Document> findVectorizedOutsideValidity(OffsetDateTime now) {
        String sql = """
            SELECT * FROM documents
            WHERE vectorized = TRUE
              AND ((end_date IS NOT NULL AND end_date < :now)
                OR (start_date IS NOT NULL AND start_date > :now))
            ORDER BY created_at
            """;

        return jdbcClient.sql(sql)
            .param("now", now)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public Map<DocumentStatus, Long> countByStatus() {
        Map<DocumentStatus, Long> counts = new EnumMap<>(DocumentStatus.class);
        for (DocumentStatus status : DocumentStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcClient.sql("SELECT status, COUNT(*) AS total FROM documents GROUP BY status")
            .query((rs, rowNum) -> Map.entry(DocumentStatus.valueOf(rs.getString("status")), rs.getLong("total")))
            .list()
            .forEach(entry -> counts.put(entry.getKey(), entry.getValue()));
        return counts;
    }

    @Override
    public long countVectorized() {
        return jdbcClient.sql("SELECT COUNT(*) FROM documents WHERE vectorized = TRUE")
            .query(Long.class)
            .single();
    }
}
