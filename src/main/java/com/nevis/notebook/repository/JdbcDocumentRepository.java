package com.nevis.notebook.repository;

import com.nevis.notebook.exception.EntityNotFoundException;
import com.nevis.notebook.model.PageText;
import com.nevis.notebook.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<SourceDocument> documentRowMapper = (rs, rowNum) -> new SourceDocument(
        rs.getObject("id", UUID.class),
        rs.getObject("owner_id", UUID.class),
        rs.getString("title"),
        rs.getString("formatted_text"),
        rs.getString("summary"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public SourceDocument save(UUID ownerId, String title) {
        return jdbcClient.sql("""
                INSERT INTO documents (owner_id, title)
                VALUES (:ownerId, :title)
                RETURNING *
                """)
            .param("ownerId", ownerId)
            .param("title", title)
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<SourceDocument> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public void savePages(UUID documentId, List<PageText> pages) {
        if (pages == null || pages.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO document_pages (document_id, page_number, text)
            VALUES (?, ?, ?)
            ON CONFLICT (document_id, page_number) DO UPDATE SET text = EXCLUDED.text
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                PageText page = pages.get(i);
                ps.setObject(1, documentId);
                ps.setInt(2, page.pageNumber());
                ps.setString(3, page.text());
            }

            @Override
            public int getBatchSize() {
                return pages.size();
            }
        });
    }

    @Override
    public List<PageText> findPages(UUID documentId) {
        return jdbcClient.sql("""
                SELECT page_number, text
                FROM document_pages
                WHERE document_id = :documentId
                ORDER BY page_number ASC
                """)
            .param("documentId", documentId)
            .query((rs, rowNum) -> new PageText(rs.getInt("page_number"), rs.getString("text")))
            .list();
    }

    @Override
    public boolean hasPages(UUID documentId) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM document_pages WHERE document_id = :documentId)")
            .param("documentId", documentId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public void deletePages(UUID documentId) {
        jdbcClient.sql("DELETE FROM document_pages WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }

    @Override
    public Set<UUID> findIdsByOwner(UUID ownerId) {
        return new HashSet<>(jdbcClient.sql("SELECT id FROM documents WHERE owner_id = :ownerId")
            .param("ownerId", ownerId)
            .query(UUID.class)
            .list());
    }

    @Override
    public int countOwnedBy(UUID ownerId, Collection<UUID> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return 0;
        }

        return jdbcClient.sql("""
                SELECT COUNT(*)
                FROM documents
                WHERE owner_id = :ownerId
                  AND id IN (:ids)
                """)
            .param("ownerId", ownerId)
            .param("ids", documentIds)
            .query(Integer.class)
            .single();
    }

    @Override
    public void updateDerivedText(UUID id, String formattedText, String summary) {
        String sql = """
            UPDATE documents
            SET formatted_text = :formattedText,
                summary = :summary,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("formattedText", formattedText)
            .param("summary", summary)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Document", id);
        }
    }
}
