package com.nevis.notebook.repository;

import com.nevis.notebook.config.RagProperties.DistanceMetric;
import com.nevis.notebook.exception.EntityNotFoundException;
import com.nevis.notebook.model.ChunkDraft;
import com.nevis.notebook.model.DocumentChunk;
import com.nevis.notebook.model.RetrievedChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDocumentChunkRepository implements DocumentChunkRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<DocumentChunk> documentChunkMapper = (rs, rowNum) -> new DocumentChunk(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getInt("chunk_index"),
        rs.getObject("page_number", Integer.class),
        rs.getString("content"),
        rs.getBoolean("embedded"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public void replaceChunks(UUID documentId, List<ChunkDraft> drafts, List<float[]> embeddings) {
        if (embeddings != null && embeddings.size() != drafts.size()) {
            throw new IllegalArgumentException(
                "Got " + embeddings.size() + " embeddings for " + drafts.size() + " chunks");
        }

        List<UUID> locked = jdbcClient.sql("SELECT id FROM documents WHERE id = :id FOR UPDATE")
            .param("id", documentId)
            .query(UUID.class)
            .list();

        if (locked.isEmpty()) {
            throw new EntityNotFoundException("Document", documentId);
        }

        int deleted = jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();

        if (drafts.isEmpty()) {
            log.info("Doc {}: removed {} chunks, nothing to insert", documentId, deleted);
            return;
        }

        String sql = """
            INSERT INTO document_chunks (document_id, chunk_index, page_number, content, embedding)
            VALUES (?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ChunkDraft draft = drafts.get(i);
                ps.setObject(1, documentId);
                ps.setInt(2, draft.chunkIndex());
                if (draft.pageNumber() != null) {
                    ps.setInt(3, draft.pageNumber());
                } else {
                    ps.setNull(3, Types.INTEGER);
                }
                ps.setString(4, draft.content());
                if (embeddings != null) {
                    ps.setObject(5, new PGvector(embeddings.get(i)));
                } else {
                    ps.setNull(5, Types.OTHER);
                }
            }

            @Override
            public int getBatchSize() {
                return drafts.size();
            }
        });

        log.info("Doc {}: replaced {} chunks with {}", documentId, deleted, drafts.size());
    }

    @Override
    public List<DocumentChunk> findByDocumentId(UUID documentId) {
        return jdbcClient.sql("""
                SELECT id, document_id, chunk_index, page_number, content,
                       embedding IS NOT NULL AS embedded, created_at
                FROM document_chunks
                WHERE document_id = :documentId
                ORDER BY chunk_index ASC
                """)
            .param("documentId", documentId)
            .query(documentChunkMapper)
            .list();
    }

    @Override
    public List<RetrievedChunk> findNearest(
        float[] queryVector,
        UUID ownerId,
        Collection<UUID> documentIds,
        int limit,
        DistanceMetric metric
    ) {
        if (documentIds == null || documentIds.isEmpty()) {
            return List.of();
        }

        String distance = "(c.embedding " + metric.operator() + " :vector)";

        String sql = """
            SELECT
                c.id,
                c.document_id,
                c.chunk_index,
                c.page_number,
                c.content,
                d.title,
                1 - %s AS similarity
            FROM document_chunks c
            JOIN documents d ON c.document_id = d.id
            WHERE d.owner_id = :ownerId
              AND c.document_id IN (:documentIds)
              AND c.embedding IS NOT NULL
            ORDER BY %s ASC
            LIMIT :limit
            """.formatted(distance, distance);

        return jdbcClient.sql(sql)
            .param("vector", new PGvector(queryVector))
            .param("ownerId", ownerId)
            .param("documentIds", documentIds)
            .param("limit", limit)
            .query((rs, rowNum) -> new RetrievedChunk(
                rs.getObject("id", UUID.class),
                rs.getObject("document_id", UUID.class),
                rs.getString("title"),
                rs.getInt("chunk_index"),
                rs.getObject("page_number", Integer.class),
                rs.getString("content"),
                rs.getDouble("similarity")
            ))
            .list();
    }
}
