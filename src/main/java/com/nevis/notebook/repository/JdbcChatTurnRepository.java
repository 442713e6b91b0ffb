package com.nevis.notebook.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.SourceReference;
import com.nevis.notebook.model.TurnRole;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcChatTurnRepository implements ChatTurnRepository {

    private static final TypeReference<List<SourceReference>> SOURCE_REFS_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<ChatTurn> turnRowMapper = (rs, rowNum) -> new ChatTurn(
        rs.getObject("id", UUID.class),
        rs.getLong("seq"),
        rs.getObject("session_id", UUID.class),
        TurnRole.valueOf(rs.getString("role")),
        rs.getString("content"),
        readRefs(rs.getString("source_refs")),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public ChatTurn append(UUID sessionId, TurnRole role, String content, List<SourceReference> sourceRefs) {
        return jdbcClient.sql("""
                INSERT INTO chat_turns (session_id, role, content, source_refs)
                VALUES (:sessionId, :role, :content, CAST(:sourceRefs AS jsonb))
                RETURNING *
                """)
            .param("sessionId", sessionId)
            .param("role", role.name())
            .param("content", content)
            .param("sourceRefs", writeRefs(sourceRefs))
            .query(turnRowMapper)
            .single();
    }

    @Override
    public List<ChatTurn> findRecent(UUID sessionId, int limit) {
        return jdbcClient.sql("""
                SELECT * FROM chat_turns
                WHERE session_id = :sessionId
                ORDER BY seq DESC
                LIMIT :limit
                """)
            .param("sessionId", sessionId)
            .param("limit", limit)
            .query(turnRowMapper)
            .list();
    }

    @Override
    public List<ChatTurn> findRecentBefore(UUID sessionId, long beforeSeq, int limit) {
        return jdbcClient.sql("""
                SELECT * FROM chat_turns
                WHERE session_id = :sessionId
                  AND seq < :beforeSeq
                ORDER BY seq DESC
                LIMIT :limit
                """)
            .param("sessionId", sessionId)
            .param("beforeSeq", beforeSeq)
            .param("limit", limit)
            .query(turnRowMapper)
            .list();
    }

    private String writeRefs(List<SourceReference> refs) {
        try {
            return objectMapper.writeValueAsString(refs == null ? List.of() : refs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize source references", e);
        }
    }

    private List<SourceReference> readRefs(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, SOURCE_REFS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read source references", e);
        }
    }
}
