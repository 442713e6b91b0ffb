package com.nevis.notebook.repository;

import com.nevis.notebook.model.ChatSession;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcChatSessionRepository implements ChatSessionRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<ChatSession> sessionRowMapper = (rs, rowNum) -> new ChatSession(
        rs.getObject("id", UUID.class),
        rs.getObject("owner_id", UUID.class),
        rs.getString("title"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public ChatSession save(UUID ownerId, String title) {
        return jdbcClient.sql("""
                INSERT INTO chat_sessions (owner_id, title)
                VALUES (:ownerId, :title)
                RETURNING *
                """)
            .param("ownerId", ownerId)
            .param("title", title)
            .query(sessionRowMapper)
            .single();
    }

    @Override
    public Optional<ChatSession> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM chat_sessions WHERE id = :id")
            .param("id", id)
            .query(sessionRowMapper)
            .optional();
    }

    @Override
    public void touch(UUID id) {
        jdbcClient.sql("UPDATE chat_sessions SET updated_at = NOW() WHERE id = :id")
            .param("id", id)
            .update();
    }
}
