package com.nevis.notebook.repository;

import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.SourceReference;
import com.nevis.notebook.model.TurnRole;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of conversation turns. There is no update or delete.
 */
public interface ChatTurnRepository {

    ChatTurn append(UUID sessionId, TurnRole role, String content, List<SourceReference> sourceRefs);

    /**
     * Newest turns of the session first, at most {@code limit}.
     */
    List<ChatTurn> findRecent(UUID sessionId, int limit);

    /**
     * Like {@link #findRecent} but only turns created before {@code beforeSeq}.
     */
    List<ChatTurn> findRecentBefore(UUID sessionId, long beforeSeq, int limit);
}
