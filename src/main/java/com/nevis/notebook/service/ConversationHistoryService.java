package com.nevis.notebook.service;

import com.nevis.notebook.config.HistoryProperties;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.repository.ChatTurnRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Bounded view of a conversation for prompting: at most {@code maxTurns} turns
 * and {@code maxChars} characters, newest kept first, returned oldest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService {

    static final String ELLIPSIS = "...";

    private final ChatTurnRepository turnRepository;
    private final HistoryProperties properties;

    public List<ChatTurn> history(UUID sessionId) {
        if (properties.maxTurns() == 0) {
            return List.of();
        }
        return window(turnRepository.findRecent(sessionId, properties.maxTurns()));
    }

    /**
     * History as it was right before the turn with sequence {@code beforeSeq}.
     */
    public List<ChatTurn> historyBefore(UUID sessionId, long beforeSeq) {
        if (properties.maxTurns() == 0) {
            return List.of();
        }
        return window(turnRepository.findRecentBefore(sessionId, beforeSeq, properties.maxTurns()));
    }

    List<ChatTurn> window(List<ChatTurn> newestFirst) {
        List<ChatTurn> selected = new ArrayList<>();
        int remaining = properties.maxChars();

        for (ChatTurn turn : newestFirst) {
            if (selected.size() >= properties.maxTurns()) {
                break;
            }

            String content = turn.content() == null ? "" : turn.content();
            if (content.length() <= remaining) {
                selected.add(turn);
                remaining -= content.length();
                continue;
            }

            if (remaining > properties.minTruncationBudget() && remaining > ELLIPSIS.length()) {
                String truncated = content.substring(0, remaining - ELLIPSIS.length()) + ELLIPSIS;
                selected.add(turn.withContent(truncated));
            }
            break;
        }

        Collections.reverse(selected);
        log.debug("History window: {} turns, {} chars left", selected.size(), remaining);
        return selected;
    }
}
