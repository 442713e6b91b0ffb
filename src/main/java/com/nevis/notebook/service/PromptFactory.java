package com.nevis.notebook.service;

import com.nevis.notebook.model.AssembledContext;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.TurnRole;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PromptFactory {

    static final String FREE_SYSTEM_PROMPT = """
        You are a helpful and knowledgeable assistant.
        Answer the user's questions clearly and politely.
        Keep the conversation consistent with what was said before.
        """;

    static final String NO_CONTEXT_SYSTEM_PROMPT = """
        You are an assistant that answers from the user's documents.
        No document excerpt matched this question, so say that you do not know
        instead of guessing. Keep the conversation consistent with what was said before.
        """;

    static final String GROUNDED_SYSTEM_PROMPT = """
        You are an assistant that answers strictly from the provided document excerpts.
        Rules:
        1. Base the answer on the excerpts only.
        2. If the excerpts do not contain the answer, say that you do not know instead of guessing.
        3. Keep the answer consistent with the earlier conversation.
        4. Mention the source title and page when you rely on an excerpt.
        """;

    private static final String GROUNDED_USER_TEMPLATE = """
        Below are the excerpts from the documents that are relevant to the question.
        Answer the question using these excerpts and the conversation so far.

        [Excerpts]
        %s

        [Question]
        %s
        """;

    private static final String SUMMARY_PROMPT_TEMPLATE = """
        Role: Document analyst.
        Task: Summarize the document below in 3-5 sentences.
        Focus: What kind of document it is, its main topics, and its key conclusions.
        Output: Only the summary.

        Document Content:
        %s
        """;

    public List<ChatMessage> freeGeneration(List<ChatTurn> history, String question) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(FREE_SYSTEM_PROMPT));
        appendHistory(messages, history);
        messages.add(UserMessage.from(question));
        return messages;
    }

    public List<ChatMessage> noContextGeneration(List<ChatTurn> history, String question) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(NO_CONTEXT_SYSTEM_PROMPT));
        appendHistory(messages, history);
        messages.add(UserMessage.from(question));
        return messages;
    }

    public List<ChatMessage> groundedGeneration(List<ChatTurn> history, AssembledContext context, String question) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(GROUNDED_SYSTEM_PROMPT));
        appendHistory(messages, history);
        messages.add(UserMessage.from(String.format(GROUNDED_USER_TEMPLATE, context.text(), question)));
        return messages;
    }

    public List<ChatMessage> summary(String text) {
        return List.of(UserMessage.from(String.format(SUMMARY_PROMPT_TEMPLATE, text)));
    }

    private static void appendHistory(List<ChatMessage> messages, List<ChatTurn> history) {
        for (ChatTurn turn : history) {
            if (turn.content() == null || turn.content().isBlank()) {
                continue;
            }
            messages.add(turn.role() == TurnRole.USER
                ? UserMessage.from(turn.content())
                : AiMessage.from(turn.content()));
        }
    }
}
