package com.nevis.notebook.service;

import com.nevis.notebook.model.BackendHealth;
import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * Uniform entry point to a text-generation backend, blocking or streaming.
 * Never returns an empty answer in place of a failure.
 */
public interface GenerationClient {

    String chat(List<ChatMessage> messages, double temperature, int maxTokens);

    /**
     * Starts a streamed answer. The listener gets tokens as they arrive and then
     * exactly one terminal call, unless the returned subscription is cancelled
     * first, after which nothing more is delivered.
     */
    StreamSubscription chatStream(
        List<ChatMessage> messages,
        double temperature,
        int maxTokens,
        TokenStreamListener listener
    );

    BackendHealth healthCheck();
}
