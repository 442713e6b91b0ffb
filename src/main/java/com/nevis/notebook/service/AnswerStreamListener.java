package com.nevis.notebook.service;

import com.nevis.notebook.model.ChatAnswer;

public interface AnswerStreamListener {

    void onToken(String token);

    /**
     * Called once the assistant turn is persisted.
     */
    void onComplete(ChatAnswer answer);

    void onError(Throwable error);
}
