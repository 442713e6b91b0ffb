package com.nevis.notebook.service;

public interface TokenStreamListener {

    void onToken(String token);

    void onComplete(String fullText);

    void onError(Throwable error);
}
