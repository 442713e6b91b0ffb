package com.nevis.notebook.service;

public interface SummaryGeneratorService {

    /**
     * Summary of the head of {@code text}, or {@code null} when there is nothing to summarize.
     */
    String summarize(String text);
}
