package com.nevis.notebook.model;

public record DocumentSubmission(SourceDocument document, ProcessingJob job) {}
