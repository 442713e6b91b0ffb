package com.nevis.notebook.model;

/**
 * Already-extracted text of a single page, as supplied by the upload layer.
 */
public record PageText(int pageNumber, String text) {}
