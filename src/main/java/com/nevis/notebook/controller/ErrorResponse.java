package com.nevis.notebook.controller;

public record ErrorResponse(
    String message,
    String code,
    int status,
    long timestamp
) {}
